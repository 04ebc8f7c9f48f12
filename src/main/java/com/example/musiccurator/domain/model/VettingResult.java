package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.VettingPhase;
import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class VettingResult {

    private VettingSessionEntity session;

    private List<VettedFile> newFiles = new ArrayList<>();

    private List<VettedFile> duplicates = new ArrayList<>();

    private List<VettedFile> uncertain = new ArrayList<>();

    private List<FileError> errors = new ArrayList<>();

    private List<String> exportedFiles = new ArrayList<>();

    private List<String> exportFailures = new ArrayList<>();

    /**
     * Last phase reached; DONE unless the run was cancelled.
     */
    private VettingPhase phase = VettingPhase.IDLE;

    private boolean cancelled;

    private long durationMs;

    public int getErrorCount() {
        return errors.size();
    }
}
