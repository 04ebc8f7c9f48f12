package com.example.musiccurator.api.request;

import com.example.musiccurator.domain.model.ReviewDecision;
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ExecuteCleanupRequest {

    @NotBlank
    private String confirmation;

    private String backupDir;

    private boolean dryRun;

    private List<ReviewDecision> decisions = new ArrayList<>();
}
