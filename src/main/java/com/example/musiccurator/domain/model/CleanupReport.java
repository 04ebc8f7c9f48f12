package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.CleanupStatus;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CleanupReport {

    private String planId;

    private CleanupStatus status;

    private CleanupMode mode;

    private int groupCount;

    private int validatedGroupCount;

    private int skippedGroupCount;

    private int deletedCount;

    private int failedCount;

    private long bytesRecovered;

    private long durationMs;

    private String backupManifestPath;

    private String csvReportPath;

    private String jsonReportPath;

    private String message;

    private List<GroupValidation> validations = new ArrayList<>();

    private List<FileAction> actions = new ArrayList<>();
}
