package com.example.musiccurator.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class BackupManifest {

    private String backupId;

    private String backupDir;

    private String createdAt;

    private List<BackupEntry> entries = new ArrayList<>();

    public boolean covers(String originalPath) {
        for (BackupEntry entry : entries) {
            if (entry.getOriginalPath().equals(originalPath)) {
                return true;
            }
        }
        return false;
    }
}
