package com.example.musiccurator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupEntry {

    private String originalPath;

    private String backupPath;

    private long size;

    /**
     * SHA-256 of the copied bytes.
     */
    private String checksum;
}
