package com.example.musiccurator.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class VettingSessionEntity {

    private Long id;

    private String importFolder;

    private Long scannedAt;

    private Integer fileCount;

    private Integer newCount;

    private Integer duplicateCount;

    private Integer uncertainCount;

    private Double thresholdUsed;
}
