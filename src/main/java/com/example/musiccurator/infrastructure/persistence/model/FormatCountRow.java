package com.example.musiccurator.infrastructure.persistence.model;

import lombok.Data;

@Data
public class FormatCountRow {

    private String fileFormat;

    private Long fileCount;
}
