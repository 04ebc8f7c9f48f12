package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.FileActionType;
import lombok.Data;

@Data
public class FileAction {

    private int groupId;

    private FileActionType action;

    private String filePath;

    private String format;

    private int qualityScore;

    private long fileSizeBytes;

    private String bitrateType;

    private Integer sampleRate;

    private String message;
}
