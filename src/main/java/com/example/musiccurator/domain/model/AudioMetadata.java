package com.example.musiccurator.domain.model;

import lombok.Data;

@Data
public class AudioMetadata {

    private String title;

    private String artist;

    private String album;

    private Integer year;

    /**
     * seconds
     */
    private Double duration;

    /**
     * kbps
     */
    private Integer bitrate;

    private Boolean vbr;

    private Integer sampleRate;

    private String encoding;
}
