package com.example.musiccurator.infrastructure.persistence.entity;

import lombok.Data;

/**
 * One row of {@code library_index}. Times are epoch milliseconds.
 */
@Data
public class LibraryFileEntity {

    private Long id;

    private String filePath;

    private String filename;

    private String artist;

    private String artistKey;

    private String title;

    private String album;

    private Integer year;

    private Double duration;

    private String fileFormat;

    /**
     * kbps
     */
    private Integer bitrate;

    private Integer vbr;

    private Integer sampleRate;

    private Long fileSize;

    private String metadataHash;

    private String contentHash;

    private Long indexedAt;

    private Long fileMtime;

    private Long lastVerified;

    private Integer isActive;

    public boolean active() {
        return isActive != null && isActive == 1;
    }

    public boolean variableBitrate() {
        return vbr != null && vbr == 1;
    }
}
