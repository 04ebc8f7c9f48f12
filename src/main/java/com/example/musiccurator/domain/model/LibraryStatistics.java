package com.example.musiccurator.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class LibraryStatistics {

    /**
     * Every row, inactive ones included. The other figures cover active rows only.
     */
    private long totalFiles;

    private long activeFiles;

    private long inactiveFiles;

    private long totalSizeBytes;

    private long averageSizeBytes;

    private List<FormatStat> formats = new ArrayList<>();

    private long uniqueArtists;

    private long uniqueAlbums;

    private Long lastIndexedAt;

    private Long lastIndexDurationMs;
}
