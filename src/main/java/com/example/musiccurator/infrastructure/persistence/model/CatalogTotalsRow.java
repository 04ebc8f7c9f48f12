package com.example.musiccurator.infrastructure.persistence.model;

import lombok.Data;

@Data
public class CatalogTotalsRow {

    private Long totalFiles;

    private Long activeFiles;

    private Long totalSize;

    private Long uniqueArtists;

    private Long uniqueAlbums;
}
