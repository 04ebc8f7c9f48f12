package com.example.musiccurator.domain.enumtype;

public enum GroupingKind {
    METADATA_HASH, CONTENT_HASH, FILENAME
}
