package com.example.musiccurator.domain;

public final class MetadataHash {

    /**
     * Stored for files with neither artist nor title. Never equal to a hex digest.
     */
    public static final String SENTINEL = "NO_METADATA_HASH";

    private MetadataHash() {
    }

    public static boolean isSentinel(String hash) {
        return SENTINEL.equals(hash);
    }
}
