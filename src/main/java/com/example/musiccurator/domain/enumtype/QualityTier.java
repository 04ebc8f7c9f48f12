package com.example.musiccurator.domain.enumtype;

public enum QualityTier {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static QualityTier of(int total) {
        if (total >= 80) {
            return EXCELLENT;
        }
        if (total >= 60) {
            return GOOD;
        }
        if (total >= 40) {
            return FAIR;
        }
        return POOR;
    }
}
