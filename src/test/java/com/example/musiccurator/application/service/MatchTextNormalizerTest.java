package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppMatchProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MatchTextNormalizerTest {

    private final MatchTextNormalizer normalizer = new MatchTextNormalizer(new AppMatchProperties());

    @Test
    void comparisonKeyShouldFoldCaseAndDiacritics() {
        Assertions.assertEquals("beyonce halo", normalizer.comparisonKey(" Beyoncé ", "HALO"));
    }

    @Test
    void comparisonKeyShouldDropNoiseTokens() {
        Assertions.assertEquals("artist song", normalizer.comparisonKey("Artist", "Song (Original Mix)"));
        Assertions.assertEquals("artist song", normalizer.comparisonKey("Artist", "Song (Extended Mix)"));
        Assertions.assertEquals("artist song", normalizer.comparisonKey("Artist", "Song - Remastered"));
    }

    @Test
    void customNoiseTokensShouldBeHonoured() {
        AppMatchProperties properties = new AppMatchProperties();
        properties.getNoiseTokens().add("(live)");
        MatchTextNormalizer custom = new MatchTextNormalizer(properties);

        Assertions.assertEquals("artist song", custom.comparisonKey("Artist", "Song (Live)"));
        Assertions.assertEquals("artist song (live)", normalizer.comparisonKey("Artist", "Song (Live)"));
    }

    @Test
    void filenameKeyShouldStripTrackNumbersAndEncodingMarkers() {
        Assertions.assertEquals("artist song", normalizer.filenameKey("01 - Artist - Song [320].mp3"));
        Assertions.assertEquals("artist song", normalizer.filenameKey("Artist_Song (flac).flac"));
        Assertions.assertEquals("", normalizer.filenameKey(null));
    }
}
