package com.example.musiccurator.application.service;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccurator.application.service.similarity.RatcliffObershelpSimilarity;
import com.example.musiccurator.application.service.similarity.SimilarityStrategy;
import com.example.musiccurator.common.config.AppMatchProperties;
import com.example.musiccurator.common.config.AppVetProperties;
import com.example.musiccurator.domain.MetadataHash;
import com.example.musiccurator.domain.enumtype.MatchStatus;
import com.example.musiccurator.domain.enumtype.MatchType;
import com.example.musiccurator.domain.model.MatchVerdict;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DuplicateMatcherTest {

    private LibraryCatalog catalog;
    private MatchTextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        catalog = mock(LibraryCatalog.class);
        normalizer = new MatchTextNormalizer(new AppMatchProperties());
        when(catalog.findByMetadataHash(anyString(), anyBoolean())).thenReturn(Collections.emptyList());
        when(catalog.findByContentHash(anyString(), anyBoolean())).thenReturn(Collections.emptyList());
        when(catalog.findCandidatesByArtist(anyString())).thenReturn(Collections.emptyList());
    }

    @Test
    void metadataTierShouldWinBeforeContentAndFuzzyTiers() {
        LibraryFileEntity byMetadata = row(1L, "/lib/a.flac", "Artist", "Song");
        when(catalog.findByMetadataHash("meta-1", true)).thenReturn(Collections.singletonList(byMetadata));

        MatchVerdict verdict = matcher(new RatcliffObershelpSimilarity())
                .match(candidate("meta-1", "content-1", "Artist", "Song"), 0.8D);

        Assertions.assertEquals(MatchStatus.DUPLICATE, verdict.getStatus());
        Assertions.assertEquals(MatchType.EXACT_METADATA, verdict.getMatchType());
        Assertions.assertEquals(1.0D, verdict.getConfidence());
        Assertions.assertSame(byMetadata, verdict.getMatch());
        verify(catalog, never()).findByContentHash(anyString(), anyBoolean());
        verify(catalog, never()).findCandidatesByArtist(anyString());
    }

    @Test
    void contentTierShouldCatchRetaggedCopy() {
        LibraryFileEntity byContent = row(2L, "/lib/b.mp3", "Someone", "Else");
        when(catalog.findByContentHash("content-1", true)).thenReturn(Collections.singletonList(byContent));

        MatchVerdict verdict = matcher(new RatcliffObershelpSimilarity())
                .match(candidate("meta-1", "content-1", "Artist", "Song"), 0.8D);

        Assertions.assertEquals(MatchType.EXACT_CONTENT, verdict.getMatchType());
        Assertions.assertSame(byContent, verdict.getMatch());
    }

    @Test
    void sentinelMetadataHashShouldNeverBeLookedUp() {
        MatchVerdict verdict = matcher(new RatcliffObershelpSimilarity())
                .match(candidate(MetadataHash.SENTINEL, "content-x", null, null), 0.8D);

        Assertions.assertEquals(MatchStatus.NEW, verdict.getStatus());
        Assertions.assertEquals(MatchType.NONE, verdict.getMatchType());
        verify(catalog, never()).findByMetadataHash(eq(MetadataHash.SENTINEL), anyBoolean());
    }

    @Test
    void fuzzyScoreAboveThresholdShouldBeDuplicate() {
        when(catalog.findCandidatesByArtist("Artist"))
                .thenReturn(Collections.singletonList(row(3L, "/lib/c.mp3", "Artist", "Song (Radio Edit)")));

        MatchVerdict verdict = matcher(fixed(0.82D)).match(candidate("m", "c", "Artist", "Song"), 0.8D);

        Assertions.assertEquals(MatchStatus.DUPLICATE, verdict.getStatus());
        Assertions.assertEquals(MatchType.FUZZY, verdict.getMatchType());
        Assertions.assertEquals(0.82D, verdict.getConfidence(), 1e-9);
    }

    @Test
    void fuzzyScoreBetweenFloorAndThresholdShouldBeUncertain() {
        when(catalog.findCandidatesByArtist("Artist"))
                .thenReturn(Collections.singletonList(row(3L, "/lib/c.mp3", "Artist", "Song")));

        MatchVerdict verdict = matcher(fixed(0.75D)).match(candidate("m", "c", "Artist", "Song"), 0.8D);

        Assertions.assertEquals(MatchStatus.UNCERTAIN, verdict.getStatus());
        Assertions.assertEquals(0.75D, verdict.getConfidence(), 1e-9);
    }

    @Test
    void fuzzyScoreBelowFloorShouldBeNew() {
        when(catalog.findCandidatesByArtist("Artist"))
                .thenReturn(Collections.singletonList(row(3L, "/lib/c.mp3", "Artist", "Song")));

        MatchVerdict verdict = matcher(fixed(0.5D)).match(candidate("m", "c", "Artist", "Song"), 0.8D);

        Assertions.assertEquals(MatchStatus.NEW, verdict.getStatus());
    }

    @Test
    void missingTitleShouldSkipFuzzyTier() {
        MatchVerdict verdict = matcher(fixed(1.0D)).match(candidate("m", "c", "Artist", " "), 0.8D);

        Assertions.assertEquals(MatchStatus.NEW, verdict.getStatus());
        verify(catalog, never()).findCandidatesByArtist(anyString());
    }

    @Test
    void equalScoresShouldPreferMostRecentlyVerifiedThenLowestId() {
        LibraryFileEntity older = row(1L, "/lib/old.mp3", "Artist", "Song");
        older.setLastVerified(1000L);
        LibraryFileEntity newer = row(5L, "/lib/new.mp3", "Artist", "Song");
        newer.setLastVerified(2000L);
        LibraryFileEntity newerHigherId = row(9L, "/lib/newer.mp3", "Artist", "Song");
        newerHigherId.setLastVerified(2000L);
        when(catalog.findCandidatesByArtist("Artist")).thenReturn(Arrays.asList(older, newerHigherId, newer));

        MatchVerdict verdict = matcher(fixed(0.9D)).match(candidate("m", "c", "Artist", "Song"), 0.8D);

        Assertions.assertSame(newer, verdict.getMatch());
    }

    @Test
    void thresholdOutsideUnitRangeShouldBeRejected() {
        DuplicateMatcher matcher = matcher(fixed(1.0D));
        LibraryFileEntity candidate = candidate("m", "c", "Artist", "Song");

        Assertions.assertThrows(IllegalArgumentException.class, () -> matcher.match(candidate, 1.5D));
    }

    private DuplicateMatcher matcher(SimilarityStrategy strategy) {
        AppVetProperties vetProperties = new AppVetProperties();
        vetProperties.setUncertainFloor(0.7D);
        return new DuplicateMatcher(catalog, strategy, normalizer, vetProperties);
    }

    private static SimilarityStrategy fixed(double score) {
        return (left, right) -> score;
    }

    private static LibraryFileEntity candidate(String metadataHash, String contentHash, String artist, String title) {
        LibraryFileEntity candidate = new LibraryFileEntity();
        candidate.setFilePath("/import/candidate.mp3");
        candidate.setMetadataHash(metadataHash);
        candidate.setContentHash(contentHash);
        candidate.setArtist(artist);
        candidate.setTitle(title);
        return candidate;
    }

    private static LibraryFileEntity row(Long id, String path, String artist, String title) {
        LibraryFileEntity row = new LibraryFileEntity();
        row.setId(id);
        row.setFilePath(path);
        row.setArtist(artist);
        row.setTitle(title);
        row.setIsActive(1);
        return row;
    }
}
