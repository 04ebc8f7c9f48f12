package com.example.musiccurator.application.service;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccurator.application.service.similarity.RatcliffObershelpSimilarity;
import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.common.config.AppMatchProperties;
import com.example.musiccurator.domain.MetadataHash;
import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.GroupingKind;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DuplicateGroupFinderTest {

    private LibraryCatalog catalog;
    private DuplicateGroupFinder finder;

    private final LibraryFileEntity alphaFlac = row(1L, "alpha.flac", "m1", "c0");
    private final LibraryFileEntity alphaMp3 = row(2L, "alpha copy.mp3", "m1", "c1");
    private final LibraryFileEntity zeta = row(3L, "zeta.ogg", "m2", "c1");
    private final LibraryFileEntity tune = row(4L, "Artist - Tune.mp3", "m3", "c3");
    private final LibraryFileEntity tuneRip = row(5L, "01 Artist - Tune [320].mp3", "m4", "c4");
    private final LibraryFileEntity lonely = row(6L, "lonely.mp3", "m5", "c5");

    @BeforeEach
    void setUp() {
        tune.setArtistKey("artist");
        tuneRip.setArtistKey("artist");
        catalog = mock(LibraryCatalog.class);
        when(catalog.findActiveSharingMetadataHash()).thenReturn(Arrays.asList(alphaFlac, alphaMp3));
        when(catalog.findActiveSharingContentHash()).thenReturn(Arrays.asList(alphaMp3, zeta));
        when(catalog.findActive()).thenReturn(Arrays.asList(alphaFlac, alphaMp3, zeta, tune, tuneRip, lonely));
        finder = new DuplicateGroupFinder(catalog, new MatchTextNormalizer(new AppMatchProperties()),
                new RatcliffObershelpSimilarity(), new AppCleanupProperties());
    }

    @Test
    void fastModeShouldGroupByMetadataHashOnly() {
        List<DuplicateGroup> groups = finder.find(CleanupMode.FAST);

        Assertions.assertEquals(1, groups.size());
        Assertions.assertEquals(GroupingKind.METADATA_HASH, groups.get(0).getKind());
        Assertions.assertEquals("m1", groups.get(0).getGroupKey());
        Assertions.assertEquals(Arrays.asList(alphaFlac, alphaMp3), groups.get(0).getMembers());
        verify(catalog, never()).findActiveSharingContentHash();
        verify(catalog, never()).findActive();
    }

    @Test
    void thoroughModeShouldMergeOverlappingGroups() {
        List<DuplicateGroup> groups = finder.find(CleanupMode.THOROUGH);

        Assertions.assertEquals(2, groups.size());
        DuplicateGroup merged = groups.get(0);
        Assertions.assertEquals(1, merged.getGroupId());
        Assertions.assertEquals(GroupingKind.METADATA_HASH, merged.getKind());
        Assertions.assertEquals(Arrays.asList(alphaFlac, alphaMp3, zeta), merged.getMembers());

        DuplicateGroup byName = groups.get(1);
        Assertions.assertEquals(2, byName.getGroupId());
        Assertions.assertEquals(GroupingKind.FILENAME, byName.getKind());
        Assertions.assertEquals(Arrays.asList(tune, tuneRip), byName.getMembers());
    }

    @Test
    void fileShouldNeverAppearInTwoGroups() {
        Set<Long> seen = new HashSet<>();
        for (DuplicateGroup group : finder.find(CleanupMode.THOROUGH)) {
            for (LibraryFileEntity member : group.getMembers()) {
                Assertions.assertTrue(seen.add(member.getId()), "duplicate membership for " + member.getId());
            }
        }
    }

    @Test
    void thoroughModeShouldNotLinkDifferentlyTaggedSongsByFilename() {
        LibraryFileEntity introA = row(11L, "01 Intro.mp3", "ma", "ca");
        introA.setArtistKey("artist a");
        LibraryFileEntity introB = row(12L, "01 Intro.flac", "mb", "cb");
        introB.setArtistKey("artist b");
        LibraryFileEntity introC = row(13L, "03 - Intro.ogg", "mc", "cc");
        introC.setArtistKey("artist c");
        when(catalog.findActiveSharingMetadataHash()).thenReturn(Collections.<LibraryFileEntity>emptyList());
        when(catalog.findActiveSharingContentHash()).thenReturn(Collections.<LibraryFileEntity>emptyList());
        when(catalog.findActive()).thenReturn(Arrays.asList(introA, introB, introC));

        Assertions.assertTrue(finder.find(CleanupMode.THOROUGH).isEmpty());
    }

    @Test
    void thoroughModeShouldLinkUntaggedFileByFilename() {
        LibraryFileEntity tagged = row(21L, "01 Intro.mp3", "ma", "ca");
        tagged.setArtistKey("artist a");
        LibraryFileEntity untagged = row(22L, "Intro.mp3", MetadataHash.SENTINEL, "cb");
        when(catalog.findActiveSharingMetadataHash()).thenReturn(Collections.<LibraryFileEntity>emptyList());
        when(catalog.findActiveSharingContentHash()).thenReturn(Collections.<LibraryFileEntity>emptyList());
        when(catalog.findActive()).thenReturn(Arrays.asList(tagged, untagged));

        List<DuplicateGroup> groups = finder.find(CleanupMode.THOROUGH);

        Assertions.assertEquals(1, groups.size());
        Assertions.assertEquals(GroupingKind.FILENAME, groups.get(0).getKind());
        Assertions.assertEquals(Arrays.asList(tagged, untagged), groups.get(0).getMembers());
    }

    private static LibraryFileEntity row(Long id, String filename, String metadataHash, String contentHash) {
        LibraryFileEntity row = new LibraryFileEntity();
        row.setId(id);
        row.setFilename(filename);
        row.setFilePath("/lib/" + filename);
        row.setMetadataHash(metadataHash);
        row.setContentHash(contentHash);
        row.setIsActive(1);
        return row;
    }
}
