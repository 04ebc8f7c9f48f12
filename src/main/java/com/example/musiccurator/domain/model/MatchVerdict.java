package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.MatchStatus;
import com.example.musiccurator.domain.enumtype.MatchType;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchVerdict {

    private MatchStatus status;

    private LibraryFileEntity match;

    private double confidence;

    private MatchType matchType;

    public static MatchVerdict newFile() {
        return new MatchVerdict(MatchStatus.NEW, null, 0D, MatchType.NONE);
    }

    public static MatchVerdict exact(LibraryFileEntity match, MatchType matchType) {
        return new MatchVerdict(MatchStatus.DUPLICATE, match, 1.0D, matchType);
    }
}
