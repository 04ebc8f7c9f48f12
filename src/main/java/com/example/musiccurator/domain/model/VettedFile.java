package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.MatchStatus;
import com.example.musiccurator.domain.enumtype.MatchType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VettedFile {

    private String path;

    private MatchStatus status;

    private MatchType matchType;

    private double confidence;

    private String matchedPath;

    public static VettedFile of(String path, MatchVerdict verdict) {
        String matchedPath = verdict.getMatch() == null ? null : verdict.getMatch().getFilePath();
        return new VettedFile(path, verdict.getStatus(), verdict.getMatchType(), verdict.getConfidence(), matchedPath);
    }
}
