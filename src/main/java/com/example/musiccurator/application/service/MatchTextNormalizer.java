package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppMatchProperties;
import com.example.musiccurator.common.util.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds the strings compared by the fuzzy tier and by thorough-mode filename grouping.
 */
@Component
public class MatchTextNormalizer {

    private static final Pattern BRACKETED = Pattern.compile("[\\(\\[\\{][^\\)\\]\\}]*[\\)\\]\\}]");
    private static final Pattern SEPARATORS = Pattern.compile("[_\\-.]+");
    private static final Pattern QUALITY_MARKERS = Pattern.compile("\\b(320|256|192|128|v0|v2|vbr|cbr|flac|mp3|kbps)\\b");
    private static final Pattern LEADING_TRACK_NO = Pattern.compile("^\\d{1,3}\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<String> noiseTokens;

    public MatchTextNormalizer(AppMatchProperties appMatchProperties) {
        List<String> tokens = new ArrayList<>();
        for (String token : appMatchProperties.getNoiseTokens()) {
            String folded = TextNormalizer.foldKey(token);
            if (folded != null && !folded.isEmpty()) {
                tokens.add(folded);
            }
        }
        // longest first so "(extended mix)" wins over "(extended)"
        Collections.sort(tokens, new Comparator<String>() {
            @Override
            public int compare(String a, String b) {
                return Integer.compare(b.length(), a.length());
            }
        });
        this.noiseTokens = tokens;
    }

    public String comparisonKey(String artist, String title) {
        String foldedArtist = TextNormalizer.foldKey(artist);
        String cleanTitle = stripNoise(TextNormalizer.foldKey(title));
        return ((foldedArtist == null ? "" : foldedArtist) + " " + cleanTitle).trim();
    }

    public String stripNoise(String foldedTitle) {
        if (foldedTitle == null) {
            return "";
        }
        String result = foldedTitle;
        for (String token : noiseTokens) {
            result = result.replace(token, " ");
        }
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        while (result.endsWith("-")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    /**
     * Filename stem without bracketed segments, separators, track numbers or encoding markers.
     */
    public String filenameKey(String filename) {
        String stem = TextNormalizer.foldKey(TextNormalizer.stemOf(filename));
        if (stem == null) {
            return "";
        }
        String result = BRACKETED.matcher(stem).replaceAll(" ");
        result = SEPARATORS.matcher(result).replaceAll(" ");
        result = QUALITY_MARKERS.matcher(result).replaceAll(" ");
        result = WHITESPACE.matcher(result).replaceAll(" ").trim();
        return LEADING_TRACK_NO.matcher(result).replaceFirst("");
    }
}
