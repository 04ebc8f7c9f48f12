package com.example.musiccurator.common.config;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Quality score weights. Defaults give lossless 44.1kHz files about 90 points and a
 * 128kbps mp3 about 42.
 */
@Data
@ConfigurationProperties(prefix = "app.quality")
public class AppQualityProperties {

    private Map<String, Integer> formatPoints = defaultFormatPoints();

    private int unknownFormatPoints = 10;

    private Set<String> losslessFormats = new HashSet<>(Arrays.asList(
            "flac", "alac", "wav", "aiff", "aif", "ape", "wv", "tta", "dsf", "dff"));

    private int maxBitratePoints = 30;

    private int referenceBitrateKbps = 320;

    private int missingBitratePoints = 5;

    private int vbrBonus = 2;

    private int sampleRateHighHz = 96000;

    private int sampleRateHighPoints = 20;

    private int sampleRateMidHz = 48000;

    private int sampleRateMidPoints = 15;

    private int sampleRateCdHz = 44100;

    private int sampleRateCdPoints = 10;

    private int missingSampleRatePoints = 10;

    private int recentDays = 365;

    private int recentPoints = 10;

    private int agingDays = 1825;

    private int agingPoints = 5;

    public int formatPointsOf(String format) {
        if (format == null) {
            return unknownFormatPoints;
        }
        Integer points = formatPoints.get(format.toLowerCase(Locale.ROOT));
        return points == null ? unknownFormatPoints : points;
    }

    public boolean isLossless(String format) {
        return format != null && losslessFormats.contains(format.toLowerCase(Locale.ROOT));
    }

    private static Map<String, Integer> defaultFormatPoints() {
        Map<String, Integer> points = new LinkedHashMap<>();
        points.put("flac", 40);
        points.put("alac", 40);
        points.put("wav", 38);
        points.put("aiff", 38);
        points.put("aif", 38);
        points.put("ape", 37);
        points.put("wv", 37);
        points.put("tta", 37);
        points.put("dsf", 36);
        points.put("dff", 36);
        points.put("m4a", 22);
        points.put("aac", 22);
        points.put("mp3", 20);
        points.put("ogg", 18);
        points.put("opus", 18);
        points.put("wma", 15);
        return points;
    }
}
