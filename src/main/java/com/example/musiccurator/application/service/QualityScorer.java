package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppQualityProperties;
import com.example.musiccurator.domain.enumtype.QualityTier;
import com.example.musiccurator.domain.model.QualityScore;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Ranking score from format, bitrate, sample rate and file age. The total can reach 102 with the
 * VBR bonus; only relative order matters.
 */
@Component
public class QualityScorer {

    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private final AppQualityProperties weights;
    private final Clock clock;

    @Autowired
    public QualityScorer(AppQualityProperties weights) {
        this(weights, Clock.systemDefaultZone());
    }

    QualityScorer(AppQualityProperties weights, Clock clock) {
        this.weights = weights;
        this.clock = clock;
    }

    public QualityScore score(LibraryFileEntity file) {
        String format = file.getFileFormat();
        boolean lossless = weights.isLossless(format);
        int formatPoints = weights.formatPointsOf(format);
        int bitratePoints = bitratePoints(file.getBitrate(), lossless);
        int vbrBonus = !lossless && file.variableBitrate() ? weights.getVbrBonus() : 0;
        int sampleRatePoints = sampleRatePoints(file.getSampleRate());
        int recencyPoints = recencyPoints(file.getFileMtime());
        int total = formatPoints + bitratePoints + vbrBonus + sampleRatePoints + recencyPoints;
        return new QualityScore(total, formatPoints, bitratePoints, vbrBonus, sampleRatePoints, recencyPoints,
                QualityTier.of(total));
    }

    /**
     * Best first: higher total, then larger file, then path for a stable order.
     */
    public List<LibraryFileEntity> rank(List<LibraryFileEntity> files) {
        List<LibraryFileEntity> ranked = new ArrayList<>(files);
        Collections.sort(ranked, new Comparator<LibraryFileEntity>() {
            @Override
            public int compare(LibraryFileEntity a, LibraryFileEntity b) {
                int byScore = Integer.compare(score(b).getTotal(), score(a).getTotal());
                if (byScore != 0) {
                    return byScore;
                }
                long sizeA = a.getFileSize() == null ? 0L : a.getFileSize();
                long sizeB = b.getFileSize() == null ? 0L : b.getFileSize();
                int bySize = Long.compare(sizeB, sizeA);
                if (bySize != 0) {
                    return bySize;
                }
                return String.valueOf(a.getFilePath()).compareTo(String.valueOf(b.getFilePath()));
            }
        });
        return ranked;
    }

    public boolean isLossless(LibraryFileEntity file) {
        return weights.isLossless(file.getFileFormat());
    }

    int bitratePoints(Integer bitrateKbps, boolean lossless) {
        if (lossless) {
            return weights.getMaxBitratePoints();
        }
        if (bitrateKbps == null || bitrateKbps <= 0) {
            return weights.getMissingBitratePoints();
        }
        double ratio = Math.min(bitrateKbps / (double) weights.getReferenceBitrateKbps(), 1.0D);
        return (int) (weights.getMaxBitratePoints() * ratio);
    }

    int sampleRatePoints(Integer sampleRate) {
        if (sampleRate == null || sampleRate <= 0) {
            return weights.getMissingSampleRatePoints();
        }
        if (sampleRate >= weights.getSampleRateHighHz()) {
            return weights.getSampleRateHighPoints();
        }
        if (sampleRate >= weights.getSampleRateMidHz()) {
            return weights.getSampleRateMidPoints();
        }
        if (sampleRate >= weights.getSampleRateCdHz()) {
            return weights.getSampleRateCdPoints();
        }
        return (int) (weights.getSampleRateCdPoints() * (sampleRate / (double) weights.getSampleRateCdHz()));
    }

    int recencyPoints(Long mtimeMs) {
        if (mtimeMs == null || mtimeMs <= 0) {
            return 0;
        }
        long ageDays = Math.max(0L, (clock.millis() - mtimeMs) / DAY_MS);
        if (ageDays < weights.getRecentDays()) {
            return weights.getRecentPoints();
        }
        if (ageDays < weights.getAgingDays()) {
            return weights.getAgingPoints();
        }
        return 0;
    }
}
