package com.example.musiccurator.application.service;

import com.example.musiccurator.application.service.similarity.SimilarityStrategy;
import com.example.musiccurator.common.config.AppVetProperties;
import com.example.musiccurator.domain.MetadataHash;
import com.example.musiccurator.domain.enumtype.MatchStatus;
import com.example.musiccurator.domain.enumtype.MatchType;
import com.example.musiccurator.domain.model.MatchVerdict;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Three ordered tiers: exact metadata hash, exact content hash, fuzzy artist/title similarity.
 * The first tier that hits decides the verdict. Read-only against the catalog.
 */
@Service
public class DuplicateMatcher {

    private static final Logger log = LoggerFactory.getLogger(DuplicateMatcher.class);

    private final LibraryCatalog libraryCatalog;
    private final SimilarityStrategy similarityStrategy;
    private final MatchTextNormalizer matchTextNormalizer;
    private final double uncertainFloor;

    public DuplicateMatcher(LibraryCatalog libraryCatalog,
                            SimilarityStrategy similarityStrategy,
                            MatchTextNormalizer matchTextNormalizer,
                            AppVetProperties appVetProperties) {
        this.libraryCatalog = libraryCatalog;
        this.similarityStrategy = similarityStrategy;
        this.matchTextNormalizer = matchTextNormalizer;
        this.uncertainFloor = appVetProperties.getUncertainFloor();
    }

    public MatchVerdict match(LibraryFileEntity candidate, double threshold) {
        if (threshold < 0D || threshold > 1D) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }
        String metadataHash = candidate.getMetadataHash();
        if (metadataHash != null && !MetadataHash.isSentinel(metadataHash)) {
            List<LibraryFileEntity> hits = libraryCatalog.findByMetadataHash(metadataHash, true);
            if (!hits.isEmpty()) {
                return MatchVerdict.exact(hits.get(0), MatchType.EXACT_METADATA);
            }
        }

        if (candidate.getContentHash() != null) {
            List<LibraryFileEntity> hits = libraryCatalog.findByContentHash(candidate.getContentHash(), true);
            if (!hits.isEmpty()) {
                return MatchVerdict.exact(hits.get(0), MatchType.EXACT_CONTENT);
            }
        }

        if (!StringUtils.hasText(candidate.getArtist()) || !StringUtils.hasText(candidate.getTitle())) {
            return MatchVerdict.newFile();
        }
        return fuzzyMatch(candidate, threshold);
    }

    private MatchVerdict fuzzyMatch(LibraryFileEntity candidate, double threshold) {
        List<LibraryFileEntity> rows = libraryCatalog.findCandidatesByArtist(candidate.getArtist());
        if (rows.isEmpty()) {
            return MatchVerdict.newFile();
        }
        String candidateKey = matchTextNormalizer.comparisonKey(candidate.getArtist(), candidate.getTitle());
        LibraryFileEntity best = null;
        double bestScore = -1D;
        for (LibraryFileEntity row : rows) {
            if (!StringUtils.hasText(row.getTitle())) {
                continue;
            }
            double score = similarityStrategy.similarity(candidateKey,
                    matchTextNormalizer.comparisonKey(row.getArtist(), row.getTitle()));
            if (score > bestScore || (score == bestScore && preferOnTie(row, best))) {
                best = row;
                bestScore = score;
            }
        }
        if (best == null) {
            return MatchVerdict.newFile();
        }
        if (log.isDebugEnabled()) {
            log.debug("FUZZY_BEST candidate='{}' match={} score={}", candidateKey, best.getFilePath(), bestScore);
        }
        if (bestScore >= threshold) {
            return new MatchVerdict(MatchStatus.DUPLICATE, best, bestScore, MatchType.FUZZY);
        }
        if (bestScore >= Math.min(uncertainFloor, threshold)) {
            return new MatchVerdict(MatchStatus.UNCERTAIN, best, bestScore, MatchType.FUZZY);
        }
        return MatchVerdict.newFile();
    }

    /**
     * Most recently verified row wins a tie, then the lowest id.
     */
    static boolean preferOnTie(LibraryFileEntity challenger, LibraryFileEntity incumbent) {
        if (incumbent == null) {
            return true;
        }
        long challengerVerified = challenger.getLastVerified() == null ? Long.MIN_VALUE : challenger.getLastVerified();
        long incumbentVerified = incumbent.getLastVerified() == null ? Long.MIN_VALUE : incumbent.getLastVerified();
        if (challengerVerified != incumbentVerified) {
            return challengerVerified > incumbentVerified;
        }
        return challenger.getId() != null && incumbent.getId() != null && challenger.getId() < incumbent.getId();
    }
}
