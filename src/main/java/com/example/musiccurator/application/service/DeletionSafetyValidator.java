package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.domain.enumtype.CheckLevel;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.domain.model.GroupValidation;
import com.example.musiccurator.domain.model.QualityScore;
import com.example.musiccurator.domain.model.ValidationCheck;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.storage.FileStore;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Seven checkpoints run on every reviewed group before it may join a deletion batch. A failed
 * ERROR check excludes the group; WARNING checks are reported but never block.
 */
@Component
public class DeletionSafetyValidator {

    static final int CHECK_KEEPER_EXISTS = 1;
    static final int CHECK_HAS_DELETIONS = 2;
    static final int CHECK_QUALITY = 3;
    static final int CHECK_CANDIDATES_EXIST = 4;
    static final int CHECK_KEEPER_NOT_DELETED = 5;
    static final int CHECK_WRITE_PERMISSION = 6;
    static final int CHECK_BACKUP_SPACE = 7;

    private final FileStore fileStore;
    private final QualityScorer qualityScorer;
    private final int qualityWarningMargin;

    public DeletionSafetyValidator(FileStore fileStore,
                                   QualityScorer qualityScorer,
                                   AppCleanupProperties appCleanupProperties) {
        this.fileStore = fileStore;
        this.qualityScorer = qualityScorer;
        this.qualityWarningMargin = appCleanupProperties.getQualityWarningMargin();
    }

    public GroupValidation validate(DuplicateGroup group, Path backupRoot) {
        GroupValidation validation = new GroupValidation();
        validation.setGroupId(group.getGroupId());
        List<ValidationCheck> checks = validation.getChecks();
        LibraryFileEntity keeper = group.getKeeper();
        List<LibraryFileEntity> candidates = group.getDeleteCandidates();

        boolean keeperExists = keeper != null && fileStore.exists(Paths.get(keeper.getFilePath()));
        checks.add(check(CHECK_KEEPER_EXISTS, "keeper_exists", CheckLevel.ERROR, keeperExists,
                keeperExists ? "Keeper present" : "Keeper missing on disk: " + pathOf(keeper)));

        boolean hasDeletions = !candidates.isEmpty();
        checks.add(check(CHECK_HAS_DELETIONS, "has_deletions", CheckLevel.ERROR, hasDeletions,
                hasDeletions ? candidates.size() + " file(s) marked for deletion" : "Nothing marked for deletion"));

        checks.add(qualityCheck(group));

        List<String> missing = new ArrayList<>();
        for (LibraryFileEntity candidate : candidates) {
            if (!fileStore.exists(Paths.get(candidate.getFilePath()))) {
                missing.add(candidate.getFilePath());
            }
        }
        checks.add(check(CHECK_CANDIDATES_EXIST, "candidates_exist", CheckLevel.ERROR, missing.isEmpty(),
                missing.isEmpty() ? "All delete candidates present" : "Missing on disk: " + missing));

        boolean keeperSafe = keeper != null && !containsSameFile(candidates, keeper);
        checks.add(check(CHECK_KEEPER_NOT_DELETED, "keeper_not_deleted", CheckLevel.ERROR, keeperSafe,
                keeperSafe ? "Keeper not in delete set" : "Keeper would be deleted"));

        List<String> readOnly = new ArrayList<>();
        for (LibraryFileEntity candidate : candidates) {
            Path path = Paths.get(candidate.getFilePath());
            Path parent = path.toAbsolutePath().getParent();
            if (fileStore.exists(path) && (!fileStore.isWritable(path) || parent == null || !fileStore.isWritable(parent))) {
                readOnly.add(candidate.getFilePath());
            }
        }
        checks.add(check(CHECK_WRITE_PERMISSION, "write_permission", CheckLevel.ERROR, readOnly.isEmpty(),
                readOnly.isEmpty() ? "Write permission confirmed" : "No write permission: " + readOnly));

        checks.add(spaceCheck(group.reclaimableBytes(), backupRoot));
        return validation;
    }

    /**
     * Checkpoint 7 for a whole batch; always a warning when short.
     */
    public ValidationCheck spaceCheck(long requiredBytes, Path backupRoot) {
        long available;
        try {
            available = fileStore.usableSpace(backupRoot);
        } catch (IOException e) {
            return check(CHECK_BACKUP_SPACE, "backup_space", CheckLevel.WARNING, false,
                    "Unable to read free space at " + backupRoot + ": " + e.getMessage());
        }
        boolean enough = available >= requiredBytes;
        return check(CHECK_BACKUP_SPACE, "backup_space", enough ? CheckLevel.INFO : CheckLevel.WARNING, enough,
                "Backup needs " + requiredBytes + " bytes, " + available + " available");
    }

    private ValidationCheck qualityCheck(DuplicateGroup group) {
        LibraryFileEntity keeper = group.getKeeper();
        if (keeper == null) {
            return check(CHECK_QUALITY, "quality", CheckLevel.INFO, true, "No keeper to compare");
        }
        QualityScore keeperScore = qualityScorer.score(keeper);
        int keeperBitrate = keeper.getBitrate() == null ? 0 : keeper.getBitrate();
        boolean keeperLossless = qualityScorer.isLossless(keeper);
        List<String> better = new ArrayList<>();
        for (LibraryFileEntity candidate : group.getDeleteCandidates()) {
            QualityScore score = qualityScorer.score(candidate);
            int bitrate = candidate.getBitrate() == null ? 0 : candidate.getBitrate();
            boolean higherFormat = score.getFormatPoints() > keeperScore.getFormatPoints();
            boolean higherBitrate = !keeperLossless && !qualityScorer.isLossless(candidate) && bitrate > keeperBitrate;
            boolean higherTotal = score.getTotal() >= keeperScore.getTotal() + qualityWarningMargin;
            if (higherFormat || higherBitrate || higherTotal) {
                better.add(candidate.getFilePath() + " (" + score.getTotal() + " vs " + keeperScore.getTotal() + ")");
            }
        }
        if (better.isEmpty()) {
            return check(CHECK_QUALITY, "quality", CheckLevel.INFO, true, "Keeper has the best quality");
        }
        return check(CHECK_QUALITY, "quality", CheckLevel.WARNING, false,
                "Deleting higher quality file(s): " + better);
    }

    private boolean containsSameFile(List<LibraryFileEntity> candidates, LibraryFileEntity keeper) {
        Set<Path> candidatePaths = new HashSet<>();
        for (LibraryFileEntity candidate : candidates) {
            if (candidate.getId() != null && candidate.getId().equals(keeper.getId())) {
                return true;
            }
            candidatePaths.add(canonical(candidate.getFilePath()));
        }
        return candidatePaths.contains(canonical(keeper.getFilePath()));
    }

    private Path canonical(String rawPath) {
        Path path = Paths.get(rawPath).toAbsolutePath().normalize();
        try {
            return path.toRealPath();
        } catch (IOException e) {
            // missing files are caught by the existence checks
            return path;
        }
    }

    private String pathOf(LibraryFileEntity file) {
        return file == null ? "<none>" : file.getFilePath();
    }

    private ValidationCheck check(int checkpoint, String name, CheckLevel level, boolean passed, String message) {
        return new ValidationCheck(checkpoint, name, level, passed, message);
    }
}
