package com.example.musiccurator.application.service;

import com.example.musiccurator.application.event.CurationEventSink;
import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.common.exception.BackupException;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.CleanupPhase;
import com.example.musiccurator.domain.enumtype.CleanupStatus;
import com.example.musiccurator.domain.enumtype.FileActionType;
import com.example.musiccurator.domain.model.BackupManifest;
import com.example.musiccurator.domain.model.CleanupPlan;
import com.example.musiccurator.domain.model.CleanupReport;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.domain.model.FileAction;
import com.example.musiccurator.domain.model.GroupValidation;
import com.example.musiccurator.domain.model.QualityScore;
import com.example.musiccurator.domain.model.ReviewDecision;
import com.example.musiccurator.domain.model.ValidationCheck;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.storage.FileStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Removes lower-quality duplicates already in the library.
 * <p>
 * {@link #plan} scans and reviews without touching anything. {@link #execute} only proceeds
 * when the caller echoes the confirmation phrase, then validates each group, backs up the
 * whole batch, commits the manifest and only then deletes, one file at a time.
 */
@Service
public class SmartCleanupService {

    private static final Logger log = LoggerFactory.getLogger(SmartCleanupService.class);

    private static final String OPERATION = "cleanup";

    private final LibraryCatalog libraryCatalog;
    private final DuplicateGroupFinder duplicateGroupFinder;
    private final QualityScorer qualityScorer;
    private final DeletionSafetyValidator deletionSafetyValidator;
    private final BackupService backupService;
    private final CleanupReportWriter cleanupReportWriter;
    private final FileStore fileStore;
    private final CurationEventSink eventSink;
    private final AppCleanupProperties appCleanupProperties;
    private final MeterRegistry meterRegistry;

    private final Map<String, CleanupPlan> pendingPlans = new ConcurrentHashMap<>();

    public SmartCleanupService(LibraryCatalog libraryCatalog,
                               DuplicateGroupFinder duplicateGroupFinder,
                               QualityScorer qualityScorer,
                               DeletionSafetyValidator deletionSafetyValidator,
                               BackupService backupService,
                               CleanupReportWriter cleanupReportWriter,
                               FileStore fileStore,
                               CurationEventSink eventSink,
                               AppCleanupProperties appCleanupProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryCatalog = libraryCatalog;
        this.duplicateGroupFinder = duplicateGroupFinder;
        this.qualityScorer = qualityScorer;
        this.deletionSafetyValidator = deletionSafetyValidator;
        this.backupService = backupService;
        this.cleanupReportWriter = cleanupReportWriter;
        this.fileStore = fileStore;
        this.eventSink = eventSink;
        this.appCleanupProperties = appCleanupProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * One-shot run: plan, ask the gate, execute.
     */
    public CleanupReport cleanup(CleanupMode mode, String backupDir, ConfirmationGate gate) {
        CleanupPlan plan = plan(mode);
        if (plan.getGroups().isEmpty()) {
            CleanupReport report = newReport(plan);
            report.setStatus(CleanupStatus.NOTHING_TO_DELETE);
            report.setMessage("No duplicate groups found");
            pendingPlans.remove(plan.getPlanId());
            return report;
        }
        String confirmation = gate.confirm(plan);
        return execute(plan.getPlanId(), confirmation, gate.decisions(plan), backupDir, false, () -> false);
    }

    public CleanupPlan plan(CleanupMode mode) {
        CleanupMode effectiveMode = mode == null ? appCleanupProperties.getMode() : mode;
        evictExpiredPlans();
        log.info("CLEANUP_SCAN_START mode={}", effectiveMode);
        List<DuplicateGroup> groups = duplicateGroupFinder.find(effectiveMode);
        eventSink.onPhaseComplete(OPERATION, CleanupPhase.SCANNING.name());

        for (DuplicateGroup group : groups) {
            review(group, null);
        }
        eventSink.onPhaseComplete(OPERATION, CleanupPhase.REVIEWING.name());

        CleanupPlan plan = new CleanupPlan();
        plan.setPlanId(UUID.randomUUID().toString().replace("-", ""));
        plan.setMode(effectiveMode);
        plan.setCreatedAt(System.currentTimeMillis());
        plan.setGroups(groups);
        pendingPlans.put(plan.getPlanId(), plan);
        log.info("CLEANUP_PLAN_READY planId={} mode={} groups={} deleteCandidates={} reclaimableBytes={}",
                plan.getPlanId(), effectiveMode, groups.size(), plan.deleteCandidateCount(), plan.reclaimableBytes());
        return plan;
    }

    public CleanupPlan getPlan(String planId) {
        evictExpiredPlans();
        CleanupPlan plan = pendingPlans.get(planId);
        if (plan == null) {
            throw new BusinessException("404", "Cleanup plan not found or expired: " + planId,
                    "Create a new plan");
        }
        return plan;
    }

    public Path exportPlan(String planId) {
        CleanupPlan plan = getPlan(planId);
        try {
            return cleanupReportWriter.writePlan(plan, reportDir());
        } catch (IOException e) {
            throw new BusinessException("500", "Cannot write plan export: " + e.getMessage());
        }
    }

    public CleanupReport execute(String planId, String confirmation, List<ReviewDecision> decisions,
                                 String backupDir, boolean dryRun, BooleanSupplier cancelSignal) {
        CleanupPlan plan = pendingPlans.remove(planId);
        if (plan == null) {
            throw new BusinessException("404", "Cleanup plan not found or expired: " + planId,
                    "Create a new plan");
        }
        long startMs = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        CleanupReport report = newReport(plan);
        CleanupStatus finalStatus = null;
        try {
            if (!appCleanupProperties.getConfirmationPhrase().equals(confirmation)) {
                log.info("CLEANUP_NOT_CONFIRMED planId={}", planId);
                return cancelled(report, "Confirmation phrase did not match; nothing was changed", startMs);
            }
            // decisions apply to this attempt only; the pending plan keeps its automatic review
            CleanupPlan reviewed = plan.copy();
            applyDecisions(reviewed, decisions);
            Path backupRoot = Paths.get(backupDir == null || backupDir.trim().isEmpty()
                    ? appCleanupProperties.getBackupDir() : backupDir.trim()).toAbsolutePath().normalize();

            List<LibraryFileEntity> batch = new ArrayList<>();
            List<DuplicateGroup> approved = validate(reviewed, backupRoot, report, batch);
            eventSink.onPhaseComplete(OPERATION, CleanupPhase.VALIDATING.name());
            if (batch.isEmpty()) {
                report.setStatus(CleanupStatus.NOTHING_TO_DELETE);
                report.setMessage("No group passed validation");
                return finish(report, startMs, startNanos);
            }
            ValidationCheck space = deletionSafetyValidator.spaceCheck(totalSize(batch), backupRoot);
            if (!space.isPassed()) {
                log.warn("CLEANUP_BACKUP_SPACE_LOW planId={} detail={}", planId, space.getMessage());
                report.setMessage(space.getMessage());
            }
            if (dryRun) {
                recordActions(approved, FileActionType.WOULD_DELETE, report, "dry run");
                report.setStatus(CleanupStatus.DRY_RUN);
                return finish(report, startMs, startNanos);
            }
            if (cancelSignal.getAsBoolean()) {
                return cancelled(report, "Cancelled before backup", startMs);
            }

            BackupManifest manifest;
            try {
                manifest = backupService.backup(batch, backupRoot, cancelSignal);
            } catch (BackupException e) {
                log.error("CLEANUP_BACKUP_FAILED planId={} failedPath={} reason={}",
                        planId, e.getFailedPath(), e.getMessage());
                recordActions(approved, FileActionType.SKIPPED, report, "backup failed, nothing deleted");
                report.setStatus(CleanupStatus.BACKUP_FAILED);
                report.setMessage(e.getMessage());
                finalStatus = CleanupStatus.BACKUP_FAILED;
                return finish(report, startMs, startNanos);
            } catch (CancellationException e) {
                return cancelled(report, e.getMessage(), startMs);
            }
            report.setBackupManifestPath(Paths.get(manifest.getBackupDir(), BackupService.MANIFEST_FILE).toString());
            eventSink.onPhaseComplete(OPERATION, CleanupPhase.BACKING_UP.name());

            delete(approved, manifest, report);
            eventSink.onPhaseComplete(OPERATION, CleanupPhase.DELETING.name());
            report.setStatus(report.getFailedCount() > 0 ? CleanupStatus.PARTIAL_SUCCESS : CleanupStatus.COMPLETED);
            finalStatus = report.getStatus();
            return finish(report, startMs, startNanos);
        } finally {
            boolean consumed = finalStatus == CleanupStatus.COMPLETED || finalStatus == CleanupStatus.PARTIAL_SUCCESS;
            if (!consumed) {
                // the plan stays available for another attempt
                pendingPlans.put(planId, plan);
            }
        }
    }

    /**
     * Ranks members and designates the keeper; {@code keeperId} overrides the automatic choice.
     */
    void review(DuplicateGroup group, Long keeperId) {
        List<LibraryFileEntity> ranked = qualityScorer.rank(group.getMembers());
        group.getScores().clear();
        for (LibraryFileEntity member : ranked) {
            group.getScores().put(member.getId(), qualityScorer.score(member));
        }
        LibraryFileEntity keeper = ranked.get(0);
        if (keeperId != null) {
            keeper = null;
            for (LibraryFileEntity member : ranked) {
                if (keeperId.equals(member.getId())) {
                    keeper = member;
                }
            }
            if (keeper == null) {
                throw new BusinessException("400", "Keeper " + keeperId + " is not a member of group "
                        + group.getGroupId());
            }
        }
        List<LibraryFileEntity> deleteCandidates = new ArrayList<>();
        for (LibraryFileEntity member : ranked) {
            if (member != keeper) {
                deleteCandidates.add(member);
            }
        }
        group.setMembers(ranked);
        group.setKeeper(keeper);
        group.setDeleteCandidates(deleteCandidates);
    }

    private void applyDecisions(CleanupPlan plan, List<ReviewDecision> decisions) {
        if (decisions == null) {
            return;
        }
        for (ReviewDecision decision : decisions) {
            DuplicateGroup group = plan.findGroup(decision.getGroupId());
            if (group == null) {
                throw new BusinessException("400", "Unknown group " + decision.getGroupId() + " in review decisions");
            }
            if (decision.isKeepAll()) {
                group.setExcluded(true);
            } else if (decision.getKeeperId() != null) {
                group.setExcluded(false);
                review(group, decision.getKeeperId());
            }
        }
    }

    private List<DuplicateGroup> validate(CleanupPlan plan, Path backupRoot, CleanupReport report,
                                          List<LibraryFileEntity> batch) {
        List<DuplicateGroup> approved = new ArrayList<>();
        for (DuplicateGroup group : plan.getGroups()) {
            if (group.isExcluded()) {
                report.setSkippedGroupCount(report.getSkippedGroupCount() + 1);
                recordGroup(group, FileActionType.SKIPPED, report, "kept by review");
                continue;
            }
            GroupValidation validation = deletionSafetyValidator.validate(group, backupRoot);
            report.getValidations().add(validation);
            boolean passed = validation.isPassed();
            eventSink.onGroupValidated(group.getGroupId(), passed,
                    passed ? "ok" : String.join("; ", validation.failureMessages()));
            if (!passed) {
                report.setSkippedGroupCount(report.getSkippedGroupCount() + 1);
                recordGroup(group, FileActionType.SKIPPED, report,
                        "validation failed: " + String.join("; ", validation.failureMessages()));
                continue;
            }
            approved.add(group);
            batch.addAll(group.getDeleteCandidates());
        }
        report.setValidatedGroupCount(approved.size());
        return approved;
    }

    private void delete(List<DuplicateGroup> approved, BackupManifest manifest, CleanupReport report) {
        int processed = 0;
        int total = 0;
        for (DuplicateGroup group : approved) {
            total += group.getDeleteCandidates().size();
        }
        for (DuplicateGroup group : approved) {
            report.getActions().add(action(group, group.getKeeper(), FileActionType.KEEP, null));
            for (LibraryFileEntity candidate : group.getDeleteCandidates()) {
                processed++;
                Path path = Paths.get(candidate.getFilePath());
                if (!manifest.covers(path.toString())) {
                    report.setFailedCount(report.getFailedCount() + 1);
                    report.getActions().add(action(group, candidate, FileActionType.SKIPPED, "no backup entry"));
                    continue;
                }
                try {
                    fileStore.delete(path);
                } catch (IOException e) {
                    log.warn("CLEANUP_DELETE_FAILED path={} reason={}", path, e.getMessage());
                    report.setFailedCount(report.getFailedCount() + 1);
                    report.getActions().add(action(group, candidate, FileActionType.DELETE_FAILED, e.getMessage()));
                    incrementCounter("curator.cleanup.files", "action", FileActionType.DELETE_FAILED.name());
                    eventSink.onFileProcessed(OPERATION, path.toString(), "FAILED", processed, total);
                    continue;
                }
                libraryCatalog.markInactive(candidate.getId());
                report.setDeletedCount(report.getDeletedCount() + 1);
                report.setBytesRecovered(report.getBytesRecovered() + sizeOf(candidate));
                report.getActions().add(action(group, candidate, FileActionType.DELETE, null));
                incrementCounter("curator.cleanup.files", "action", FileActionType.DELETE.name());
                eventSink.onFileProcessed(OPERATION, path.toString(), "DELETED", processed, total);
            }
        }
    }

    private CleanupReport finish(CleanupReport report, long startMs, long startNanos) {
        report.setDurationMs(System.currentTimeMillis() - startMs);
        Path reportDir = reportDir();
        try {
            report.setCsvReportPath(cleanupReportWriter.writeCsv(report, reportDir).toString());
            report.setJsonReportPath(cleanupReportWriter.writeJson(report, reportDir).toString());
        } catch (IOException e) {
            log.warn("CLEANUP_REPORT_WRITE_FAILED dir={} reason={}", reportDir, e.getMessage());
        }
        eventSink.onPhaseComplete(OPERATION, CleanupPhase.REPORTING.name());
        eventSink.onPhaseComplete(OPERATION, CleanupPhase.DONE.name());
        recordDuration("curator.cleanup.duration", System.nanoTime() - startNanos);
        log.info("CLEANUP_FINISH planId={} status={} groups={} validated={} skippedGroups={} deleted={} failed={} "
                        + "bytesRecovered={} costMs={}",
                report.getPlanId(), report.getStatus(), report.getGroupCount(), report.getValidatedGroupCount(),
                report.getSkippedGroupCount(), report.getDeletedCount(), report.getFailedCount(),
                report.getBytesRecovered(), report.getDurationMs());
        return report;
    }

    private CleanupReport cancelled(CleanupReport report, String message, long startMs) {
        report.setStatus(CleanupStatus.CANCELLED);
        report.setMessage(message);
        report.setDurationMs(System.currentTimeMillis() - startMs);
        eventSink.onPhaseComplete(OPERATION, CleanupPhase.CANCELLED.name());
        log.info("CLEANUP_CANCELED planId={} reason={}", report.getPlanId(), message);
        return report;
    }

    private CleanupReport newReport(CleanupPlan plan) {
        CleanupReport report = new CleanupReport();
        report.setPlanId(plan.getPlanId());
        report.setMode(plan.getMode());
        report.setGroupCount(plan.getGroups().size());
        return report;
    }

    private void recordActions(List<DuplicateGroup> groups, FileActionType candidateAction, CleanupReport report,
                               String message) {
        for (DuplicateGroup group : groups) {
            recordGroup(group, candidateAction, report, message);
        }
    }

    private void recordGroup(DuplicateGroup group, FileActionType candidateAction, CleanupReport report,
                             String message) {
        if (group.getKeeper() != null) {
            report.getActions().add(action(group, group.getKeeper(), FileActionType.KEEP, null));
        }
        for (LibraryFileEntity candidate : group.getDeleteCandidates()) {
            report.getActions().add(action(group, candidate, candidateAction, message));
        }
    }

    private FileAction action(DuplicateGroup group, LibraryFileEntity file, FileActionType type, String message) {
        QualityScore score = group.scoreOf(file);
        FileAction action = new FileAction();
        action.setGroupId(group.getGroupId());
        action.setAction(type);
        action.setFilePath(file.getFilePath());
        action.setFormat(file.getFileFormat());
        action.setQualityScore(score == null ? qualityScorer.score(file).getTotal() : score.getTotal());
        action.setFileSizeBytes(sizeOf(file));
        action.setBitrateType(bitrateType(file));
        action.setSampleRate(file.getSampleRate());
        action.setMessage(message);
        return action;
    }

    private String bitrateType(LibraryFileEntity file) {
        if (qualityScorer.isLossless(file)) {
            return "Lossless";
        }
        if (file.variableBitrate()) {
            return "VBR";
        }
        return file.getBitrate() == null ? "Unknown" : "CBR";
    }

    private long totalSize(List<LibraryFileEntity> files) {
        long total = 0L;
        for (LibraryFileEntity file : files) {
            total += sizeOf(file);
        }
        return total;
    }

    private long sizeOf(LibraryFileEntity file) {
        return file.getFileSize() == null ? 0L : file.getFileSize();
    }

    private Path reportDir() {
        return Paths.get(appCleanupProperties.getReportDir()).toAbsolutePath().normalize();
    }

    private void evictExpiredPlans() {
        long cutoff = System.currentTimeMillis() - TimeUnit.MINUTES.toMillis(appCleanupProperties.getPlanTtlMinutes());
        Iterator<Map.Entry<String, CleanupPlan>> iterator = pendingPlans.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, CleanupPlan> entry = iterator.next();
            if (entry.getValue().getCreatedAt() < cutoff) {
                iterator.remove();
                log.debug("CLEANUP_PLAN_EXPIRED planId={}", entry.getKey());
            }
        }
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }
}
