package com.example.musiccurator.application.service;

import com.example.musiccurator.application.event.CurationEventSink;
import com.example.musiccurator.common.config.AppVetProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.enumtype.VettingPhase;
import com.example.musiccurator.domain.model.ExportOptions;
import com.example.musiccurator.domain.model.FileError;
import com.example.musiccurator.domain.model.MatchVerdict;
import com.example.musiccurator.domain.model.VettedFile;
import com.example.musiccurator.domain.model.VettingResult;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Classifies an import folder against the catalog as new, duplicate or uncertain. The only
 * catalog write is the session row saved at the end of the run.
 */
@Service
public class VettingService {

    private static final Logger log = LoggerFactory.getLogger(VettingService.class);

    private static final String OPERATION = "vet";

    private final LibraryCatalog libraryCatalog;
    private final AudioFileScanner audioFileScanner;
    private final AudioFileInspector audioFileInspector;
    private final DuplicateMatcher duplicateMatcher;
    private final VettingExportWriter vettingExportWriter;
    private final ExecutorService curatorWorkerExecutor;
    private final CurationEventSink eventSink;
    private final AppVetProperties appVetProperties;
    private final MeterRegistry meterRegistry;

    public VettingService(LibraryCatalog libraryCatalog,
                          AudioFileScanner audioFileScanner,
                          AudioFileInspector audioFileInspector,
                          DuplicateMatcher duplicateMatcher,
                          VettingExportWriter vettingExportWriter,
                          ExecutorService curatorWorkerExecutor,
                          CurationEventSink eventSink,
                          AppVetProperties appVetProperties,
                          ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryCatalog = libraryCatalog;
        this.audioFileScanner = audioFileScanner;
        this.audioFileInspector = audioFileInspector;
        this.duplicateMatcher = duplicateMatcher;
        this.vettingExportWriter = vettingExportWriter;
        this.curatorWorkerExecutor = curatorWorkerExecutor;
        this.eventSink = eventSink;
        this.appVetProperties = appVetProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public ExportOptions defaultExportOptions() {
        return new ExportOptions(appVetProperties.isExportNew(), appVetProperties.isExportDuplicates(),
                appVetProperties.isExportUncertain());
    }

    public VettingResult vet(String folder, Double threshold, ExportOptions exportOptions) {
        return vet(folder, threshold, exportOptions, () -> false);
    }

    public VettingResult vet(String folder, Double threshold, ExportOptions exportOptions,
                             BooleanSupplier cancelSignal) {
        double effectiveThreshold = threshold == null ? appVetProperties.getThreshold() : threshold;
        if (effectiveThreshold < 0D || effectiveThreshold > 1D) {
            throw new BusinessException("400", "Threshold must be between 0 and 1");
        }
        ExportOptions exports = exportOptions == null ? defaultExportOptions() : exportOptions;
        long startMs = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        VettingResult result = new VettingResult();

        result.setPhase(VettingPhase.SCANNING);
        Path importDir = audioFileScanner.resolveDirectory(folder);
        List<Path> files;
        try {
            files = audioFileScanner.scan(importDir, result.getErrors());
        } catch (IOException e) {
            throw new BusinessException("500", "Unable to scan import folder: " + e.getMessage(),
                    "Check folder permissions");
        }
        log.info("VET_START folder={} files={} threshold={}", importDir, files.size(), effectiveThreshold);
        eventSink.onPhaseComplete(OPERATION, VettingPhase.SCANNING.name());

        result.setPhase(VettingPhase.MATCHING);
        List<Future<FileVerdict>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(curatorWorkerExecutor.submit(() -> classify(file, effectiveThreshold, cancelSignal)));
        }
        int processed = 0;
        try {
            for (Future<FileVerdict> future : futures) {
                FileVerdict verdict = future.get();
                if (verdict.skipped) {
                    result.setCancelled(true);
                    continue;
                }
                processed++;
                collect(verdict, result);
                eventSink.onFileProcessed(OPERATION, verdict.path,
                        verdict.error != null ? "FAILED" : verdict.verdict.getStatus().name(), processed, files.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.setCancelled(true);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                // catalog failures are fatal for the whole run
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Vetting worker failed", e.getCause());
        } finally {
            for (Future<FileVerdict> future : futures) {
                future.cancel(true);
            }
        }
        if (result.isCancelled()) {
            result.setDurationMs(System.currentTimeMillis() - startMs);
            log.info("VET_CANCELED folder={} processed={}", importDir, processed);
            return result;
        }
        eventSink.onPhaseComplete(OPERATION, VettingPhase.MATCHING.name());

        result.setPhase(VettingPhase.SUMMARIZING);
        VettingSessionEntity session = new VettingSessionEntity();
        session.setImportFolder(importDir.toString());
        session.setScannedAt(System.currentTimeMillis());
        session.setNewCount(result.getNewFiles().size());
        session.setDuplicateCount(result.getDuplicates().size());
        session.setUncertainCount(result.getUncertain().size());
        session.setFileCount(session.getNewCount() + session.getDuplicateCount() + session.getUncertainCount());
        session.setThresholdUsed(effectiveThreshold);
        result.setSession(libraryCatalog.saveVettingSession(session));
        writeExports(importDir, exports, result);
        eventSink.onPhaseComplete(OPERATION, VettingPhase.SUMMARIZING.name());

        result.setPhase(VettingPhase.DONE);
        result.setDurationMs(System.currentTimeMillis() - startMs);
        recordDuration("curator.vet.duration", System.nanoTime() - startNanos);
        eventSink.onPhaseComplete(OPERATION, VettingPhase.DONE.name());
        log.info("VET_FINISH folder={} sessionId={} new={} duplicates={} uncertain={} errors={} costMs={}",
                importDir, session.getId(), session.getNewCount(), session.getDuplicateCount(),
                session.getUncertainCount(), result.getErrorCount(), result.getDurationMs());
        return result;
    }

    public List<VettingSessionEntity> history(Integer limit) {
        int effectiveLimit = limit == null ? appVetProperties.getHistoryDefaultLimit() : limit;
        return libraryCatalog.findVettingHistory(effectiveLimit);
    }

    private FileVerdict classify(Path file, double threshold, BooleanSupplier cancelSignal) {
        if (cancelSignal.getAsBoolean()) {
            return FileVerdict.skipped(file);
        }
        try {
            AudioFileInspector.Inspection inspection = audioFileInspector.inspect(file);
            return FileVerdict.matched(file, duplicateMatcher.match(inspection.getRecord(), threshold));
        } catch (IOException e) {
            return FileVerdict.failed(file, e);
        }
    }

    private void collect(FileVerdict verdict, VettingResult result) {
        if (verdict.error != null) {
            log.warn("VET_FILE_FAILED path={} reason={}", verdict.path, verdict.error.getMessage());
            result.getErrors().add(new FileError(verdict.path, verdict.error.getMessage()));
            incrementCounter("curator.vet.files", "status", "ERROR");
            return;
        }
        VettedFile vetted = VettedFile.of(verdict.path, verdict.verdict);
        switch (verdict.verdict.getStatus()) {
            case DUPLICATE:
                result.getDuplicates().add(vetted);
                break;
            case UNCERTAIN:
                result.getUncertain().add(vetted);
                break;
            default:
                result.getNewFiles().add(vetted);
                break;
        }
        incrementCounter("curator.vet.files", "status", verdict.verdict.getStatus().name());
    }

    private void writeExports(Path importDir, ExportOptions exports, VettingResult result) {
        if (!exports.any()) {
            return;
        }
        Path exportDir = Paths.get(appVetProperties.getExportDir()).toAbsolutePath().normalize();
        Path folderName = importDir.getFileName();
        String name = folderName == null ? "root" : folderName.toString();
        LocalDateTime now = LocalDateTime.now();
        if (exports.isExportNew()) {
            export(exportDir, "new_songs", "New Songs", name, result.getNewFiles(), now, result);
        }
        if (exports.isExportDuplicates()) {
            export(exportDir, "duplicates", "Duplicates", name, result.getDuplicates(), now, result);
        }
        if (exports.isExportUncertain()) {
            export(exportDir, "uncertain", "Uncertain Matches", name, result.getUncertain(), now, result);
        }
    }

    private void export(Path exportDir, String prefix, String heading, String folderName,
                        List<VettedFile> files, LocalDateTime now, VettingResult result) {
        try {
            Path written = vettingExportWriter.write(exportDir, prefix, heading, folderName, files, now);
            result.getExportedFiles().add(written.toString());
        } catch (IOException e) {
            log.warn("VET_EXPORT_FAILED kind={} dir={} reason={}", prefix, exportDir, e.getMessage());
            result.getExportFailures().add(prefix + ": " + e.getMessage());
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

    private static final class FileVerdict {

        private final String path;
        private final MatchVerdict verdict;
        private final IOException error;
        private final boolean skipped;

        private FileVerdict(String path, MatchVerdict verdict, IOException error, boolean skipped) {
            this.path = path;
            this.verdict = verdict;
            this.error = error;
            this.skipped = skipped;
        }

        static FileVerdict matched(Path file, MatchVerdict verdict) {
            return new FileVerdict(file.toString(), verdict, null, false);
        }

        static FileVerdict failed(Path file, IOException error) {
            return new FileVerdict(file.toString(), null, error, false);
        }

        static FileVerdict skipped(Path file) {
            return new FileVerdict(file.toString(), null, null, true);
        }
    }
}
