package com.example.musiccurator.application.service;

import com.example.musiccurator.application.event.CurationEventSink;
import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.enumtype.UpsertOutcome;
import com.example.musiccurator.domain.model.FileError;
import com.example.musiccurator.domain.model.IndexResult;
import com.example.musiccurator.domain.model.UpsertResult;
import com.example.musiccurator.domain.model.VerifyResult;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Walks a library folder and keeps the catalog in step with it.
 * <p>
 * Extraction and hashing run on the shared worker pool; every catalog write happens on the calling
 * thread, which drains finished work through a {@link CompletionService}.
 */
@Service
public class LibraryIndexService {

    private static final Logger log = LoggerFactory.getLogger(LibraryIndexService.class);

    private static final String OPERATION_INDEX = "index";
    private static final String OPERATION_VERIFY = "verify";

    private final LibraryCatalog libraryCatalog;
    private final AudioFileScanner audioFileScanner;
    private final AudioFileInspector audioFileInspector;
    private final ExecutorService curatorWorkerExecutor;
    private final CurationEventSink eventSink;
    private final int maxInFlight;
    private final MeterRegistry meterRegistry;

    public LibraryIndexService(LibraryCatalog libraryCatalog,
                               AudioFileScanner audioFileScanner,
                               AudioFileInspector audioFileInspector,
                               ExecutorService curatorWorkerExecutor,
                               CurationEventSink eventSink,
                               AppLibraryProperties appLibraryProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryCatalog = libraryCatalog;
        this.audioFileScanner = audioFileScanner;
        this.audioFileInspector = audioFileInspector;
        this.curatorWorkerExecutor = curatorWorkerExecutor;
        this.eventSink = eventSink;
        this.maxInFlight = Math.max(2, appLibraryProperties.effectiveWorkerThreads() * 4);
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public IndexResult index(String path, boolean rescan, boolean incremental) {
        return index(path, rescan, incremental, () -> false);
    }

    /**
     * @param rescan      re-extract and rewrite every file, even unchanged ones
     * @param incremental skip extraction for files whose mtime and size match the catalog
     */
    public IndexResult index(String path, boolean rescan, boolean incremental, BooleanSupplier cancelSignal) {
        Path root = audioFileScanner.resolveDirectory(path);
        long startMs = System.currentTimeMillis();
        long startNanos = System.nanoTime();
        IndexResult result = new IndexResult();
        result.setRoot(root.toString());

        List<Path> files;
        try {
            files = audioFileScanner.scan(root, result.getErrors());
        } catch (IOException e) {
            throw new BusinessException("500", "Unable to scan library folder: " + e.getMessage(),
                    "Check folder permissions");
        }
        result.setTotalFiles(files.size());
        result.setFailed(result.getErrors().size());
        log.info("INDEX_START root={} files={} rescan={} incremental={}", root, files.size(), rescan, incremental);
        eventSink.onPhaseComplete(OPERATION_INDEX, "SCANNING");

        CompletionService<ExtractionOutcome> completionService = new ExecutorCompletionService<>(curatorWorkerExecutor);
        List<Future<ExtractionOutcome>> futures = new ArrayList<>();
        int inFlight = 0;
        int processed = 0;
        try {
            for (Path file : files) {
                if (cancelSignal.getAsBoolean()) {
                    result.setCancelled(true);
                    log.info("INDEX_CANCELED root={} processed={}", root, processed);
                    break;
                }
                if (incremental && !rescan && refreshIfUnchanged(file, result)) {
                    processed++;
                    eventSink.onFileProcessed(OPERATION_INDEX, file.toString(), UpsertOutcome.UNCHANGED.name(),
                            processed, files.size());
                    continue;
                }
                futures.add(completionService.submit(() -> extract(file)));
                inFlight++;
                if (inFlight >= maxInFlight) {
                    processed += write(completionService.take(), rescan, result, processed, files.size());
                    inFlight--;
                }
            }
            while (inFlight > 0) {
                processed += write(completionService.take(), rescan, result, processed, files.size());
                inFlight--;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.setCancelled(true);
            log.warn("INDEX_INTERRUPTED root={} processed={}", root, processed);
        } finally {
            for (Future<ExtractionOutcome> future : futures) {
                future.cancel(true);
            }
        }

        result.setDurationMs(System.currentTimeMillis() - startMs);
        libraryCatalog.recordIndexRun(System.currentTimeMillis(), result.getDurationMs());
        eventSink.onPhaseComplete(OPERATION_INDEX, "DONE");
        recordDuration("curator.index.duration", System.nanoTime() - startNanos);
        log.info("INDEX_FINISH root={} total={} added={} updated={} unchanged={} failed={} metadataErrors={} "
                        + "cancelled={} costMs={}",
                root, result.getTotalFiles(), result.getAdded(), result.getUpdated(), result.getUnchanged(),
                result.getFailed(), result.getMetadataErrors(), result.isCancelled(), result.getDurationMs());
        return result;
    }

    /**
     * Marks catalog rows under {@code path} whose file no longer exists as inactive. A blank path
     * verifies the whole catalog.
     */
    public VerifyResult verify(String path) {
        List<LibraryFileEntity> rows;
        if (path == null || path.trim().isEmpty()) {
            rows = libraryCatalog.findActive();
        } else {
            String prefix = Paths.get(path.trim()).toAbsolutePath().normalize().toString();
            if (!prefix.endsWith(File.separator)) {
                prefix = prefix + File.separator;
            }
            rows = libraryCatalog.findUnderPath(prefix, true);
        }
        log.info("VERIFY_START path={} rows={}", path, rows.size());

        List<Long> missingIds = new ArrayList<>();
        int checked = 0;
        for (LibraryFileEntity row : rows) {
            checked++;
            boolean exists = Files.isRegularFile(Paths.get(row.getFilePath()));
            if (!exists) {
                missingIds.add(row.getId());
                log.debug("VERIFY_MISSING path={}", row.getFilePath());
            }
            eventSink.onFileProcessed(OPERATION_VERIFY, row.getFilePath(), exists ? "PRESENT" : "MISSING",
                    checked, rows.size());
        }
        int marked = libraryCatalog.markInactive(missingIds);
        eventSink.onPhaseComplete(OPERATION_VERIFY, "DONE");
        log.info("VERIFY_FINISH path={} checked={} missing={} markedInactive={}",
                path, checked, missingIds.size(), marked);
        return new VerifyResult(checked, missingIds.size(), marked);
    }

    private boolean refreshIfUnchanged(Path file, IndexResult result) {
        LibraryFileEntity existing = libraryCatalog.findByPath(file.toString());
        if (existing == null) {
            return false;
        }
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            // let the extraction path record the failure
            return false;
        }
        LibraryFileEntity fingerprint = new LibraryFileEntity();
        fingerprint.setFilePath(existing.getFilePath());
        fingerprint.setFileMtime(attributes.lastModifiedTime().toMillis());
        fingerprint.setFileSize(attributes.size());
        if (!sameFingerprint(existing, fingerprint)) {
            return false;
        }
        fingerprint.setLastVerified(System.currentTimeMillis());
        libraryCatalog.upsertFile(fingerprint);
        result.setUnchanged(result.getUnchanged() + 1);
        incrementCounter("curator.index.files", "outcome", UpsertOutcome.UNCHANGED.name());
        return true;
    }

    static boolean sameFingerprint(LibraryFileEntity stored, LibraryFileEntity current) {
        return stored.getFileMtime() != null && stored.getFileMtime().equals(current.getFileMtime())
                && stored.getFileSize() != null && stored.getFileSize().equals(current.getFileSize());
    }

    private ExtractionOutcome extract(Path file) {
        try {
            return ExtractionOutcome.success(file, audioFileInspector.inspect(file));
        } catch (IOException e) {
            return ExtractionOutcome.failure(file, e);
        }
    }

    private int write(Future<ExtractionOutcome> future, boolean rescan, IndexResult result,
                      int processed, int total) throws InterruptedException {
        ExtractionOutcome outcome;
        try {
            outcome = future.get();
        } catch (ExecutionException e) {
            result.setFailed(result.getFailed() + 1);
            result.getErrors().add(new FileError(null, "Extraction crashed: " + e.getCause()));
            log.warn("INDEX_WORKER_FAILED", e.getCause());
            return 1;
        }
        String path = outcome.file.toString();
        if (outcome.error != null) {
            result.setFailed(result.getFailed() + 1);
            result.getErrors().add(new FileError(path, outcome.error.getMessage()));
            log.warn("INDEX_FILE_FAILED path={} reason={}", path, outcome.error.getMessage());
            incrementCounter("curator.index.files", "outcome", "FAILED");
            eventSink.onFileProcessed(OPERATION_INDEX, path, "FAILED", processed + 1, total);
            return 1;
        }
        if (outcome.inspection.isMetadataError()) {
            result.setMetadataErrors(result.getMetadataErrors() + 1);
        }
        LibraryFileEntity record = outcome.inspection.getRecord();
        UpsertResult upsert = rescan ? libraryCatalog.replaceFile(record) : libraryCatalog.upsertFile(record);
        switch (upsert.getOutcome()) {
            case INSERTED:
                result.setAdded(result.getAdded() + 1);
                break;
            case UPDATED:
                result.setUpdated(result.getUpdated() + 1);
                break;
            default:
                result.setUnchanged(result.getUnchanged() + 1);
                break;
        }
        incrementCounter("curator.index.files", "outcome", upsert.getOutcome().name());
        eventSink.onFileProcessed(OPERATION_INDEX, path, upsert.getOutcome().name(), processed + 1, total);
        return 1;
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

    private static final class ExtractionOutcome {

        private final Path file;
        private final AudioFileInspector.Inspection inspection;
        private final IOException error;

        private ExtractionOutcome(Path file, AudioFileInspector.Inspection inspection, IOException error) {
            this.file = file;
            this.inspection = inspection;
            this.error = error;
        }

        static ExtractionOutcome success(Path file, AudioFileInspector.Inspection inspection) {
            return new ExtractionOutcome(file, inspection, null);
        }

        static ExtractionOutcome failure(Path file, IOException error) {
            return new ExtractionOutcome(file, null, error);
        }
    }
}
