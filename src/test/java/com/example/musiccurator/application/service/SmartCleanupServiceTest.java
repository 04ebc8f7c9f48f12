package com.example.musiccurator.application.service;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccurator.application.event.CurationEventSink;
import com.example.musiccurator.application.service.similarity.RatcliffObershelpSimilarity;
import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.common.config.AppMatchProperties;
import com.example.musiccurator.common.config.AppQualityProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.CleanupStatus;
import com.example.musiccurator.domain.enumtype.FileActionType;
import com.example.musiccurator.domain.model.CleanupPlan;
import com.example.musiccurator.domain.model.CleanupReport;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.domain.model.FileAction;
import com.example.musiccurator.domain.model.ReviewDecision;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.storage.FileStore;
import com.example.musiccurator.infrastructure.storage.LocalFileStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class SmartCleanupServiceTest {

    private static final String PHRASE = "DELETE DUPLICATES";

    @TempDir
    Path tempDir;

    private LibraryCatalog catalog;
    private AppCleanupProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private final List<LibraryFileEntity> rows = new ArrayList<>();

    @BeforeEach
    void setUp() {
        catalog = mock(LibraryCatalog.class);
        when(catalog.findActiveSharingMetadataHash()).thenReturn(rows);
        properties = new AppCleanupProperties();
        properties.setBackupDir(tempDir.resolve("backups").toString());
        properties.setReportDir(tempDir.resolve("reports").toString());
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void shouldKeepFlacAndDeleteMp3AfterBackup() throws Exception {
        LibraryFileEntity flac = file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());

        CleanupPlan plan = service.plan(CleanupMode.FAST);
        Assertions.assertEquals(1, plan.getGroups().size());
        DuplicateGroup group = plan.getGroups().get(0);
        Assertions.assertSame(flac, group.getKeeper());
        Assertions.assertEquals(Collections.singletonList(mp3), group.getDeleteCandidates());

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.COMPLETED, report.getStatus());
        Assertions.assertEquals(1, report.getDeletedCount());
        Assertions.assertEquals(1000L, report.getBytesRecovered());
        Assertions.assertTrue(Files.exists(Paths.get(flac.getFilePath())));
        Assertions.assertFalse(Files.exists(Paths.get(mp3.getFilePath())));
        verify(catalog).markInactive(2L);
        verify(catalog, never()).markInactive(1L);

        Path manifest = Paths.get(report.getBackupManifestPath());
        Assertions.assertTrue(Files.exists(manifest));
        Assertions.assertTrue(Files.exists(manifest.getParent().resolve("A.mp3")));
        Assertions.assertTrue(Files.exists(Paths.get(report.getCsvReportPath())));
        Assertions.assertTrue(Files.exists(Paths.get(report.getJsonReportPath())));
        List<String> csv = Files.readAllLines(Paths.get(report.getCsvReportPath()));
        Assertions.assertTrue(csv.get(0).contains("Quality Score"));
        Assertions.assertEquals(1.0D, meterRegistry.counter("curator.cleanup.files", "action", "DELETE").count());
    }

    @Test
    void backupFailureOnLastFileShouldDeleteNothing() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity firstMp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        file(3L, "B.flac", "flac", 1000, "hash-b", 4000);
        LibraryFileEntity lastMp3 = file(4L, "B.mp3", "mp3", 128, "hash-b", 1000);
        FileStore failingStore = new LocalFileStore() {
            @Override
            public void copy(Path source, Path target) throws IOException {
                if (source.getFileName().toString().equals("B.mp3")) {
                    throw new IOException("disk full");
                }
                super.copy(source, target);
            }
        };
        SmartCleanupService service = service(failingStore);
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.BACKUP_FAILED, report.getStatus());
        Assertions.assertEquals(0, report.getDeletedCount());
        Assertions.assertTrue(Files.exists(Paths.get(firstMp3.getFilePath())));
        Assertions.assertTrue(Files.exists(Paths.get(lastMp3.getFilePath())));
        verify(catalog, never()).markInactive(anyLong());
        Assertions.assertSame(plan, service.getPlan(plan.getPlanId()));
    }

    @Test
    void deleteFailureShouldNotStopRemainingDeletions() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity deletable = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        file(3L, "B.flac", "flac", 1000, "hash-b", 4000);
        LibraryFileEntity locked = file(4L, "B.mp3", "mp3", 128, "hash-b", 1000);
        FileStore lockingStore = new LocalFileStore() {
            @Override
            public void delete(Path path) throws IOException {
                if (path.getFileName().toString().equals("B.mp3")) {
                    throw new IOException("file is locked");
                }
                super.delete(path);
            }
        };
        SmartCleanupService service = service(lockingStore);
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.PARTIAL_SUCCESS, report.getStatus());
        Assertions.assertEquals(1, report.getDeletedCount());
        Assertions.assertEquals(1, report.getFailedCount());
        Assertions.assertFalse(Files.exists(Paths.get(deletable.getFilePath())));
        Assertions.assertTrue(Files.exists(Paths.get(locked.getFilePath())));
        Assertions.assertTrue(containsAction(report, deletable.getFilePath(), FileActionType.DELETE));
        Assertions.assertTrue(containsAction(report, locked.getFilePath(), FileActionType.DELETE_FAILED));
        verify(catalog).markInactive(2L);
        verify(catalog, never()).markInactive(4L);
        Assertions.assertEquals(1.0D,
                meterRegistry.counter("curator.cleanup.files", "action", "DELETE_FAILED").count());
    }

    @Test
    void cancelBeforeBackupShouldLeaveFilesAndBackupRootUntouched() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, false, () -> true);

        Assertions.assertEquals(CleanupStatus.CANCELLED, report.getStatus());
        Assertions.assertEquals(0, report.getDeletedCount());
        Assertions.assertTrue(Files.exists(Paths.get(mp3.getFilePath())));
        Assertions.assertFalse(Files.exists(tempDir.resolve("backups")));
        Assertions.assertNull(report.getBackupManifestPath());
        verify(catalog, never()).markInactive(anyLong());
        Assertions.assertSame(plan, service.getPlan(plan.getPlanId()));
    }

    @Test
    void decisionsFromCancelledAttemptShouldNotCarryOver() throws Exception {
        LibraryFileEntity flac = file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);
        List<ReviewDecision> keepMp3 = Collections.singletonList(new ReviewDecision(1, 2L, false));

        CleanupReport cancelled = service.execute(plan.getPlanId(), PHRASE, keepMp3, null, false, () -> true);
        Assertions.assertEquals(CleanupStatus.CANCELLED, cancelled.getStatus());
        DuplicateGroup pending = service.getPlan(plan.getPlanId()).getGroups().get(0);
        Assertions.assertSame(flac, pending.getKeeper());
        Assertions.assertFalse(pending.isExcluded());

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.COMPLETED, report.getStatus());
        Assertions.assertTrue(Files.exists(Paths.get(flac.getFilePath())));
        Assertions.assertFalse(Files.exists(Paths.get(mp3.getFilePath())));
    }

    @Test
    void wrongConfirmationShouldCancelWithoutTouchingFiles() throws Exception {
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        CleanupReport report = service.execute(plan.getPlanId(), "delete duplicates", null, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.CANCELLED, report.getStatus());
        Assertions.assertTrue(Files.exists(Paths.get(mp3.getFilePath())));
        Assertions.assertFalse(Files.exists(tempDir.resolve("backups")));
        verify(catalog, never()).markInactive(anyLong());
    }

    @Test
    void dryRunShouldReportWithoutBackupOrDeletion() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, null, null, true, () -> false);

        Assertions.assertEquals(CleanupStatus.DRY_RUN, report.getStatus());
        Assertions.assertTrue(Files.exists(Paths.get(mp3.getFilePath())));
        Assertions.assertNull(report.getBackupManifestPath());
        Assertions.assertTrue(containsAction(report, mp3.getFilePath(), FileActionType.WOULD_DELETE));
    }

    @Test
    void reviewDecisionsShouldOverrideKeeperOrSkipGroup() throws Exception {
        LibraryFileEntity flac = file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        LibraryFileEntity otherFlac = file(3L, "B.flac", "flac", 1000, "hash-b", 4000);
        LibraryFileEntity otherMp3 = file(4L, "B.mp3", "mp3", 128, "hash-b", 1000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);

        List<ReviewDecision> decisions = Arrays.asList(
                new ReviewDecision(1, 2L, false),
                new ReviewDecision(2, null, true));
        CleanupReport report = service.execute(plan.getPlanId(), PHRASE, decisions, null, false, () -> false);

        Assertions.assertEquals(CleanupStatus.COMPLETED, report.getStatus());
        Assertions.assertEquals(1, report.getSkippedGroupCount());
        Assertions.assertFalse(Files.exists(Paths.get(flac.getFilePath())));
        Assertions.assertTrue(Files.exists(Paths.get(mp3.getFilePath())));
        Assertions.assertTrue(Files.exists(Paths.get(otherFlac.getFilePath())));
        Assertions.assertTrue(Files.exists(Paths.get(otherMp3.getFilePath())));
    }

    @Test
    void keeperOverrideOutsideGroupShouldBeRejected() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());
        CleanupPlan plan = service.plan(CleanupMode.FAST);
        List<ReviewDecision> decisions = Collections.singletonList(new ReviewDecision(1, 99L, false));

        BusinessException e = Assertions.assertThrows(BusinessException.class,
                () -> service.execute(plan.getPlanId(), PHRASE, decisions, null, false, () -> false));
        Assertions.assertEquals("400", e.getCode());
    }

    @Test
    void everyGroupShouldKeepExactlyOneFile() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        file(2L, "A.mp3", "mp3", 320, "hash-a", 2000);
        file(3L, "A (1).mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());

        CleanupPlan plan = service.plan(CleanupMode.FAST);

        for (DuplicateGroup group : plan.getGroups()) {
            Assertions.assertNotNull(group.getKeeper());
            Assertions.assertFalse(group.getDeleteCandidates().contains(group.getKeeper()));
            Assertions.assertEquals(group.size() - 1, group.getDeleteCandidates().size());
        }
    }

    @Test
    void unknownPlanShouldBeRejected() {
        SmartCleanupService service = service(new LocalFileStore());

        BusinessException e = Assertions.assertThrows(BusinessException.class, () -> service.getPlan("nope"));
        Assertions.assertEquals("404", e.getCode());
    }

    @Test
    void gateShouldDriveOneShotCleanup() throws Exception {
        file(1L, "A.flac", "flac", 1000, "hash-a", 4000);
        LibraryFileEntity mp3 = file(2L, "A.mp3", "mp3", 128, "hash-a", 1000);
        SmartCleanupService service = service(new LocalFileStore());

        CleanupReport report = service.cleanup(CleanupMode.FAST, null, plan -> PHRASE);

        Assertions.assertEquals(CleanupStatus.COMPLETED, report.getStatus());
        Assertions.assertFalse(Files.exists(Paths.get(mp3.getFilePath())));
    }

    private SmartCleanupService service(FileStore fileStore) {
        ObjectMapper objectMapper = new ObjectMapper();
        QualityScorer scorer = new QualityScorer(new AppQualityProperties());
        RatcliffObershelpSimilarity similarity = new RatcliffObershelpSimilarity();
        DuplicateGroupFinder finder = new DuplicateGroupFinder(catalog,
                new MatchTextNormalizer(new AppMatchProperties()), similarity, properties);
        return new SmartCleanupService(catalog, finder, scorer,
                new DeletionSafetyValidator(fileStore, scorer, properties),
                new BackupService(fileStore, objectMapper),
                new CleanupReportWriter(objectMapper),
                fileStore,
                CurationEventSink.NOOP,
                properties,
                beanProvider(meterRegistry));
    }

    private LibraryFileEntity file(Long id, String name, String format, int bitrate, String metadataHash, int size)
            throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("library"));
        Path path = Files.write(dir.resolve(name), new byte[size]);
        LibraryFileEntity file = new LibraryFileEntity();
        file.setId(id);
        file.setFilePath(path.toString());
        file.setFilename(name);
        file.setFileFormat(format);
        file.setBitrate(bitrate);
        file.setSampleRate(44100);
        file.setFileSize((long) size);
        file.setFileMtime(System.currentTimeMillis());
        file.setMetadataHash(metadataHash);
        file.setVbr(0);
        file.setIsActive(1);
        rows.add(file);
        return file;
    }

    private static boolean containsAction(CleanupReport report, String path, FileActionType type) {
        for (FileAction action : report.getActions()) {
            if (action.getFilePath().equals(path) && action.getAction() == type) {
                return true;
            }
        }
        return false;
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry registry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", registry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
