package com.example.musiccurator.application.service;

import com.example.musiccurator.common.exception.BackupException;
import com.example.musiccurator.common.util.HashUtil;
import com.example.musiccurator.common.util.TextNormalizer;
import com.example.musiccurator.domain.model.BackupEntry;
import com.example.musiccurator.domain.model.BackupManifest;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.storage.FileStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Copies a deletion batch into a timestamped folder and commits {@value #MANIFEST_FILE} there.
 * The batch is all-or-nothing: the first failed copy aborts it with a {@link BackupException}.
 */
@Service
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    public static final String MANIFEST_FILE = "manifest.json";

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int STREAM_BUFFER = 8192;

    private final FileStore fileStore;
    private final ObjectMapper manifestMapper;

    public BackupService(FileStore fileStore, ObjectMapper objectMapper) {
        this.fileStore = fileStore;
        this.manifestMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @throws CancellationException when {@code cancelSignal} fires between two copies
     */
    public BackupManifest backup(List<LibraryFileEntity> files, Path backupRoot, BooleanSupplier cancelSignal)
            throws BackupException {
        LocalDateTime now = LocalDateTime.now();
        Path backupDir;
        try {
            backupDir = createBackupDir(backupRoot, "backup_" + BACKUP_STAMP.format(now));
        } catch (IOException e) {
            throw new BackupException(backupRoot, "Cannot create backup folder under " + backupRoot, e);
        }
        BackupManifest manifest = new BackupManifest();
        manifest.setBackupId(backupDir.getFileName().toString());
        manifest.setBackupDir(backupDir.toString());
        manifest.setCreatedAt(now.toString());
        log.info("BACKUP_START backupDir={} files={}", backupDir, files.size());

        Set<String> usedNames = new HashSet<>();
        for (LibraryFileEntity file : files) {
            if (cancelSignal.getAsBoolean()) {
                log.info("BACKUP_CANCELED backupDir={} copied={}", backupDir, manifest.getEntries().size());
                throw new CancellationException("Backup cancelled after " + manifest.getEntries().size() + " file(s)");
            }
            Path source = Paths.get(file.getFilePath());
            Path target = backupDir.resolve(uniqueName(source.getFileName().toString(), usedNames));
            try {
                fileStore.copy(source, target);
                long size = fileStore.size(target);
                long expected = fileStore.size(source);
                if (size != expected) {
                    throw new IOException("Copied size " + size + " differs from source size " + expected);
                }
                manifest.getEntries().add(new BackupEntry(source.toString(), target.toString(), size, sha256(target)));
            } catch (IOException e) {
                log.error("BACKUP_FAILED source={} target={} copied={} reason={}",
                        source, target, manifest.getEntries().size(), e.getMessage());
                throw new BackupException(source, "Backup copy failed for " + source + ": " + e.getMessage(), e);
            }
        }

        Path manifestPath = backupDir.resolve(MANIFEST_FILE);
        try {
            manifestMapper.writeValue(manifestPath.toFile(), manifest);
        } catch (IOException e) {
            throw new BackupException(manifestPath, "Cannot write backup manifest: " + e.getMessage(), e);
        }
        log.info("BACKUP_COMMITTED manifest={} entries={}", manifestPath, manifest.getEntries().size());
        return manifest;
    }

    public BackupManifest readManifest(Path manifestPath) throws IOException {
        return manifestMapper.readValue(manifestPath.toFile(), BackupManifest.class);
    }

    private Path createBackupDir(Path backupRoot, String baseName) throws IOException {
        fileStore.createDirectories(backupRoot);
        Path candidate = backupRoot.resolve(baseName);
        int counter = 1;
        while (fileStore.pathExists(candidate)) {
            candidate = backupRoot.resolve(baseName + "_" + counter++);
        }
        fileStore.createDirectories(candidate);
        return candidate;
    }

    static String uniqueName(String filename, Set<String> usedNames) {
        String name = filename;
        String stem = TextNormalizer.stemOf(filename);
        String extension = TextNormalizer.extensionOf(filename);
        String suffix = extension.isEmpty() ? "" : filename.substring(filename.length() - extension.length() - 1);
        int counter = 1;
        while (!usedNames.add(name)) {
            name = stem + "_" + counter++ + suffix;
        }
        return name;
    }

    private String sha256(Path file) throws IOException {
        MessageDigest digest = HashUtil.sha256();
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            byte[] buffer = new byte[STREAM_BUFFER];
            while (in.read(buffer) != -1) {
                // digest is updated as the stream is read
            }
        }
        return HashUtil.toHex(digest.digest());
    }
}
