package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.common.util.TextNormalizer;
import com.example.musiccurator.domain.model.FileError;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AudioFileScanner {

    private static final Logger log = LoggerFactory.getLogger(AudioFileScanner.class);

    private final Set<String> audioExtensions;

    public AudioFileScanner(AppLibraryProperties appLibraryProperties) {
        this.audioExtensions = appLibraryProperties.normalizedAudioExtensions();
    }

    public Path resolveDirectory(String rawPath) {
        if (rawPath == null || rawPath.trim().isEmpty()) {
            throw new BusinessException("400", "Folder path is required");
        }
        Path dir = Paths.get(rawPath.trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new BusinessException("404", "Folder does not exist or is not a directory: " + dir,
                    "Check the path and mount point");
        }
        return dir;
    }

    /**
     * Supported audio files below {@code root}, sorted by path. Unreadable directories are
     * recorded in {@code errors} and skipped.
     */
    public List<Path> scan(Path root, final List<FileError> errors) throws IOException {
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isAudioFile(file)) {
                    files.add(file.toAbsolutePath().normalize());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("SCAN_ACCESS_FAILED path={} reason={}", file, exc.getMessage());
                errors.add(new FileError(file.toString(), "Cannot access: " + exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }

    public boolean isAudioFile(Path file) {
        Path name = file.getFileName();
        return name != null && audioExtensions.contains(TextNormalizer.extensionOf(name.toString()));
    }
}
