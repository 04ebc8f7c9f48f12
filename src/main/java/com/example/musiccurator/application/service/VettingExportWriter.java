package com.example.musiccurator.application.service;

import com.example.musiccurator.domain.model.VettedFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Plain-text path lists produced by a vetting run: a short '#' header, a blank line, then one
 * absolute path per line.
 */
@Component
public class VettingExportWriter {

    static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final DateTimeFormatter HEADER_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public Path write(Path exportDir, String filePrefix, String heading, String folderName,
                      List<VettedFile> files, LocalDateTime generatedAt) throws IOException {
        Files.createDirectories(exportDir);
        String safeFolder = folderName.replaceAll("[^A-Za-z0-9._-]+", "_");
        Path target = exportDir.resolve(filePrefix + "_" + safeFolder + "_" + FILE_STAMP.format(generatedAt) + ".txt");

        List<String> lines = new ArrayList<>(files.size() + 4);
        lines.add("# " + heading + " from " + folderName);
        lines.add("# Generated: " + HEADER_STAMP.format(generatedAt));
        lines.add("# Total: " + files.size());
        lines.add("");
        for (VettedFile file : files) {
            lines.add(file.getPath());
        }
        return Files.write(target, lines, StandardCharsets.UTF_8);
    }
}
