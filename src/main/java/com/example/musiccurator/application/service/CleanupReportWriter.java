package com.example.musiccurator.application.service;

import com.example.musiccurator.domain.model.CleanupPlan;
import com.example.musiccurator.domain.model.CleanupReport;
import com.example.musiccurator.domain.model.FileAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class CleanupReportWriter {

    static final String[] CSV_HEADER = {
            "Group ID", "Action", "File Path", "Format", "Quality Score", "File Size MB", "Bitrate Type", "Sample Rate"
    };

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final double BYTES_PER_MB = 1024D * 1024D;

    private final ObjectMapper reportMapper;

    public CleanupReportWriter(ObjectMapper objectMapper) {
        this.reportMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path writeCsv(CleanupReport report, Path reportDir) throws IOException {
        Files.createDirectories(reportDir);
        Path target = reportDir.resolve("cleanup_report_" + FILE_STAMP.format(LocalDateTime.now()) + ".csv");
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_HEADER);
            for (FileAction action : report.getActions()) {
                writer.writeNext(new String[]{
                        String.valueOf(action.getGroupId()),
                        action.getAction().name(),
                        action.getFilePath(),
                        action.getFormat() == null ? "" : action.getFormat().toUpperCase(Locale.ROOT),
                        String.valueOf(action.getQualityScore()),
                        String.format(Locale.ROOT, "%.2f", action.getFileSizeBytes() / BYTES_PER_MB),
                        action.getBitrateType(),
                        action.getSampleRate() == null ? "" : String.valueOf(action.getSampleRate())
                });
            }
        }
        return target;
    }

    public Path writeJson(CleanupReport report, Path reportDir) throws IOException {
        Files.createDirectories(reportDir);
        Path target = reportDir.resolve("cleanup_report_" + FILE_STAMP.format(LocalDateTime.now()) + ".json");
        reportMapper.writeValue(target.toFile(), report);
        return target;
    }

    /**
     * Deletion plan as reviewed, before any file is touched.
     */
    public Path writePlan(CleanupPlan plan, Path reportDir) throws IOException {
        Files.createDirectories(reportDir);
        Path target = reportDir.resolve("cleanup_plan_" + plan.getPlanId() + ".json");
        reportMapper.writeValue(target.toFile(), plan);
        return target;
    }
}
