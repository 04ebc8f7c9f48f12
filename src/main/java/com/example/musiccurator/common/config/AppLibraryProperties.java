package com.example.musiccurator.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    @NotBlank
    private String databasePath = "./data/library.db";

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList(
            "mp3", "flac", "m4a", "wav", "ogg", "opus", "aiff", "aif"));

    /**
     * Extraction + hashing workers. 0 means one per available core.
     */
    @Min(0)
    private int workerThreads = 0;

    /**
     * Bytes hashed per sampled region (head, middle, tail) for the content hash.
     */
    @Min(1024)
    private int contentChunkBytes = 65536;

    @Min(1)
    private int progressLogInterval = 200;

    /**
     * Library roots refreshed by the scheduled incremental index; empty disables the job.
     */
    private List<String> scheduledRoots = new ArrayList<>();

    private String scheduledIndexCron = "0 30 4 * * ?";

    public int effectiveWorkerThreads() {
        if (workerThreads > 0) {
            return workerThreads;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
