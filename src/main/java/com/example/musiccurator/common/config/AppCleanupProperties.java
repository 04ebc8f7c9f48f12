package com.example.musiccurator.common.config;

import com.example.musiccurator.domain.enumtype.CleanupMode;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.cleanup")
public class AppCleanupProperties {

    @NotNull
    private CleanupMode mode = CleanupMode.FAST;

    @NotBlank
    private String backupDir = "./backups";

    @NotBlank
    private String reportDir = "./reports";

    /**
     * Phrase the caller must echo back before a deletion batch runs.
     */
    @NotBlank
    private String confirmationPhrase = "DELETE DUPLICATES";

    /**
     * Minimum normalized filename similarity for THOROUGH grouping.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double filenameSimilarityThreshold = 0.9D;

    /**
     * A delete candidate this many quality points above the keeper raises a warning.
     */
    private int qualityWarningMargin = 5;

    /**
     * Pending plans older than this are discarded.
     */
    private int planTtlMinutes = 60;
}
