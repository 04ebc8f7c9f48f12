package com.example.musiccurator.common.config;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.vet")
public class AppVetProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.8D;

    /**
     * Fuzzy scores in [uncertainFloor, threshold) are reported as uncertain.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double uncertainFloor = 0.7D;

    private boolean exportNew = true;

    private boolean exportDuplicates = false;

    private boolean exportUncertain = true;

    @NotBlank
    private String exportDir = "./exports";

    private int historyDefaultLimit = 20;
}
