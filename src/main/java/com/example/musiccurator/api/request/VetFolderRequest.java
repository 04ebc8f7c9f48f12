package com.example.musiccurator.api.request;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VetFolderRequest {

    @NotBlank
    private String folder;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double threshold;

    private Boolean exportNew;

    private Boolean exportDuplicates;

    private Boolean exportUncertain;
}
