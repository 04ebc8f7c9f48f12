package com.example.musiccurator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExportOptions {

    private boolean exportNew;

    private boolean exportDuplicates;

    private boolean exportUncertain;

    public static ExportOptions none() {
        return new ExportOptions(false, false, false);
    }

    public boolean any() {
        return exportNew || exportDuplicates || exportUncertain;
    }
}
