package com.example.musiccurator.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class IndexResult {

    private String root;

    private int totalFiles;

    private int added;

    private int updated;

    private int unchanged;

    private int failed;

    /**
     * Files indexed without tags because extraction failed.
     */
    private int metadataErrors;

    private boolean cancelled;

    private long durationMs;

    private List<FileError> errors = new ArrayList<>();
}
