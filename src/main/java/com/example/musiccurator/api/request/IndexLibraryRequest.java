package com.example.musiccurator.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class IndexLibraryRequest {

    @NotBlank
    private String path;

    /**
     * Re-extract every file even when the stored record is up to date.
     */
    private boolean rescan;

    /**
     * Skip files whose size and modification time are unchanged.
     */
    private boolean incremental;
}
