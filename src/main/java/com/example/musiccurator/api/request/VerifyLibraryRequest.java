package com.example.musiccurator.api.request;

import lombok.Data;

@Data
public class VerifyLibraryRequest {

    /**
     * Blank verifies the whole catalog.
     */
    private String path;
}
