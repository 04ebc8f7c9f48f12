package com.example.musiccurator.common.exception;

import java.io.File;

public class MetadataExtractionException extends Exception {

    public MetadataExtractionException(File file, Throwable cause) {
        super("Unable to read tags from " + file.getAbsolutePath() + ": " + cause.getMessage(), cause);
    }
}
