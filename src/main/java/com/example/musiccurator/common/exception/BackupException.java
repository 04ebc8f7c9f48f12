package com.example.musiccurator.common.exception;

import java.nio.file.Path;

/**
 * A copy in a cleanup backup batch failed; the whole batch is abandoned before any deletion.
 */
public class BackupException extends Exception {

    private final Path failedPath;

    public BackupException(Path failedPath, String message, Throwable cause) {
        super(message, cause);
        this.failedPath = failedPath;
    }

    public Path getFailedPath() {
        return failedPath;
    }
}
