package com.example.musiccurator.infrastructure.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem operations used by the destructive cleanup phases.
 */
public interface FileStore {

    boolean exists(Path path);

    /**
     * True when anything, file or directory, is at {@code path}.
     */
    boolean pathExists(Path path);

    boolean isWritable(Path path);

    long size(Path path) throws IOException;

    /**
     * Free bytes on the volume holding {@code path} (or its nearest existing ancestor).
     */
    long usableSpace(Path path) throws IOException;

    void createDirectories(Path dir) throws IOException;

    /**
     * Copies preserving timestamps; fails when the target already exists.
     */
    void copy(Path source, Path target) throws IOException;

    void delete(Path path) throws IOException;
}
