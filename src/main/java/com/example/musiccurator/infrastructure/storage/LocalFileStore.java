package com.example.musiccurator.infrastructure.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.springframework.stereotype.Component;

@Component
public class LocalFileStore implements FileStore {

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public boolean pathExists(Path path) {
        return Files.exists(path);
    }

    @Override
    public boolean isWritable(Path path) {
        return Files.isWritable(path);
    }

    @Override
    public long size(Path path) throws IOException {
        return Files.size(path);
    }

    @Override
    public long usableSpace(Path path) throws IOException {
        Path probe = path.toAbsolutePath();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            throw new IOException("No existing ancestor for " + path);
        }
        return Files.getFileStore(probe).getUsableSpace();
    }

    @Override
    public void createDirectories(Path dir) throws IOException {
        Files.createDirectories(dir);
    }

    @Override
    public void copy(Path source, Path target) throws IOException {
        Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    }

    @Override
    public void delete(Path path) throws IOException {
        Files.delete(path);
    }
}
