package com.example.musiccurator.application.service;

import com.example.musiccurator.common.exception.MetadataExtractionException;
import com.example.musiccurator.common.util.TextNormalizer;
import com.example.musiccurator.domain.model.AudioMetadata;
import com.example.musiccurator.infrastructure.parser.AudioMetadataParser;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a file on disk into a catalog-shaped record: tags, filesystem stats and both hashes.
 * Safe to call from worker threads.
 */
@Component
public class AudioFileInspector {

    private static final Logger log = LoggerFactory.getLogger(AudioFileInspector.class);

    private final AudioMetadataParser audioMetadataParser;
    private final HashCalculator hashCalculator;

    public AudioFileInspector(AudioMetadataParser audioMetadataParser, HashCalculator hashCalculator) {
        this.audioMetadataParser = audioMetadataParser;
        this.hashCalculator = hashCalculator;
    }

    /**
     * @throws IOException when the file cannot be read; tag failures only null the metadata
     */
    public Inspection inspect(Path file) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        AudioMetadata metadata = null;
        boolean metadataError = false;
        try {
            metadata = audioMetadataParser.parse(file.toFile());
        } catch (MetadataExtractionException e) {
            metadataError = true;
            log.warn("METADATA_UNREADABLE path={} reason={}", file, e.getMessage());
        }

        long now = System.currentTimeMillis();
        LibraryFileEntity record = new LibraryFileEntity();
        record.setFilePath(file.toString());
        record.setFilename(file.getFileName().toString());
        record.setFileSize(attributes.size());
        record.setFileMtime(attributes.lastModifiedTime().toMillis());
        record.setFileFormat(resolveFormat(record.getFilename(), metadata));
        record.setVbr(0);
        if (metadata != null) {
            record.setArtist(TextNormalizer.trimToNull(metadata.getArtist()));
            record.setTitle(TextNormalizer.trimToNull(metadata.getTitle()));
            record.setAlbum(TextNormalizer.trimToNull(metadata.getAlbum()));
            record.setYear(metadata.getYear());
            record.setDuration(metadata.getDuration());
            record.setBitrate(metadata.getBitrate());
            record.setSampleRate(metadata.getSampleRate());
            record.setVbr(Boolean.TRUE.equals(metadata.getVbr()) ? 1 : 0);
        }
        record.setArtistKey(TextNormalizer.foldKey(record.getArtist()));
        record.setMetadataHash(hashCalculator.metadataHash(record.getArtist(), record.getTitle()));
        record.setContentHash(hashCalculator.contentHash(file));
        record.setIndexedAt(now);
        record.setLastVerified(now);
        record.setIsActive(1);
        return new Inspection(record, metadataError);
    }

    static String resolveFormat(String filename, AudioMetadata metadata) {
        String extension = TextNormalizer.extensionOf(filename);
        if ("m4a".equals(extension) && metadata != null && metadata.getEncoding() != null
                && metadata.getEncoding().toLowerCase(Locale.ROOT).contains("alac")) {
            return "alac";
        }
        return extension.isEmpty() ? null : extension;
    }

    public static class Inspection {

        private final LibraryFileEntity record;
        private final boolean metadataError;

        public Inspection(LibraryFileEntity record, boolean metadataError) {
            this.record = record;
            this.metadataError = metadataError;
        }

        public LibraryFileEntity getRecord() {
            return record;
        }

        public boolean isMetadataError() {
            return metadataError;
        }
    }
}
