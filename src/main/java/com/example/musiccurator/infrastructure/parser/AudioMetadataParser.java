package com.example.musiccurator.infrastructure.parser;

import com.example.musiccurator.common.exception.MetadataExtractionException;
import com.example.musiccurator.domain.model.AudioMetadata;
import java.io.File;

public interface AudioMetadataParser {

    AudioMetadata parse(File audioFile) throws MetadataExtractionException;
}
