package com.example.musiccurator.infrastructure.parser;

import com.example.musiccurator.common.exception.MetadataExtractionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JaudiotaggerAudioMetadataParserTest {

    @TempDir
    Path tempDir;

    @Test
    void yearOutsidePlausibleRangeShouldBeDropped() {
        Assertions.assertEquals(Integer.valueOf(1999), JaudiotaggerAudioMetadataParser.validYear(1999));
        Assertions.assertEquals(Integer.valueOf(2100), JaudiotaggerAudioMetadataParser.validYear(2100));
        Assertions.assertNull(JaudiotaggerAudioMetadataParser.validYear(1899));
        Assertions.assertNull(JaudiotaggerAudioMetadataParser.validYear(20240));
        Assertions.assertNull(JaudiotaggerAudioMetadataParser.validYear(null));
    }

    @Test
    void unreadableFileShouldRaiseExtractionException() throws IOException {
        Path notAudio = Files.write(tempDir.resolve("notes.xyz"), "hello".getBytes());

        Assertions.assertThrows(MetadataExtractionException.class,
                () -> new JaudiotaggerAudioMetadataParser().parse(notAudio.toFile()));
    }
}
