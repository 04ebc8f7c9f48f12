package com.example.musiccurator.application.service;

import com.example.musiccurator.domain.model.MatchVerdict;
import com.example.musiccurator.domain.model.VettedFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VettingExportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteHeaderThenOnePathPerLine() throws Exception {
        LocalDateTime generatedAt = LocalDateTime.of(2024, 3, 9, 14, 5, 7);
        List<VettedFile> files = Arrays.asList(
                VettedFile.of("/import/a.mp3", MatchVerdict.newFile()),
                VettedFile.of("/import/b.flac", MatchVerdict.newFile()));

        Path written = new VettingExportWriter().write(tempDir.resolve("exports"), "new_songs", "New Songs",
                "Summer Drop", files, generatedAt);

        Assertions.assertEquals("new_songs_Summer_Drop_20240309_140507.txt", written.getFileName().toString());
        List<String> lines = Files.readAllLines(written);
        Assertions.assertEquals(Arrays.asList(
                "# New Songs from Summer Drop",
                "# Generated: 2024-03-09 14:05:07",
                "# Total: 2",
                "",
                "/import/a.mp3",
                "/import/b.flac"), lines);
    }

    @Test
    void emptyListShouldStillProduceHeader() throws Exception {
        Path written = new VettingExportWriter().write(tempDir, "uncertain", "Uncertain Matches", "drop",
                Collections.<VettedFile>emptyList(), LocalDateTime.of(2024, 1, 1, 0, 0));

        List<String> lines = Files.readAllLines(written);
        Assertions.assertEquals("# Total: 0", lines.get(2));
        Assertions.assertEquals(4, lines.size());
    }
}
