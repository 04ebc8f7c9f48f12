package com.example.musiccurator.application.service;

import com.example.musiccurator.domain.MetadataHash;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HashCalculatorTest {

    private static final int CHUNK = 1024;

    private final HashCalculator hashCalculator = new HashCalculator(CHUNK);

    @TempDir
    Path tempDir;

    @Test
    void metadataHashShouldIgnoreCaseAndSurroundingWhitespace() {
        Assertions.assertEquals(hashCalculator.metadataHash("Artist", "Song"),
                hashCalculator.metadataHash("  ARTIST ", "song  "));
        Assertions.assertNotEquals(hashCalculator.metadataHash("Artist", "Song"),
                hashCalculator.metadataHash("Artist", "Other Song"));
    }

    @Test
    void metadataHashShouldReturnSentinelWhenArtistAndTitleMissing() {
        Assertions.assertEquals(MetadataHash.SENTINEL, hashCalculator.metadataHash(null, "  "));
        Assertions.assertTrue(MetadataHash.isSentinel(hashCalculator.metadataHash("", null)));
        Assertions.assertNotEquals(MetadataHash.SENTINEL, hashCalculator.metadataHash("Artist", null));
    }

    @Test
    void contentHashShouldSurviveRetagging() throws IOException {
        byte[] payload = payload(8 * CHUNK);
        Path plain = write("plain.mp3", payload);
        Path tagged = write("tagged.mp3", concat(id3v2("Old Title"), payload, id3v1("Old Title")));
        Path retagged = write("retagged.mp3", concat(id3v2("A much longer replacement title"), payload,
                id3v1("New")));

        String expected = hashCalculator.contentHash(plain);
        Assertions.assertEquals(expected, hashCalculator.contentHash(tagged));
        Assertions.assertEquals(expected, hashCalculator.contentHash(retagged));
    }

    @Test
    void contentHashShouldChangeWhenAudioChanges() throws IOException {
        byte[] payload = payload(8 * CHUNK);
        byte[] changed = Arrays.copyOf(payload, payload.length);
        changed[payload.length - 1] ^= 0x1;

        Assertions.assertNotEquals(hashCalculator.contentHash(write("a.mp3", payload)),
                hashCalculator.contentHash(write("b.mp3", changed)));
    }

    @Test
    void contentHashShouldHandleTinyAndEmptyFiles() throws IOException {
        Assertions.assertNotNull(hashCalculator.contentHash(write("empty.wav", new byte[0])));
        Assertions.assertNotEquals(hashCalculator.contentHash(write("one.wav", new byte[]{1})),
                hashCalculator.contentHash(write("two.wav", new byte[]{1, 2})));
    }

    @Test
    void contentHashShouldFailForMissingFile() {
        Assertions.assertThrows(NoSuchFileException.class,
                () -> hashCalculator.contentHash(tempDir.resolve("missing.mp3")));
    }

    private Path write(String name, byte[] bytes) throws IOException {
        return Files.write(tempDir.resolve(name), bytes);
    }

    private static byte[] payload(int size) {
        byte[] bytes = new byte[size];
        new Random(42L).nextBytes(bytes);
        // keep the random payload from looking like a tag
        bytes[0] = 0x00;
        bytes[size - 128] = 0x00;
        return bytes;
    }

    private static byte[] id3v2(String title) {
        byte[] body = title.getBytes(StandardCharsets.UTF_8);
        int size = body.length + 20;
        byte[] tag = new byte[10 + size];
        tag[0] = 'I';
        tag[1] = 'D';
        tag[2] = '3';
        tag[3] = 4;
        tag[6] = (byte) ((size >> 21) & 0x7F);
        tag[7] = (byte) ((size >> 14) & 0x7F);
        tag[8] = (byte) ((size >> 7) & 0x7F);
        tag[9] = (byte) (size & 0x7F);
        System.arraycopy(body, 0, tag, 10, body.length);
        return tag;
    }

    private static byte[] id3v1(String title) {
        byte[] tag = new byte[128];
        tag[0] = 'T';
        tag[1] = 'A';
        tag[2] = 'G';
        byte[] body = title.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(body, 0, tag, 3, Math.min(body.length, 30));
        return tag;
    }

    private static byte[] concat(byte[]... parts) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.write(part);
        }
        return out.toByteArray();
    }
}
