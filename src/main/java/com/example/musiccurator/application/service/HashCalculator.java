package com.example.musiccurator.application.service;

import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.util.HashUtil;
import com.example.musiccurator.common.util.TextNormalizer;
import com.example.musiccurator.domain.MetadataHash;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Metadata and partial-content hashes used for exact duplicate detection.
 * <p>
 * The content hash covers the audio payload only: a leading ID3v2 tag and a trailing ID3v1 block
 * are skipped, so re-tagging a file does not change its hash. Within the payload the first chunk,
 * the middle chunk (payload of at least four chunks) and the last chunk (at least two chunks) are
 * hashed together with the payload length.
 */
@Component
public class HashCalculator {

    static final int ID3V2_HEADER_LENGTH = 10;
    static final int ID3V1_LENGTH = 128;

    private final int chunkBytes;

    @Autowired
    public HashCalculator(AppLibraryProperties appLibraryProperties) {
        this(appLibraryProperties.getContentChunkBytes());
    }

    HashCalculator(int chunkBytes) {
        this.chunkBytes = chunkBytes;
    }

    public String metadataHash(String artist, String title) {
        String normalizedArtist = TextNormalizer.lowerTrim(artist);
        String normalizedTitle = TextNormalizer.lowerTrim(title);
        if (normalizedArtist.isEmpty() && normalizedTitle.isEmpty()) {
            return MetadataHash.SENTINEL;
        }
        return HashUtil.md5Hex(normalizedArtist + "|" + normalizedTitle);
    }

    public String contentHash(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            long payloadStart = id3v2Length(channel, fileSize);
            long payloadEnd = fileSize;
            if (payloadEnd - payloadStart >= ID3V1_LENGTH && hasId3v1(channel, fileSize)) {
                payloadEnd -= ID3V1_LENGTH;
            }
            long payloadSize = Math.max(0L, payloadEnd - payloadStart);

            MessageDigest digest = HashUtil.sha256();
            digest.update(String.valueOf(payloadSize).getBytes(StandardCharsets.US_ASCII));
            digest.update(readChunk(channel, payloadStart, Math.min(chunkBytes, payloadSize)));
            if (payloadSize >= 4L * chunkBytes) {
                long middle = payloadStart + payloadSize / 2 - chunkBytes / 2;
                digest.update(readChunk(channel, middle, chunkBytes));
            }
            if (payloadSize >= 2L * chunkBytes) {
                digest.update(readChunk(channel, payloadEnd - chunkBytes, chunkBytes));
            }
            return HashUtil.toHex(digest.digest());
        }
    }

    private long id3v2Length(FileChannel channel, long fileSize) throws IOException {
        if (fileSize < ID3V2_HEADER_LENGTH) {
            return 0L;
        }
        byte[] header = readChunk(channel, 0L, ID3V2_HEADER_LENGTH);
        if (header[0] != 'I' || header[1] != 'D' || header[2] != '3') {
            return 0L;
        }
        long tagSize = 0L;
        for (int i = 6; i < 10; i++) {
            if ((header[i] & 0x80) != 0) {
                // not a syncsafe integer, treat as untagged
                return 0L;
            }
            tagSize = (tagSize << 7) | (header[i] & 0x7F);
        }
        boolean hasFooter = (header[5] & 0x10) != 0;
        long total = ID3V2_HEADER_LENGTH + tagSize + (hasFooter ? ID3V2_HEADER_LENGTH : 0);
        return Math.min(total, fileSize);
    }

    private boolean hasId3v1(FileChannel channel, long fileSize) throws IOException {
        byte[] marker = readChunk(channel, fileSize - ID3V1_LENGTH, 3);
        return marker[0] == 'T' && marker[1] == 'A' && marker[2] == 'G';
    }

    private byte[] readChunk(FileChannel channel, long position, long length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) length);
        long offset = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset);
            if (read < 0) {
                break;
            }
            offset += read;
        }
        return buffer.array();
    }
}
