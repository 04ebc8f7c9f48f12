package com.example.musiccurator.infrastructure.parser;

import com.example.musiccurator.common.exception.MetadataExtractionException;
import com.example.musiccurator.domain.model.AudioMetadata;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;

    @Override
    public AudioMetadata parse(File audioFile) throws MetadataExtractionException {
        AudioFile parsed;
        try {
            parsed = AudioFileIO.read(audioFile);
        } catch (Exception e) {
            throw new MetadataExtractionException(audioFile, e);
        }
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        metadata.setYear(validYear(parseInteger(safeTagValue(tag, FieldKey.YEAR))));

        if (header != null) {
            double duration = header.getPreciseTrackLength();
            metadata.setDuration(duration < 0 ? null : duration);
            metadata.setBitrate(parseInteger(header.getBitRate()));
            metadata.setSampleRate(parseInteger(header.getSampleRate()));
            metadata.setVbr(header.isVariableBitRate());
            metadata.setEncoding(header.getEncodingType());
        }
        return metadata;
    }

    static Integer validYear(Integer year) {
        if (year == null || year < MIN_YEAR || year > MAX_YEAR) {
            return null;
        }
        return year;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (KeyNotFoundException e) {
            // some container tags do not map every generic key
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
