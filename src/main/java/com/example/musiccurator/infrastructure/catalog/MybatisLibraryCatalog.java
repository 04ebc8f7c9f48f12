package com.example.musiccurator.infrastructure.catalog;

import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.common.exception.CatalogException;
import com.example.musiccurator.common.util.TextNormalizer;
import com.example.musiccurator.domain.MetadataHash;
import com.example.musiccurator.domain.enumtype.UpsertOutcome;
import com.example.musiccurator.domain.model.FormatStat;
import com.example.musiccurator.domain.model.LibraryStatistics;
import com.example.musiccurator.domain.model.UpsertResult;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import com.example.musiccurator.infrastructure.persistence.mapper.LibraryFileMapper;
import com.example.musiccurator.infrastructure.persistence.mapper.LibraryStatsMapper;
import com.example.musiccurator.infrastructure.persistence.mapper.VettingHistoryMapper;
import com.example.musiccurator.infrastructure.persistence.model.CatalogTotalsRow;
import com.example.musiccurator.infrastructure.persistence.model.FormatCountRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MybatisLibraryCatalog implements LibraryCatalog {

    private static final Logger log = LoggerFactory.getLogger(MybatisLibraryCatalog.class);

    static final int MAX_HISTORY_LIMIT = 1000;

    private final LibraryFileMapper libraryFileMapper;
    private final VettingHistoryMapper vettingHistoryMapper;
    private final LibraryStatsMapper libraryStatsMapper;

    public MybatisLibraryCatalog(LibraryFileMapper libraryFileMapper,
                                 VettingHistoryMapper vettingHistoryMapper,
                                 LibraryStatsMapper libraryStatsMapper) {
        this.libraryFileMapper = libraryFileMapper;
        this.vettingHistoryMapper = vettingHistoryMapper;
        this.libraryStatsMapper = libraryStatsMapper;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public UpsertResult upsertFile(LibraryFileEntity record) {
        return guard("upsertFile", () -> write(record, false));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public UpsertResult replaceFile(LibraryFileEntity record) {
        return guard("replaceFile", () -> write(record, true));
    }

    private UpsertResult write(LibraryFileEntity record, boolean force) {
        if (record.getArtistKey() == null) {
            record.setArtistKey(TextNormalizer.foldKey(record.getArtist()));
        }
        LibraryFileEntity existing = libraryFileMapper.selectByPath(record.getFilePath());
        if (existing == null) {
            libraryFileMapper.insert(record);
            record.setIsActive(1);
            return new UpsertResult(record.getId(), UpsertOutcome.INSERTED);
        }
        long verifiedAt = record.getLastVerified() == null ? System.currentTimeMillis() : record.getLastVerified();
        if (!force && !changed(existing, record)) {
            libraryFileMapper.touchVerified(existing.getId(), verifiedAt);
            return new UpsertResult(existing.getId(), UpsertOutcome.UNCHANGED);
        }
        record.setId(existing.getId());
        record.setLastVerified(verifiedAt);
        libraryFileMapper.updateIndexedFields(record);
        record.setIsActive(1);
        return new UpsertResult(existing.getId(), UpsertOutcome.UPDATED);
    }

    /**
     * Same path with a different mtime or size means the file must be re-extracted.
     */
    static boolean changed(LibraryFileEntity stored, LibraryFileEntity incoming) {
        return !Objects.equals(stored.getFileMtime(), incoming.getFileMtime())
                || !Objects.equals(stored.getFileSize(), incoming.getFileSize());
    }

    @Override
    public LibraryFileEntity findByPath(String filePath) {
        return guard("findByPath", () -> libraryFileMapper.selectByPath(filePath));
    }

    @Override
    public List<LibraryFileEntity> findByMetadataHash(String metadataHash, boolean activeOnly) {
        if (metadataHash == null || MetadataHash.isSentinel(metadataHash)) {
            return Collections.emptyList();
        }
        return guard("findByMetadataHash", () -> libraryFileMapper.selectByMetadataHash(metadataHash, activeOnly));
    }

    @Override
    public List<LibraryFileEntity> findByContentHash(String contentHash, boolean activeOnly) {
        if (contentHash == null) {
            return Collections.emptyList();
        }
        return guard("findByContentHash", () -> libraryFileMapper.selectByContentHash(contentHash, activeOnly));
    }

    @Override
    public List<LibraryFileEntity> findCandidatesByArtist(String artist) {
        String artistKey = TextNormalizer.foldKey(artist);
        if (artistKey == null || artistKey.isEmpty()) {
            return Collections.emptyList();
        }
        return guard("findCandidatesByArtist", () -> libraryFileMapper.selectActiveByArtistKey(artistKey));
    }

    @Override
    public List<LibraryFileEntity> findActive() {
        return guard("findActive", libraryFileMapper::selectActive);
    }

    @Override
    public List<LibraryFileEntity> findUnderPath(String pathPrefix, boolean activeOnly) {
        return guard("findUnderPath", () -> libraryFileMapper.selectUnderPath(pathPrefix, activeOnly));
    }

    @Override
    public List<LibraryFileEntity> findActiveSharingMetadataHash() {
        return guard("findActiveSharingMetadataHash",
                () -> libraryFileMapper.selectActiveSharingMetadataHash(MetadataHash.SENTINEL));
    }

    @Override
    public List<LibraryFileEntity> findActiveSharingContentHash() {
        return guard("findActiveSharingContentHash", libraryFileMapper::selectActiveSharingContentHash);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void markInactive(Long id) {
        guard("markInactive", () -> libraryFileMapper.updateActive(id, 0));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void markActive(Long id) {
        guard("markActive", () -> libraryFileMapper.updateActive(id, 1));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int markInactive(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return guard("markInactiveBatch", () -> libraryFileMapper.updateActiveByIds(ids, 0));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int purgeInactive() {
        int purged = guard("purgeInactive", libraryFileMapper::deleteInactive);
        log.info("CATALOG_PURGE purgedRows={}", purged);
        return purged;
    }

    @Override
    public LibraryStatistics statistics() {
        return guard("statistics", () -> {
            LibraryStatistics statistics = new LibraryStatistics();
            CatalogTotalsRow totals = libraryFileMapper.selectTotals();
            if (totals != null) {
                statistics.setTotalFiles(nullToZero(totals.getTotalFiles()));
                statistics.setActiveFiles(nullToZero(totals.getActiveFiles()));
                statistics.setTotalSizeBytes(nullToZero(totals.getTotalSize()));
                statistics.setUniqueArtists(nullToZero(totals.getUniqueArtists()));
                statistics.setUniqueAlbums(nullToZero(totals.getUniqueAlbums()));
            }
            statistics.setInactiveFiles(statistics.getTotalFiles() - statistics.getActiveFiles());
            long active = statistics.getActiveFiles();
            statistics.setAverageSizeBytes(active == 0 ? 0L : statistics.getTotalSizeBytes() / active);

            List<FormatStat> formats = new ArrayList<>();
            List<FormatCountRow> rows = libraryFileMapper.selectFormatCounts();
            if (rows != null) {
                for (FormatCountRow row : rows) {
                    long count = nullToZero(row.getFileCount());
                    double percentage = active == 0 ? 0D : Math.round(count * 10000D / active) / 100D;
                    formats.add(new FormatStat(row.getFileFormat(), count, percentage));
                }
            }
            statistics.setFormats(formats);
            statistics.setLastIndexedAt(parseLong(libraryStatsMapper.selectValue(LibraryStatsMapper.LAST_INDEXED_AT)));
            statistics.setLastIndexDurationMs(
                    parseLong(libraryStatsMapper.selectValue(LibraryStatsMapper.LAST_INDEX_DURATION_MS)));
            return statistics;
        });
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void recordIndexRun(long finishedAt, long durationMs) {
        guard("recordIndexRun", () -> {
            libraryStatsMapper.upsert(LibraryStatsMapper.LAST_INDEXED_AT, String.valueOf(finishedAt), finishedAt);
            libraryStatsMapper.upsert(LibraryStatsMapper.LAST_INDEX_DURATION_MS, String.valueOf(durationMs), finishedAt);
            return null;
        });
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public VettingSessionEntity saveVettingSession(VettingSessionEntity session) {
        if (session.getId() != null) {
            throw new IllegalArgumentException("Vetting sessions are immutable once saved, id=" + session.getId());
        }
        return guard("saveVettingSession", () -> {
            vettingHistoryMapper.insert(session);
            return session;
        });
    }

    @Override
    public List<VettingSessionEntity> findVettingHistory(int limit) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new BusinessException("400", "History limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return guard("findVettingHistory", () -> vettingHistoryMapper.selectRecent(limit));
    }

    private <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CatalogException("Catalog operation failed: " + operation, e);
        }
    }

    private long nullToZero(Long value) {
        return value == null ? 0L : value;
    }

    private Long parseLong(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("CATALOG_STAT_INVALID value={}", raw);
            return null;
        }
    }
}
