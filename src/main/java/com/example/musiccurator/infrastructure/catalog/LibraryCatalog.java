package com.example.musiccurator.infrastructure.catalog;

import com.example.musiccurator.domain.model.LibraryStatistics;
import com.example.musiccurator.domain.model.UpsertResult;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import java.util.List;

/**
 * Durable index of library files plus the vetting history.
 * <p>
 * Rows are never physically removed by normal workflows: a file that disappears is flipped to
 * inactive and lookups only return active rows unless {@code activeOnly} is false. Metadata-hash
 * lookups never match the untagged sentinel. Store failures surface as
 * {@link com.example.musiccurator.common.exception.CatalogException}.
 */
public interface LibraryCatalog {

    /**
     * Inserts a new row, rewrites the row for the same path when mtime or size changed, and
     * otherwise only refreshes {@code last_verified} (reactivating the row if needed).
     */
    UpsertResult upsertFile(LibraryFileEntity record);

    /**
     * Like {@link #upsertFile} but rewrites an existing row even when mtime and size match.
     */
    UpsertResult replaceFile(LibraryFileEntity record);

    LibraryFileEntity findByPath(String filePath);

    List<LibraryFileEntity> findByMetadataHash(String metadataHash, boolean activeOnly);

    List<LibraryFileEntity> findByContentHash(String contentHash, boolean activeOnly);

    /**
     * Active rows whose artist folds (case and diacritics) to the same key.
     */
    List<LibraryFileEntity> findCandidatesByArtist(String artist);

    List<LibraryFileEntity> findActive();

    List<LibraryFileEntity> findUnderPath(String pathPrefix, boolean activeOnly);

    List<LibraryFileEntity> findActiveSharingMetadataHash();

    List<LibraryFileEntity> findActiveSharingContentHash();

    void markInactive(Long id);

    void markActive(Long id);

    int markInactive(List<Long> ids);

    /**
     * Physically removes inactive rows. Not used by index, vet, verify or cleanup.
     */
    int purgeInactive();

    LibraryStatistics statistics();

    void recordIndexRun(long finishedAt, long durationMs);

    VettingSessionEntity saveVettingSession(VettingSessionEntity session);

    List<VettingSessionEntity> findVettingHistory(int limit);
}
