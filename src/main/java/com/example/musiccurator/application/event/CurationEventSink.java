package com.example.musiccurator.application.event;

/**
 * Progress notifications emitted by indexing, vetting and cleanup runs. Implementations must be
 * thread-safe: {@link #onFileProcessed} is called from the writer thread of each run, but several
 * runs may be active at once.
 */
public interface CurationEventSink {

    CurationEventSink NOOP = new CurationEventSink() {
    };

    /**
     * @param operation index, vet, verify or cleanup
     * @param outcome   short outcome key, e.g. INSERTED, DUPLICATE, DELETED, FAILED
     */
    default void onFileProcessed(String operation, String path, String outcome, int processed, int total) {
    }

    default void onGroupValidated(int groupId, boolean passed, String detail) {
    }

    default void onPhaseComplete(String operation, String phase) {
    }
}
