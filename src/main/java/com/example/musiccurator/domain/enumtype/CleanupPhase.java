package com.example.musiccurator.domain.enumtype;

public enum CleanupPhase {
    IDLE,
    SCANNING,
    REVIEWING,
    VALIDATING,
    BACKING_UP,
    DELETING,
    REPORTING,
    DONE,
    CANCELLED;

    /**
     * Cancellation leaves disk and catalog untouched only while nothing has been deleted.
     */
    public boolean isCancellable() {
        return ordinal() < DELETING.ordinal();
    }
}
