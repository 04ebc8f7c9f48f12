package com.example.musiccurator.domain.enumtype;

public enum CleanupStatus {
    COMPLETED, PARTIAL_SUCCESS, DRY_RUN, NOTHING_TO_DELETE, BACKUP_FAILED, CANCELLED
}
