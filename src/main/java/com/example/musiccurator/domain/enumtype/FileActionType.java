package com.example.musiccurator.domain.enumtype;

public enum FileActionType {
    KEEP, DELETE, DELETE_FAILED, WOULD_DELETE, SKIPPED
}
