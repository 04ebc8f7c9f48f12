package com.example.musiccurator.domain.enumtype;

public enum UpsertOutcome {
    INSERTED, UPDATED, UNCHANGED
}
