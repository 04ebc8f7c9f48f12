package com.example.musiccurator.domain.enumtype;

public enum CleanupMode {
    FAST, THOROUGH
}
