package com.example.musiccurator.domain.enumtype;

public enum VettingPhase {
    IDLE, SCANNING, MATCHING, SUMMARIZING, DONE
}
