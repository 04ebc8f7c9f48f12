package com.example.musiccurator.domain.enumtype;

public enum MatchType {
    EXACT_METADATA, EXACT_CONTENT, FUZZY, NONE
}
