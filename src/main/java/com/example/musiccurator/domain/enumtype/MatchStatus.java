package com.example.musiccurator.domain.enumtype;

public enum MatchStatus {
    NEW, DUPLICATE, UNCERTAIN
}
