package com.example.musiccurator.domain.enumtype;

public enum CheckLevel {
    ERROR, WARNING, INFO
}
