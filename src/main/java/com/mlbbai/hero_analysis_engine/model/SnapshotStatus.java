package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of the hero snapshot.
 * INITIALIZING -> SCRAPING -> READY | STALE | ERROR, and back to SCRAPING on every refresh.
 */
public enum SnapshotStatus {
    INITIALIZING,
    SCRAPING,
    READY,
    STALE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
