package com.whereq.scribe.model;

/**
 * Catalogue entry status
 */
public enum PageStatus {
    IDLE,
    ANALYZING,
    ANALYZED,
    ERROR
}
