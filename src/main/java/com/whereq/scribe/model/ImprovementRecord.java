package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry in a page's optimization history
 */
@Value
@Builder
public class ImprovementRecord {
    Instant timestamp;

    int score;

    /**
     * What produced the entry, e.g. the application version
     */
    String action;

    int wordCount;

    int qaScore;

    String version;
}
