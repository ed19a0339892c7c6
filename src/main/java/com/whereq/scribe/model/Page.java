package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Catalogue entry for a page that can be optimized
 */
@Value
@Builder(toBuilder = true)
public class Page {
    /**
     * Page URL
     */
    String id;

    String title;

    String slug;

    /**
     * Last final score, null when never optimized
     */
    Integer healthScore;

    Integer wordCount;

    @Builder.Default
    PageStatus status = PageStatus.IDLE;

    String targetKeyword;

    Long postId;

    Instant lastPublishedAt;

    SeoMetrics seoMetrics;

    @Builder.Default
    List<ImprovementRecord> improvementHistory = List.of();

    public int healthScoreOrZero() {
        return healthScore != null ? healthScore : 0;
    }

    public Page withImprovement(ImprovementRecord record) {
        List<ImprovementRecord> copy = new ArrayList<>(improvementHistory);
        copy.add(record);
        return toBuilder().improvementHistory(Collections.unmodifiableList(copy)).build();
    }
}
