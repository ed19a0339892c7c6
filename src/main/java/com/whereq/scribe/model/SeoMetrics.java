package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Independent content metrics blended into the final page score. All scores are 0..100.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeoMetrics {
    private int wordCount;

    /**
     * Answer-engine readiness: question headings, FAQ, lists, tables
     */
    private int aeoScore;

    private int contentDepth;

    private int headingStructure;
}
