package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recommended term from NLP analysis
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NlpTerm {
    private String term;

    /**
     * Share of top competitors using the term, 0..100
     */
    private int usagePercent;
}
