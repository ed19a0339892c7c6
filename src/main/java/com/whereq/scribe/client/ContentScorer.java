package com.whereq.scribe.client;

import com.whereq.scribe.model.QaResult;
import com.whereq.scribe.model.QualitySignals;
import com.whereq.scribe.model.SeoMetrics;

/**
 * Deterministic content quality scoring
 */
public interface ContentScorer {

    /**
     * QA pass over a generated article
     */
    QaResult score(String html, QualitySignals signals);

    /**
     * Independent SEO metrics for the final page score
     */
    SeoMetrics measure(String html, String title, String slug);
}
