package com.whereq.scribe.model;

/**
 * Non-fatal failures. They are logged and recorded on the job but never abort it.
 */
public enum SoftWarning {
    /**
     * No existing post found, or its content could not be fetched
     */
    RESOLUTION,

    /**
     * An optional enrichment phase (entity gap, NLP terms) failed
     */
    ANALYSIS,

    /**
     * SEO metadata update after publishing failed
     */
    METADATA
}
