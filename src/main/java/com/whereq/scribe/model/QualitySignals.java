package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Auxiliary inputs for quality scoring
 */
@Value
@Builder
public class QualitySignals {
    String title;

    String metaDescription;

    String targetKeyword;

    EntityGapData entityGap;

    @Builder.Default
    List<NlpTerm> nlpTerms = List.of();
}
