package com.whereq.scribe.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Everything the synthesis engine needs to write one article
 */
@Value
@Builder
public class SynthesisRequest {
    String topic;

    String targetKeyword;

    /**
     * surgical or writer
     */
    String mode;

    String provider;

    String model;

    @ToString.Exclude
    String apiKey;

    int targetWords;

    String siteName;

    String siteUrl;

    String authorName;

    String country;

    String language;

    ExistingContentAnalysis existingAnalysis;

    EntityGapData entityGap;

    NeuronAnalysis neuron;

    @Builder.Default
    List<InternalLinkTarget> internalLinks = List.of();
}
