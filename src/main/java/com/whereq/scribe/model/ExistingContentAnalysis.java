package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structure of the post body being replaced
 */
@Value
@Builder
public class ExistingContentAnalysis {
    int wordCount;

    @Builder.Default
    List<String> headings = List.of();

    int linkCount;

    int imageCount;
}
