package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Article produced by the synthesis engine
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SynthesizedContent {
    private String title;

    private String htmlContent;

    private String excerpt;

    private String slug;

    private String metaDescription;

    private String youtubeVideoUrl;

    private int referenceCount;
}
