package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

/**
 * SEO plugin metadata written after publishing
 */
@Value
@Builder
public class SeoMeta {
    String title;

    String description;

    String focusKeyword;
}
