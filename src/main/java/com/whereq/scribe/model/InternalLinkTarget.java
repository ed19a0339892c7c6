package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

/**
 * Catalogue page offered to the synthesis engine as an internal link
 */
@Value
@Builder
public class InternalLinkTarget {
    String url;

    String title;

    String slug;
}
