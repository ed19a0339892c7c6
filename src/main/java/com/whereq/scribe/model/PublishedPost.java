package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a create or update call against the content store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishedPost {
    private Long id;

    private String link;
}
