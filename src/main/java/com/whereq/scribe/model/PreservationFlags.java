package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which preserved fields are reapplied when updating an existing post
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreservationFlags {
    @Builder.Default
    private boolean preserveFeaturedImage = true;

    @Builder.Default
    private boolean preserveSlug = true;

    @Builder.Default
    private boolean preserveCategories = true;

    @Builder.Default
    private boolean preserveTags = true;
}
