package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Existing WordPress post with the assets needed for preservation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemotePost {
    private Long id;

    /**
     * Rendered title, may contain HTML entities
     */
    private String title;

    /**
     * Rendered body HTML
     */
    private String content;

    private String slug;

    private String link;

    private List<Long> categories;

    private List<Long> tags;

    private Long featuredMediaId;
}
