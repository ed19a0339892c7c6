package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * WordPress post metadata captured before regeneration, selectively reapplied at publish time
 */
@Value
@Builder
public class PreservationRecord {
    String originalSlug;

    String originalLink;

    @Builder.Default
    List<Long> categories = List.of();

    @Builder.Default
    List<Long> tags = List.of();

    Long featuredMediaId;

    public static PreservationRecord from(RemotePost post) {
        return PreservationRecord.builder()
            .originalSlug(post.getSlug())
            .originalLink(post.getLink())
            .categories(post.getCategories() != null ? List.copyOf(post.getCategories()) : List.of())
            .tags(post.getTags() != null ? List.copyOf(post.getTags()) : List.of())
            .featuredMediaId(post.getFeaturedMediaId() != null && post.getFeaturedMediaId() > 0
                ? post.getFeaturedMediaId() : null)
            .build();
    }
}
