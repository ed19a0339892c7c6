package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of a WordPress create/update request. Absent fields are left untouched by WordPress.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PostPayload {
    private String title;

    private String content;

    private String excerpt;

    /**
     * publish or draft
     */
    private String status;

    private String slug;

    private List<Long> categories;

    private List<Long> tags;

    @JsonProperty("featured_media")
    private Long featuredMedia;
}
