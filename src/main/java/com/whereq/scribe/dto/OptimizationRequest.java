package com.whereq.scribe.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to optimize one page
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequest {

    /**
     * Target page URL. When absent the catalogue page with the lowest health score is picked.
     */
    @Pattern(regexp = "https?://\\S+", message = "url must be an absolute http(s) URL")
    private String url;

    /**
     * Keyword overriding the topic derived from the existing post
     */
    @Size(max = 200)
    private String targetKeyword;

    public static OptimizationRequest forUrl(String url) {
        return OptimizationRequest.builder().url(url).build();
    }
}
