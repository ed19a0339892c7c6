package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SitemapResponse {

    private int discovered;

    /**
     * Pages that were not in the catalogue yet
     */
    private int added;

    private int totalPages;

    private String errorMessage;

    public static SitemapResponse error(String message) {
        return SitemapResponse.builder().errorMessage(message).build();
    }
}
