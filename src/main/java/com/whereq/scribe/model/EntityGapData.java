package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Search-derived gaps between the existing content and what ranks for the topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityGapData {
    /**
     * Related entities the existing content never mentions
     */
    @Builder.Default
    private List<String> missingEntities = List.of();

    /**
     * "People also ask" questions
     */
    @Builder.Default
    private List<String> paaQuestions = List.of();

    @Builder.Default
    private List<String> competitorUrls = List.of();

    /**
     * Candidate citation URLs
     */
    @Builder.Default
    private List<String> validatedReferences = List.of();
}
