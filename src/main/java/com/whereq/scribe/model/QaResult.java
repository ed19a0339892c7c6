package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a QA pass over generated content
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QaResult {
    /**
     * 0..100
     */
    private int score;

    @Builder.Default
    private List<Check> checks = List.of();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Check {
        private String name;
        private boolean passed;
        private int weight;
        private String detail;
    }
}
