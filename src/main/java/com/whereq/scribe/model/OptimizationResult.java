package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Terminal outcome of one orchestrator run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationResult {
    private boolean success;

    private int score;

    private int wordCount;

    /**
     * Failure message, absent on success
     */
    private String error;

    public static OptimizationResult success(int score, int wordCount) {
        return new OptimizationResult(true, score, wordCount, null);
    }

    public static OptimizationResult failure(String error) {
        return new OptimizationResult(false, 0, 0, error);
    }
}
