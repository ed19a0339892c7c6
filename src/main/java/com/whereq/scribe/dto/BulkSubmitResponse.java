package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for bulk batch submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkSubmitResponse {

    private String batchId;

    /**
     * Jobs after URL normalisation
     */
    private int total;

    private int concurrency;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    public static BulkSubmitResponse error(String message) {
        return BulkSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
