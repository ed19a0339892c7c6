package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for cancellation and abort requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationResponse {

    /**
     * Whether a running job or batch received the request
     */
    private boolean accepted;

    private String reason;

    private Instant cancelledAt;

    private String message;
}
