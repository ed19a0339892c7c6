package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One URL slot in a bulk batch
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BulkJob {
    private String id;

    private String url;

    @Builder.Default
    private BulkJobStatus status = BulkJobStatus.QUEUED;

    private Integer score;

    private Integer wordCount;

    private String error;

    private Instant startTime;

    private Instant endTime;
}
