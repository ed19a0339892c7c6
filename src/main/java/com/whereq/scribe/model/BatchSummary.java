package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of a bulk batch
 */
@Value
@Builder
public class BatchSummary {
    String batchId;

    boolean running;

    boolean aborted;

    int concurrency;

    int total;

    int completed;

    int failed;

    long totalWords;

    /**
     * Rounded mean score of successful jobs, 0 when none succeeded
     */
    int avgScore;

    /**
     * Milliseconds from batch start to the end of the last wave
     */
    long totalTime;

    List<BulkJob> jobs;
}
