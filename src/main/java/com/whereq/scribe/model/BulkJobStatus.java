package com.whereq.scribe.model;

/**
 * Status of one slot in a bulk batch
 */
public enum BulkJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
