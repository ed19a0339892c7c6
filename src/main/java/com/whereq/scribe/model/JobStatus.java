package com.whereq.scribe.model;

/**
 * Coarse job lifecycle, tracked next to the fine-grained {@link Phase}
 */
public enum JobStatus {
    /**
     * Known but never run
     */
    IDLE,

    /**
     * Owned by an orchestrator run
     */
    RUNNING,

    /**
     * Published successfully
     */
    COMPLETED,

    /**
     * Terminated with error
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
