package com.whereq.scribe.exception;

/**
 * Exception thrown when an interactive job was cancelled
 */
public class JobCancelledException extends OptimizerException {
    public JobCancelledException(String reason) {
        super("Cancelled: " + reason);
    }
}
