package com.whereq.scribe.exception;

import java.time.Duration;

/**
 * Exception thrown when a bulk job exceeds its wall-clock budget
 */
public class JobTimeoutException extends OptimizerException {
    public static final String MESSAGE = "Job timeout";

    private final Duration timeout;

    public JobTimeoutException(Duration timeout) {
        super(MESSAGE);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
