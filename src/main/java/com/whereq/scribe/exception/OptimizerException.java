package com.whereq.scribe.exception;

/**
 * Base class of the fatal failures that abort an optimization job.
 * The message is returned verbatim to callers.
 */
public abstract class OptimizerException extends RuntimeException {
    protected OptimizerException(String message) {
        super(message);
    }

    protected OptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
