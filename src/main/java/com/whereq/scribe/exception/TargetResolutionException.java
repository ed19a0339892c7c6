package com.whereq.scribe.exception;

/**
 * Exception thrown when no page can be selected for optimization
 */
public class TargetResolutionException extends OptimizerException {
    public TargetResolutionException(String message) {
        super(message);
    }
}
