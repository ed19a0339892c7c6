package com.whereq.scribe.exception;

/**
 * Exception thrown when synthesis fails or produces insufficient content
 */
public class GenerationException extends OptimizerException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
