package com.whereq.scribe.exception;

/**
 * Exception thrown when creating or updating the WordPress post fails
 */
public class PublishException extends OptimizerException {
    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
