package com.whereq.scribe.exception;

/**
 * Exception thrown when a required credential or endpoint is not configured
 */
public class ConfigurationException extends OptimizerException {
    public ConfigurationException(String message) {
        super(message);
    }
}
