package com.logtable.core.errors;

/**
 * Thrown when a parse request is invalid. Always raised before any file is opened.
 */
public class ConfigurationException extends LogtableException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
