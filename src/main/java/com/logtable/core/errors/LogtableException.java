package com.logtable.core.errors;

/**
 * Root of all failures raised by the parsing engine.
 */
public class LogtableException extends RuntimeException {
    public LogtableException(String message) {
        super(message);
    }

    public LogtableException(String message, Throwable cause) {
        super(message, cause);
    }
}
