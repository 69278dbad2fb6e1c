package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;

import java.nio.file.Path;

/**
 * Thrown when a line contains bytes that are invalid in the configured charset.
 */
public class DecodeException extends LineFailureException {
    public DecodeException(String message, Path file, long lineNumber, String rawText) {
        super(message, file, lineNumber, rawText);
    }

    @Override
    public FailureReason reason() {
        return FailureReason.DECODE_ERROR;
    }
}
