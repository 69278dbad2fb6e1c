package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;

import java.nio.file.Path;

/**
 * Thrown when a resolved file cannot be opened or fails while being read.
 */
public class UnreadableFileException extends LineFailureException {
    public UnreadableFileException(String message, Path file, long lineNumber) {
        super(message, file, lineNumber, null);
    }

    @Override
    public FailureReason reason() {
        return FailureReason.UNREADABLE_FILE;
    }
}
