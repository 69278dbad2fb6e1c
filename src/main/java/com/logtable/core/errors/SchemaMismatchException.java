package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;

import java.nio.file.Path;

/**
 * Thrown when a match succeeds but yields a different number of groups than configured columns.
 */
public class SchemaMismatchException extends LineFailureException {
    public SchemaMismatchException(String message, Path file, long lineNumber, String rawText) {
        super(message, file, lineNumber, rawText);
    }

    @Override
    public FailureReason reason() {
        return FailureReason.SCHEMA_MISMATCH;
    }
}
