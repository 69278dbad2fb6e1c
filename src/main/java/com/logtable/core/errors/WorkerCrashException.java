package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;

import java.nio.file.Path;

/**
 * Thrown when a worker fails unexpectedly while matching a batch.
 */
public class WorkerCrashException extends LineFailureException {
    public WorkerCrashException(String message, Path file, long lineNumber, String rawText) {
        super(message, file, lineNumber, rawText);
    }

    public WorkerCrashException(String message, Path file, long lineNumber, String rawText, Throwable cause) {
        super(message, file, lineNumber, rawText, cause);
    }

    @Override
    public FailureReason reason() {
        return FailureReason.WORKER_CRASH;
    }
}
