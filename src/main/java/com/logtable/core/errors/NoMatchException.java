package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when a line does not match the regex, or when the path patterns resolve to no files.
 */
public class NoMatchException extends LineFailureException {

    public NoMatchException(String message, Path file, long lineNumber, String rawText) {
        super(message, file, lineNumber, rawText);
    }

    /**
     * The path patterns matched zero files. Carries no line context.
     */
    public static NoMatchException noFiles(List<String> patterns) {
        return new NoMatchException("No files match " + patterns, null, 0, null);
    }

    @Override
    public FailureReason reason() {
        return FailureReason.NO_MATCH;
    }
}
