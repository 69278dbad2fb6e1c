package com.logtable.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of matching one line: either the captured values or a structured failure.
 * Both variants keep the canonical position of the line they came from.
 */
public interface MatchResult {

    CanonicalPosition position();

    boolean isSuccess();

    /**
     * Captured group values in declaration order. Groups that did not participate are {@code ""}.
     */
    record Success(CanonicalPosition position, List<String> values) implements MatchResult {
        public Success {
            values = List.copyOf(values);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A line that yielded no row.
     *
     * @param position canonical position of the line
     * @param file     source file
     * @param reason   failure category
     * @param rawText  the raw line (or the I/O error message for unreadable files)
     * @param detail   extra context such as the exception message; may be empty
     */
    record Failure(CanonicalPosition position, Path file, FailureReason reason,
                   String rawText, String detail) implements MatchResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
