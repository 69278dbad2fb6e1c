package com.logtable.core.model;

import com.logtable.core.errors.ConfigurationException;

import java.util.Locale;

/**
 * How per-line failures are treated during a parse run.
 */
public enum ErrorPolicy {
    /** First failure aborts the run; no partial table is returned. */
    RAISE,
    /** Failures are dropped and counted. */
    SKIP,
    /** Failures are kept as diagnostic rows. */
    INCLUDE;

    /**
     * Parses a user-supplied policy name. {@code ignore} is accepted as an alias for {@link #SKIP}.
     */
    public static ErrorPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Error policy must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("IGNORE".equals(normalized)) {
            return SKIP;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Expected raise, skip or include but got: " + name);
        }
    }
}
