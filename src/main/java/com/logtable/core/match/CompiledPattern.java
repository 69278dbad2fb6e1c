package com.logtable.core.match;

import com.logtable.core.errors.ConfigurationException;

import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled regex together with the column names its capture groups map to.
 * <p>
 * Immutable and safe to share across worker threads; each worker obtains its own
 * {@link java.util.regex.Matcher}.
 */
public final class CompiledPattern {

    private final Pattern pattern;
    private final List<String> columns;

    private CompiledPattern(Pattern pattern, List<String> columns) {
        this.pattern = pattern;
        this.columns = columns;
    }

    /**
     * Compiles {@code regex} and checks it against {@code columns}.
     *
     * @throws ConfigurationException if the regex is blank or invalid, a column name is blank
     *                                or repeated, or the group count differs from the column count
     */
    public static CompiledPattern compile(String regex, List<String> columns) {
        if (regex == null || regex.isEmpty()) {
            throw new ConfigurationException("Regex must not be empty");
        }
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("At least one column name is required");
        }
        var seen = new HashSet<String>();
        for (String column : columns) {
            if (column == null || column.isBlank()) {
                throw new ConfigurationException("Column names must not be blank: " + columns);
            }
            if (!seen.add(column)) {
                throw new ConfigurationException("Duplicate column name: " + column);
            }
        }

        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regex: " + e.getDescription() + " in " + regex, e);
        }

        int groups = pattern.matcher("").groupCount();
        if (groups != columns.size()) {
            throw new ConfigurationException("Number of regex groups (" + groups
                    + ") and number of columns (" + columns.size() + ") do not match");
        }
        return new CompiledPattern(pattern, List.copyOf(columns));
    }

    public Pattern pattern() {
        return pattern;
    }

    public List<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    @Override
    public String toString() {
        return pattern.pattern() + " -> " + columns;
    }
}
