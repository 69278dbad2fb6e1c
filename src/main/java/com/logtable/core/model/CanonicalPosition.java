package com.logtable.core.model;

import java.util.Comparator;

/**
 * Position of a line in canonical order: file rank first, then 0-based line index within the file.
 *
 * @param fileIndex rank of the file in resolution order
 * @param lineIndex 0-based line index within the file
 */
public record CanonicalPosition(int fileIndex, long lineIndex) implements Comparable<CanonicalPosition> {

    private static final Comparator<CanonicalPosition> ORDER =
            Comparator.comparingInt(CanonicalPosition::fileIndex)
                    .thenComparingLong(CanonicalPosition::lineIndex);

    /** 1-based line number, for messages. */
    public long lineNumber() {
        return lineIndex + 1;
    }

    @Override
    public int compareTo(CanonicalPosition other) {
        return ORDER.compare(this, other);
    }
}
