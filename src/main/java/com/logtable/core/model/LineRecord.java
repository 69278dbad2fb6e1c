package com.logtable.core.model;

import java.nio.file.Path;

/**
 * One raw line read from a source file.
 *
 * @param fileIndex rank of the file in resolution order
 * @param lineIndex 0-based line index within the file
 * @param file      the file the line was read from
 * @param text      decoded line text without its terminator
 * @param defect    {@link FailureReason#DECODE_ERROR} or {@link FailureReason#UNREADABLE_FILE}
 *                  when the line could not be read cleanly; {@code null} otherwise
 */
public record LineRecord(
    int fileIndex,
    long lineIndex,
    Path file,
    String text,
    FailureReason defect
) {

    public static LineRecord of(int fileIndex, long lineIndex, Path file, String text) {
        return new LineRecord(fileIndex, lineIndex, file, text, null);
    }

    public CanonicalPosition position() {
        return new CanonicalPosition(fileIndex, lineIndex);
    }

    public boolean isDefective() {
        return defect != null;
    }
}
