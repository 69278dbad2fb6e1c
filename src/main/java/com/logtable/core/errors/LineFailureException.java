package com.logtable.core.errors;

import com.logtable.core.model.FailureReason;
import com.logtable.core.model.MatchResult;

import java.nio.file.Path;

/**
 * Base class for failures tied to a single input line. Carries the file, the 1-based line
 * number and the raw text so the caller can diagnose the line without re-running the parse.
 */
public abstract class LineFailureException extends LogtableException {

    private static final int MAX_TEXT_IN_MESSAGE = 200;

    private final Path file;
    private final long lineNumber;
    private final String rawText;

    protected LineFailureException(String message, Path file, long lineNumber, String rawText) {
        super(describe(message, file, lineNumber, rawText));
        this.file = file;
        this.lineNumber = lineNumber;
        this.rawText = rawText;
    }

    protected LineFailureException(String message, Path file, long lineNumber, String rawText, Throwable cause) {
        super(describe(message, file, lineNumber, rawText), cause);
        this.file = file;
        this.lineNumber = lineNumber;
        this.rawText = rawText;
    }

    /**
     * Converts a failed match into the exception for its reason.
     */
    public static LineFailureException of(MatchResult.Failure failure) {
        Path file = failure.file();
        long line = failure.position().lineNumber();
        String text = failure.rawText();
        String detail = failure.detail() == null || failure.detail().isBlank()
                ? failure.reason().name()
                : failure.detail();
        return switch (failure.reason()) {
            case NO_MATCH -> new NoMatchException("Regex failed to match", file, line, text);
            case SCHEMA_MISMATCH -> new SchemaMismatchException(detail, file, line, text);
            case DECODE_ERROR -> new DecodeException(detail, file, line, text);
            case UNREADABLE_FILE -> new UnreadableFileException(detail, file, line);
            case WORKER_CRASH -> new WorkerCrashException(detail, file, line, text);
        };
    }

    public abstract FailureReason reason();

    /** The file the line came from; {@code null} for failures not tied to a file. */
    public Path getFile() {
        return file;
    }

    /** 1-based line number; {@code 0} when the failure is not tied to a line. */
    public long getLineNumber() {
        return lineNumber;
    }

    public String getRawText() {
        return rawText;
    }

    private static String describe(String message, Path file, long lineNumber, String rawText) {
        var sb = new StringBuilder(message);
        if (file != null) {
            sb.append(" at ").append(file);
            if (lineNumber > 0) {
                sb.append(':').append(lineNumber);
            }
        }
        if (rawText != null) {
            String shown = rawText.length() > MAX_TEXT_IN_MESSAGE
                    ? rawText.substring(0, MAX_TEXT_IN_MESSAGE) + "..."
                    : rawText;
            sb.append(": ").append(shown);
        }
        return sb.toString();
    }
}
