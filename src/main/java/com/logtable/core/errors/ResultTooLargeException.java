package com.logtable.core.errors;

/**
 * Thrown when the assembled table would exceed the configured memory limit.
 */
public class ResultTooLargeException extends LogtableException {

    private final long limitBytes;
    private final long rows;

    public ResultTooLargeException(long limitBytes, long rows) {
        super("Assembled table exceeds the result limit of " + limitBytes
                + " bytes after " + rows + " rows; narrow the input or raise logtable.parser.max-result-bytes");
        this.limitBytes = limitBytes;
        this.rows = rows;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    public long getRows() {
        return rows;
    }
}
