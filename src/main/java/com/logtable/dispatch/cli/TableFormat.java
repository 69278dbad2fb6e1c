package com.logtable.dispatch.cli;

/**
 * Output formats supported by {@code logtable parse}.
 */
public enum TableFormat {
    TABLE,
    CSV,
    JSON
}
