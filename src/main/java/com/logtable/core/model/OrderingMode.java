package com.logtable.core.model;

/**
 * Row order of the assembled table.
 */
public enum OrderingMode {
    /** File resolution order, then on-disk line order. The default. */
    CANONICAL,
    /** Batches are appended as workers finish them. Opt-in only. */
    UNORDERED
}
