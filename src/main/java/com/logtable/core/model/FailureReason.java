package com.logtable.core.model;

/**
 * Why a single input line produced no captured values.
 */
public enum FailureReason {
    NO_MATCH,
    SCHEMA_MISMATCH,
    DECODE_ERROR,
    UNREADABLE_FILE,
    WORKER_CRASH
}
