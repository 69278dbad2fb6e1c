package com.logtable.core.dispatch;

/**
 * Counters collected by one {@link ParallelDispatcher#dispatch} call.
 */
public record DispatchStats(long batches, long lines, long crashedBatches) {}
