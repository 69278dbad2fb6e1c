package com.logtable.core.dispatch;

import com.logtable.core.model.OrderingMode;

/**
 * Per-run knobs for {@link ParallelDispatcher}. All counts are already resolved (no zero defaults).
 *
 * @param runId              run identifier propagated to worker MDC
 * @param parallelism        number of worker threads
 * @param batchSize          lines per batch
 * @param maxInFlightBatches batches submitted but not yet delivered
 * @param ordering           delivery order of batch results
 * @param failFast           propagate worker crashes instead of converting them to failures
 */
public record DispatchSettings(
    String runId,
    int parallelism,
    int batchSize,
    int maxInFlightBatches,
    OrderingMode ordering,
    boolean failFast
) {}
