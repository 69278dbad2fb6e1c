package com.logtable.core.model;

import java.util.Map;

/**
 * Run metadata returned alongside every table so that dropped or flagged lines are observable.
 *
 * @param runId            identifier of the parse run (also the {@code runId} MDC key)
 * @param backend          name of the backend that executed the run
 * @param filesResolved    number of files the path patterns resolved to
 * @param totalLines       lines seen, including failed ones
 * @param matchedLines     lines that produced captured values
 * @param skippedLines     failed lines dropped under {@link ErrorPolicy#SKIP}
 * @param flaggedLines     failed lines kept as diagnostic rows under {@link ErrorPolicy#INCLUDE}
 * @param failuresByReason failed line counts per reason, regardless of policy
 * @param batches          number of batches dispatched
 * @param elapsedMs        wall-clock duration of the run
 */
public record ParseSummary(
    String runId,
    String backend,
    int filesResolved,
    long totalLines,
    long matchedLines,
    long skippedLines,
    long flaggedLines,
    Map<FailureReason, Long> failuresByReason,
    long batches,
    long elapsedMs
) {

    public ParseSummary {
        failuresByReason = Map.copyOf(failuresByReason);
    }

    public long failedLines() {
        return failuresByReason.values().stream().mapToLong(Long::longValue).sum();
    }

    public long failures(FailureReason reason) {
        return failuresByReason.getOrDefault(reason, 0L);
    }
}
