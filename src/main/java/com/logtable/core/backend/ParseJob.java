package com.logtable.core.backend;

import com.logtable.core.dispatch.DispatchSettings;
import com.logtable.core.match.CompiledPattern;
import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.ParseRequest;

/**
 * A validated request with every host-derived default resolved.
 *
 * @param runId              run identifier
 * @param request            the original request
 * @param pattern            compiled regex and column names
 * @param parallelism        worker count
 * @param maxInFlightBatches bound on submitted but undelivered batches
 * @param maxResultBytes     bound on the estimated table size
 */
public record ParseJob(
    String runId,
    ParseRequest request,
    CompiledPattern pattern,
    int parallelism,
    int maxInFlightBatches,
    long maxResultBytes
) {

    public ErrorPolicy onError() {
        return request.onError();
    }

    /** The diagnostic column name, or {@code null} unless failures are kept as rows. */
    public String diagnosticColumn() {
        return request.onError() == ErrorPolicy.INCLUDE ? request.diagnosticColumn() : null;
    }

    public DispatchSettings dispatchSettings() {
        return new DispatchSettings(runId, parallelism, request.batchSize(), maxInFlightBatches,
                request.ordering(), request.onError() == ErrorPolicy.RAISE);
    }
}
