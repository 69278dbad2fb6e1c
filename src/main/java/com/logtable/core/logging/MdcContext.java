package com.logtable.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing logtable-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setBatch(String runId, long batchIndex) {
        MDC.put("runId", runId);
        MDC.put("batchIndex", String.valueOf(batchIndex));
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("batchIndex");
    }
}
