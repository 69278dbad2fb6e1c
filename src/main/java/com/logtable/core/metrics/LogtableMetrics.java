package com.logtable.core.metrics;

import com.logtable.core.model.FailureReason;
import com.logtable.core.model.ParseSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Centralised Micrometer metrics for parse runs.
 */
@Service
public class LogtableMetrics {

    private final MeterRegistry registry;

    public LogtableMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordParseDuration(String backend, String outcome, long ms) {
        Timer.builder("logtable.parse.duration")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records line and batch counters of a completed run.
     */
    public void recordSummary(ParseSummary summary) {
        incrementLines("matched", summary.matchedLines());
        incrementLines("skipped", summary.skippedLines());
        incrementLines("flagged", summary.flaggedLines());
        for (Map.Entry<FailureReason, Long> entry : summary.failuresByReason().entrySet()) {
            recordFailures(entry.getKey(), entry.getValue());
        }
        Counter.builder("logtable.batches.dispatched")
                .description("Line batches handed to workers")
                .register(registry)
                .increment(summary.batches());
    }

    public void recordFailures(FailureReason reason, long count) {
        Counter.builder("logtable.failures.total")
                .tag("reason", reason.name())
                .register(registry)
                .increment(count);
    }

    private void incrementLines(String result, long count) {
        Counter.builder("logtable.lines.total")
                .tag("result", result)
                .register(registry)
                .increment(count);
    }
}
