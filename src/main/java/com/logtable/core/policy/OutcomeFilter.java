package com.logtable.core.policy;

import com.logtable.core.errors.LineFailureException;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.MatchResult;
import com.logtable.core.table.TableAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Applies an {@link ErrorPolicy} to match results and forwards the retained rows to a
 * {@link TableAssembler}.
 * <ul>
 *   <li>{@code RAISE}: the first failure delivered is thrown as the matching
 *       {@link LineFailureException}.</li>
 *   <li>{@code SKIP}: failures are dropped and counted.</li>
 *   <li>{@code INCLUDE}: failures become diagnostic rows.</li>
 * </ul>
 * One instance per run; called from the dispatching thread only.
 */
public class OutcomeFilter implements Consumer<BatchResult> {

    private static final Logger log = LoggerFactory.getLogger(OutcomeFilter.class);

    private final ErrorPolicy policy;
    private final TableAssembler assembler;
    private final Map<FailureReason, Long> failures = new EnumMap<>(FailureReason.class);

    private long total;
    private long matched;
    private long skipped;
    private long flagged;

    public OutcomeFilter(ErrorPolicy policy, TableAssembler assembler) {
        this.policy = policy;
        this.assembler = assembler;
    }

    @Override
    public void accept(BatchResult batch) {
        for (MatchResult result : batch.results()) {
            apply(result);
        }
    }

    void apply(MatchResult result) {
        total++;
        if (result instanceof MatchResult.Success success) {
            matched++;
            assembler.appendRow(success.values());
            return;
        }

        var failure = (MatchResult.Failure) result;
        failures.merge(failure.reason(), 1L, Long::sum);
        switch (policy) {
            case RAISE -> throw LineFailureException.of(failure);
            case SKIP -> {
                skipped++;
                log.trace("Skipping line {} of {}: {}", failure.position().lineNumber(),
                        failure.file(), failure.reason());
            }
            case INCLUDE -> {
                flagged++;
                assembler.appendDiagnostic(failure.reason());
            }
        }
    }

    public long totalLines() {
        return total;
    }

    public long matchedLines() {
        return matched;
    }

    public long skippedLines() {
        return skipped;
    }

    public long flaggedLines() {
        return flagged;
    }

    public Map<FailureReason, Long> failuresByReason() {
        return Map.copyOf(failures);
    }
}
