package com.logtable.core.backend;

import com.logtable.core.dispatch.DispatchStats;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.LineRecord;
import com.logtable.core.model.ParseSummary;
import com.logtable.core.policy.OutcomeFilter;
import com.logtable.core.source.LineSource;
import com.logtable.core.table.TableAssembler;
import com.logtable.core.table.TabularResult;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Execution substrate for a parse run.
 * Implementations: LocalParseBackend (thread pool in this JVM). Other substrates register as
 * additional beans under their own {@link #name()}.
 * <p>
 * The contract is the same for every backend; only how files are listed, how batches are
 * scheduled and where the table lives may differ.
 */
public interface ParseBackend {

    /** Name used to select this backend in a request. */
    String name();

    /**
     * Expands the request's path patterns into an ordered list of files.
     */
    List<Path> resolveFiles(ParseJob job);

    /**
     * Opens a lazy line stream over the resolved files, in canonical order.
     */
    LineSource openLines(ParseJob job, List<Path> files);

    /**
     * Matches every line of {@code lines} and hands batch results to {@code consumer}.
     */
    DispatchStats dispatch(ParseJob job, Iterator<LineRecord> lines, Consumer<BatchResult> consumer);

    /**
     * Creates the assembler that collects retained rows for this run.
     */
    TableAssembler newAssembler(ParseJob job);

    /**
     * Runs the whole pipeline: resolve, stream, match, filter, assemble.
     */
    default TabularResult parse(ParseJob job) {
        long startMs = System.currentTimeMillis();
        List<Path> files = resolveFiles(job);
        TableAssembler assembler = newAssembler(job);
        var filter = new OutcomeFilter(job.onError(), assembler);

        DispatchStats stats;
        try (LineSource lines = openLines(job, files)) {
            stats = dispatch(job, lines, filter);
        }

        var summary = new ParseSummary(
                job.runId(),
                name(),
                files.size(),
                filter.totalLines(),
                filter.matchedLines(),
                filter.skippedLines(),
                filter.flaggedLines(),
                filter.failuresByReason(),
                stats.batches(),
                System.currentTimeMillis() - startMs);
        return assembler.build(summary);
    }
}
