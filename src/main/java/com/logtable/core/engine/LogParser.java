package com.logtable.core.engine;

import com.logtable.core.backend.BackendRegistry;
import com.logtable.core.backend.LocalParseBackend;
import com.logtable.core.backend.ParseBackend;
import com.logtable.core.backend.ParseJob;
import com.logtable.core.dispatch.ParallelDispatcher;
import com.logtable.core.errors.ConfigurationException;
import com.logtable.core.errors.LineFailureException;
import com.logtable.core.errors.LogtableException;
import com.logtable.core.logging.MdcContext;
import com.logtable.core.match.CompiledPattern;
import com.logtable.core.match.MatchWorker;
import com.logtable.core.metrics.LogtableMetrics;
import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.ParseRequest;
import com.logtable.core.resolve.FileResolver;
import com.logtable.core.table.TabularResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Entry point of the parsing engine: validates a {@link ParseRequest}, hands it to the
 * selected {@link ParseBackend} and returns the assembled {@link TabularResult}.
 * <p>
 * Every configuration problem is reported as a {@link ConfigurationException} before any
 * file is touched.
 */
@Service
public class LogParser {

    private static final Logger log = LoggerFactory.getLogger(LogParser.class);

    private final BackendRegistry backends;
    private final LogtableMetrics metrics;

    @Autowired
    public LogParser(BackendRegistry backends, @Autowired(required = false) LogtableMetrics metrics) {
        this.backends = backends;
        this.metrics = metrics;
    }

    /**
     * A parser with only the local backend and no metrics, for use outside a Spring context.
     */
    public static LogParser local() {
        var backend = new LocalParseBackend(new FileResolver(), new ParallelDispatcher(new MatchWorker()));
        return new LogParser(new BackendRegistry(List.of(backend)), null);
    }

    public TabularResult parse(ParseRequest request) {
        ParseBackend backend = backends.get(request.backend());
        ParseJob job = prepare(request);

        MdcContext.setRun(job.runId());
        long startMs = System.currentTimeMillis();
        String outcome = "failed";
        try {
            log.info("Parsing {} with {} column(s) on backend {} (policy={}, ordering={}, workers={}, batch={})",
                    request.paths(), job.pattern().columnCount(), backend.name(), request.onError(),
                    request.ordering(), job.parallelism(), request.batchSize());

            TabularResult table = backend.parse(job);
            var summary = table.summary();
            log.info("Parsed {} line(s) from {} file(s): {} matched, {} skipped, {} flagged in {}ms",
                    summary.totalLines(), summary.filesResolved(), summary.matchedLines(),
                    summary.skippedLines(), summary.flaggedLines(), summary.elapsedMs());
            if (metrics != null) {
                metrics.recordSummary(summary);
            }
            outcome = "completed";
            return table;
        } catch (LineFailureException e) {
            log.error("Parse aborted: {}", e.getMessage());
            // zero resolved files carries no line and is not a line failure
            if (metrics != null && e.getLineNumber() > 0) {
                metrics.recordFailures(e.reason(), 1);
            }
            throw e;
        } catch (LogtableException e) {
            log.error("Parse failed: {}", e.getMessage());
            throw e;
        } finally {
            if (metrics != null) {
                metrics.recordParseDuration(backend.name(), outcome, System.currentTimeMillis() - startMs);
            }
            MdcContext.clear();
        }
    }

    /**
     * Validates the request and resolves host-derived defaults.
     *
     * @throws ConfigurationException on any invalid setting
     */
    ParseJob prepare(ParseRequest request) {
        if (request.paths().isEmpty()) {
            throw new ConfigurationException("At least one path pattern is required");
        }
        for (String path : request.paths()) {
            if (path == null || path.isBlank()) {
                throw new ConfigurationException("Path patterns must not be blank: " + request.paths());
            }
        }
        CompiledPattern pattern = CompiledPattern.compile(request.regex(), request.columns());

        if (request.onError() == null) {
            throw new ConfigurationException("Error policy is required");
        }
        if (request.ordering() == null) {
            throw new ConfigurationException("Ordering mode is required");
        }
        if (request.charset() == null) {
            throw new ConfigurationException("Charset is required");
        }
        if (request.batchSize() <= 0) {
            throw new ConfigurationException("Batch size must be positive: " + request.batchSize());
        }
        if (request.parallelism() < 0) {
            throw new ConfigurationException("Parallelism must not be negative: " + request.parallelism());
        }
        if (request.maxInFlightBatches() < 0) {
            throw new ConfigurationException("Max in-flight batches must not be negative: "
                    + request.maxInFlightBatches());
        }
        if (request.maxResultBytes() < 0) {
            throw new ConfigurationException("Max result bytes must not be negative: " + request.maxResultBytes());
        }
        if (request.onError() == ErrorPolicy.INCLUDE) {
            String diagnostic = request.diagnosticColumn();
            if (diagnostic == null || diagnostic.isBlank()) {
                throw new ConfigurationException("Diagnostic column name must not be blank");
            }
            if (request.columns().contains(diagnostic)) {
                throw new ConfigurationException("Diagnostic column " + diagnostic + " clashes with a requested column");
            }
        }

        int parallelism = request.parallelism() > 0
                ? request.parallelism()
                : Runtime.getRuntime().availableProcessors();
        int maxInFlight = request.maxInFlightBatches() > 0
                ? request.maxInFlightBatches()
                : 2 * parallelism;
        long maxResultBytes = request.maxResultBytes() > 0
                ? request.maxResultBytes()
                : Runtime.getRuntime().maxMemory() / 2;

        return new ParseJob(newRunId(), request, pattern, parallelism, maxInFlight, maxResultBytes);
    }

    private static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
