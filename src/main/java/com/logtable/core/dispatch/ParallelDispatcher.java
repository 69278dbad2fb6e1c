package com.logtable.core.dispatch;

import com.logtable.core.errors.LogtableException;
import com.logtable.core.errors.WorkerCrashException;
import com.logtable.core.logging.MdcContext;
import com.logtable.core.match.CompiledPattern;
import com.logtable.core.match.MatchWorker;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.LineBatch;
import com.logtable.core.model.LineRecord;
import com.logtable.core.model.MatchResult;
import com.logtable.core.model.OrderingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs the {@link MatchWorker} over a line stream on a bounded pool of worker threads.
 * <p>
 * The calling thread is the single producer: it reads the source, cuts it into batches in
 * canonical order and submits them. At most {@code maxInFlightBatches} batches are submitted
 * but not yet handed to the consumer; when the limit is reached the producer stops reading
 * and waits for a result, so a slow consumer never causes the source to be buffered.
 * <p>
 * In {@link OrderingMode#CANONICAL} mode results reach the consumer in submission order; in
 * {@link OrderingMode#UNORDERED} mode they arrive as workers finish. The consumer always runs
 * on the calling thread.
 * <p>
 * The pool belongs to one {@link #dispatch} call. If the consumer throws, or a worker crashes
 * while {@code failFast} is set, every outstanding batch is cancelled, the pool is shut down
 * and the exception propagates.
 */
@Component
public class ParallelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelDispatcher.class);

    private final MatchWorker worker;

    public ParallelDispatcher(MatchWorker worker) {
        this.worker = worker;
    }

    public DispatchStats dispatch(Iterator<LineRecord> source, CompiledPattern compiled,
                                  DispatchSettings settings, Consumer<BatchResult> consumer) {
        ExecutorService pool = Executors.newFixedThreadPool(settings.parallelism(), workerThreads(settings.runId()));
        var run = new Run(pool, compiled, settings, consumer);
        boolean completed = false;
        try {
            run.produce(source);
            run.drain();
            completed = true;
            log.debug("Dispatched {} batch(es), {} line(s)", run.batches, run.lines);
            return new DispatchStats(run.batches, run.lines, run.crashedBatches);
        } finally {
            if (!completed) {
                run.cancelAll();
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }
    }

    private static ThreadFactory workerThreads(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "logtable-worker-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Pending(LineBatch batch, Future<BatchResult> future) {}

    /** State of one dispatch call; touched only by the calling thread. */
    private final class Run {

        private final ExecutorService pool;
        private final CompiledPattern compiled;
        private final DispatchSettings settings;
        private final Consumer<BatchResult> consumer;
        private final CompletionService<BatchResult> completion;
        private final Deque<Pending> ordered = new ArrayDeque<>();
        private final Map<Future<BatchResult>, Pending> unordered = new LinkedHashMap<>();

        private long batches;
        private long lines;
        private long crashedBatches;

        Run(ExecutorService pool, CompiledPattern compiled, DispatchSettings settings,
            Consumer<BatchResult> consumer) {
            this.pool = pool;
            this.compiled = compiled;
            this.settings = settings;
            this.consumer = consumer;
            this.completion = new ExecutorCompletionService<>(pool);
        }

        void produce(Iterator<LineRecord> source) {
            var buffer = new ArrayList<LineRecord>(settings.batchSize());
            while (source.hasNext()) {
                buffer.add(source.next());
                if (buffer.size() == settings.batchSize()) {
                    submit(new LineBatch(batches, buffer));
                    buffer.clear();
                }
            }
            if (!buffer.isEmpty()) {
                submit(new LineBatch(batches, buffer));
            }
        }

        void drain() {
            while (inFlight() > 0) {
                deliverNext();
            }
        }

        void cancelAll() {
            ordered.forEach(p -> p.future().cancel(true));
            unordered.keySet().forEach(f -> f.cancel(true));
            ordered.clear();
            unordered.clear();
        }

        private void submit(LineBatch batch) {
            while (inFlight() >= settings.maxInFlightBatches()) {
                deliverNext();
            }
            String runId = settings.runId();
            Callable<BatchResult> task = () -> {
                MdcContext.setBatch(runId, batch.index());
                try {
                    return worker.matchBatch(compiled, batch);
                } finally {
                    MdcContext.clear();
                }
            };
            // the completion queue is only drained in unordered mode
            if (settings.ordering() == OrderingMode.CANONICAL) {
                ordered.addLast(new Pending(batch, pool.submit(task)));
            } else {
                Future<BatchResult> future = completion.submit(task);
                unordered.put(future, new Pending(batch, future));
            }
            batches++;
            lines += batch.size();
            log.debug("Submitted batch {} ({} line(s), {} in flight)", batch.index(), batch.size(), inFlight());
        }

        private int inFlight() {
            return ordered.size() + unordered.size();
        }

        private void deliverNext() {
            Pending pending;
            if (settings.ordering() == OrderingMode.CANONICAL) {
                pending = ordered.removeFirst();
            } else {
                pending = unordered.remove(take());
            }
            consumer.accept(await(pending));
        }

        private Future<BatchResult> take() {
            try {
                return completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LogtableException("Interrupted while waiting for a worker", e);
            }
        }

        private BatchResult await(Pending pending) {
            try {
                return pending.future().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LogtableException("Interrupted while waiting for batch " + pending.batch().index(), e);
            } catch (ExecutionException | CancellationException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                return crashed(pending.batch(), cause);
            }
        }

        private BatchResult crashed(LineBatch batch, Throwable cause) {
            crashedBatches++;
            LineRecord first = batch.lines().get(0);
            String detail = "Worker failed on batch " + batch.index() + ": " + cause;
            if (settings.failFast()) {
                throw new WorkerCrashException(detail, first.file(), first.position().lineNumber(),
                        first.text(), cause);
            }
            log.warn("{}; converting {} line(s) to failures", detail, batch.size());
            var results = new ArrayList<MatchResult>(batch.size());
            for (LineRecord line : batch.lines()) {
                results.add(new MatchResult.Failure(line.position(), line.file(),
                        FailureReason.WORKER_CRASH, line.text(), detail));
            }
            return new BatchResult(batch.index(), results);
        }
    }
}
