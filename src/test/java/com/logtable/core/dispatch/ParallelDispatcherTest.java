package com.logtable.core.dispatch;

import com.logtable.core.errors.WorkerCrashException;
import com.logtable.core.match.CompiledPattern;
import com.logtable.core.match.MatchWorker;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.CanonicalPosition;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.LineRecord;
import com.logtable.core.model.MatchResult;
import com.logtable.core.model.OrderingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ParallelDispatcherTest {

    private static final Path FILE = Path.of("gen.log");
    private static final CompiledPattern PATTERN =
            CompiledPattern.compile("^L(\\d+) (\\w+)$", List.of("id", "word"));

    /** Lazily generates lines; every 7th line does not match. */
    private static final class GeneratedLines implements Iterator<LineRecord> {
        private final int total;
        private int pulled;

        GeneratedLines(int total) {
            this.total = total;
        }

        @Override
        public boolean hasNext() {
            return pulled < total;
        }

        @Override
        public LineRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            int i = pulled++;
            String text = i % 7 == 6 ? "garbage " + i : "L" + i + " w" + i;
            return LineRecord.of(i / 100, i % 100, FILE, text);
        }
    }

    private static DispatchSettings settings(int parallelism, int batchSize, int maxInFlight,
                                             OrderingMode ordering, boolean failFast) {
        return new DispatchSettings("test", parallelism, batchSize, maxInFlight, ordering, failFast);
    }

    private static List<MatchResult> collect(ParallelDispatcher dispatcher, int lines, DispatchSettings settings) {
        var results = new ArrayList<MatchResult>();
        dispatcher.dispatch(new GeneratedLines(lines), PATTERN, settings, batch -> results.addAll(batch.results()));
        return results;
    }

    @Test
    @DisplayName("canonical mode delivers results in line order for any pool and batch size")
    void canonicalOrderIsStable() {
        var dispatcher = new ParallelDispatcher(new MatchWorker());
        var reference = collect(dispatcher, 1_000, settings(1, 1_000, 1, OrderingMode.CANONICAL, false));

        for (int parallelism : new int[]{1, 2, 8}) {
            for (int batchSize : new int[]{1, 7, 64, 5_000}) {
                var results = collect(dispatcher, 1_000,
                        settings(parallelism, batchSize, 2 * parallelism, OrderingMode.CANONICAL, false));
                assertEquals(reference, results,
                        "parallelism=" + parallelism + ", batchSize=" + batchSize);
            }
        }
        for (int i = 1; i < reference.size(); i++) {
            assertTrue(reference.get(i - 1).position().compareTo(reference.get(i).position()) < 0);
        }
    }

    @Test
    @DisplayName("unordered mode delivers every line exactly once")
    void unorderedDeliversEverything() {
        var dispatcher = new ParallelDispatcher(new MatchWorker());
        var results = collect(dispatcher, 2_000, settings(4, 16, 8, OrderingMode.UNORDERED, false));

        var positions = new ArrayList<CanonicalPosition>();
        results.forEach(r -> positions.add(r.position()));
        positions.sort(null);

        assertEquals(2_000, positions.size());
        for (int i = 0; i < positions.size(); i++) {
            assertEquals(new CanonicalPosition(i / 100, i % 100), positions.get(i));
        }
    }

    @Test
    @DisplayName("producer never reads further ahead than the in-flight bound allows")
    void boundedInFlight() {
        var dispatcher = new ParallelDispatcher(new MatchWorker());
        var source = new GeneratedLines(5_000);
        int batchSize = 10;
        int maxInFlight = 3;
        long[] delivered = {0};

        var stats = dispatcher.dispatch(source, PATTERN,
                settings(4, batchSize, maxInFlight, OrderingMode.CANONICAL, false),
                batch -> {
                    delivered[0] += batch.results().size();
                    long buffered = source.pulled - delivered[0];
                    assertTrue(buffered <= (long) (maxInFlight + 1) * batchSize,
                            "buffered " + buffered + " lines");
                });

        assertEquals(5_000, delivered[0]);
        assertEquals(500, stats.batches());
        assertEquals(5_000, stats.lines());
    }

    @Test
    @DisplayName("a crashed batch becomes WORKER_CRASH failures for each of its lines")
    void crashConvertedToFailures() {
        MatchWorker worker = spy(new MatchWorker());
        doThrow(new IllegalStateException("boom"))
                .when(worker).matchBatch(any(), argThat(b -> b != null && b.index() == 1));
        var dispatcher = new ParallelDispatcher(worker);

        var results = new ArrayList<MatchResult>();
        var stats = dispatcher.dispatch(new GeneratedLines(30), PATTERN,
                settings(2, 10, 4, OrderingMode.CANONICAL, false), batch -> results.addAll(batch.results()));

        assertEquals(30, results.size());
        assertEquals(1, stats.crashedBatches());
        for (int i = 10; i < 20; i++) {
            var failure = (MatchResult.Failure) results.get(i);
            assertEquals(FailureReason.WORKER_CRASH, failure.reason());
            assertEquals(i, failure.position().lineIndex());
            assertTrue(failure.detail().contains("boom"));
        }
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(20).isSuccess());
    }

    @Test
    @DisplayName("with failFast a worker crash propagates")
    void crashPropagatesWhenFailFast() {
        MatchWorker worker = spy(new MatchWorker());
        doThrow(new IllegalStateException("boom"))
                .when(worker).matchBatch(any(), argThat(b -> b != null && b.index() == 0));
        var dispatcher = new ParallelDispatcher(worker);

        var e = assertThrows(WorkerCrashException.class, () -> dispatcher.dispatch(new GeneratedLines(30), PATTERN,
                settings(2, 10, 4, OrderingMode.CANONICAL, true), batch -> {}));
        assertEquals(1, e.getLineNumber());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("consumer failure stops the producer and propagates")
    void consumerFailureCancels() {
        var dispatcher = new ParallelDispatcher(new MatchWorker());
        var source = new GeneratedLines(100_000);

        var e = assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(source, PATTERN,
                settings(2, 10, 2, OrderingMode.CANONICAL, false), batch -> {
                    throw new IllegalStateException("stop");
                }));

        assertEquals("stop", e.getMessage());
        assertTrue(source.pulled < 100_000, "source should not be drained, pulled " + source.pulled);
    }

    @Test
    @DisplayName("empty source dispatches nothing")
    void emptySource() {
        var dispatcher = new ParallelDispatcher(new MatchWorker());
        var batches = new ArrayList<BatchResult>();
        var stats = dispatcher.dispatch(new GeneratedLines(0), PATTERN,
                settings(2, 10, 4, OrderingMode.CANONICAL, false), batches::add);
        assertTrue(batches.isEmpty());
        assertEquals(0, stats.batches());
    }
}
