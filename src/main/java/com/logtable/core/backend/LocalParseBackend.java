package com.logtable.core.backend;

import com.logtable.core.dispatch.DispatchStats;
import com.logtable.core.dispatch.ParallelDispatcher;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.LineRecord;
import com.logtable.core.resolve.FileResolver;
import com.logtable.core.source.LineSource;
import com.logtable.core.table.TableAssembler;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the pipeline inside this JVM: local filesystem globbing, a fixed worker thread pool
 * and a heap-resident table.
 */
@Component
public class LocalParseBackend implements ParseBackend {

    public static final String NAME = "local";

    private final FileResolver resolver;
    private final ParallelDispatcher dispatcher;

    public LocalParseBackend(FileResolver resolver, ParallelDispatcher dispatcher) {
        this.resolver = resolver;
        this.dispatcher = dispatcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Path> resolveFiles(ParseJob job) {
        return resolver.resolve(job.request().paths(), job.request().allowEmpty());
    }

    @Override
    public LineSource openLines(ParseJob job, List<Path> files) {
        return new LineSource(files, job.request().charset());
    }

    @Override
    public DispatchStats dispatch(ParseJob job, Iterator<LineRecord> lines, Consumer<BatchResult> consumer) {
        return dispatcher.dispatch(lines, job.pattern(), job.dispatchSettings(), consumer);
    }

    @Override
    public TableAssembler newAssembler(ParseJob job) {
        return new TableAssembler(job.pattern().columns(), job.diagnosticColumn(), job.maxResultBytes());
    }
}
