package com.logtable.core.model;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable description of one parse invocation.
 * <p>
 * Zero values for {@code parallelism}, {@code maxInFlightBatches} and {@code maxResultBytes}
 * mean "derive from the host" and are resolved by the engine before dispatch.
 * Validation is the engine's job so that every problem surfaces as a configuration error
 * before any file is opened.
 */
public record ParseRequest(
    List<String> paths,
    String regex,
    List<String> columns,
    ErrorPolicy onError,
    String backend,
    boolean allowEmpty,
    OrderingMode ordering,
    int parallelism,
    int batchSize,
    int maxInFlightBatches,
    Charset charset,
    long maxResultBytes,
    String diagnosticColumn
) {

    public static final String DEFAULT_BACKEND = "local";
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final String DEFAULT_DIAGNOSTIC_COLUMN = "_error";

    public ParseRequest {
        paths = paths == null ? List.of() : List.copyOf(paths);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .paths(paths)
                .regex(regex)
                .columns(columns)
                .onError(onError)
                .backend(backend)
                .allowEmpty(allowEmpty)
                .ordering(ordering)
                .parallelism(parallelism)
                .batchSize(batchSize)
                .maxInFlightBatches(maxInFlightBatches)
                .charset(charset)
                .maxResultBytes(maxResultBytes)
                .diagnosticColumn(diagnosticColumn);
    }

    public static final class Builder {
        private final List<String> paths = new ArrayList<>();
        private String regex;
        private final List<String> columns = new ArrayList<>();
        private ErrorPolicy onError = ErrorPolicy.RAISE;
        private String backend = DEFAULT_BACKEND;
        private boolean allowEmpty;
        private OrderingMode ordering = OrderingMode.CANONICAL;
        private int parallelism;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int maxInFlightBatches;
        private Charset charset = StandardCharsets.UTF_8;
        private long maxResultBytes;
        private String diagnosticColumn = DEFAULT_DIAGNOSTIC_COLUMN;

        private Builder() {}

        public Builder path(String path) {
            this.paths.add(path);
            return this;
        }

        public Builder paths(List<String> paths) {
            this.paths.clear();
            this.paths.addAll(paths);
            return this;
        }

        public Builder regex(String regex) {
            this.regex = regex;
            return this;
        }

        public Builder columns(String... columns) {
            return columns(Arrays.asList(columns));
        }

        public Builder columns(List<String> columns) {
            this.columns.clear();
            this.columns.addAll(columns);
            return this;
        }

        public Builder onError(ErrorPolicy onError) {
            this.onError = onError;
            return this;
        }

        public Builder backend(String backend) {
            this.backend = backend;
            return this;
        }

        public Builder allowEmpty(boolean allowEmpty) {
            this.allowEmpty = allowEmpty;
            return this;
        }

        public Builder ordering(OrderingMode ordering) {
            this.ordering = ordering;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxInFlightBatches(int maxInFlightBatches) {
            this.maxInFlightBatches = maxInFlightBatches;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder maxResultBytes(long maxResultBytes) {
            this.maxResultBytes = maxResultBytes;
            return this;
        }

        public Builder diagnosticColumn(String diagnosticColumn) {
            this.diagnosticColumn = diagnosticColumn;
            return this;
        }

        public ParseRequest build() {
            return new ParseRequest(paths, regex, columns, onError, backend, allowEmpty, ordering,
                    parallelism, batchSize, maxInFlightBatches, charset, maxResultBytes, diagnosticColumn);
        }
    }
}
