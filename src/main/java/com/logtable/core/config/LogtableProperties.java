package com.logtable.core.config;

import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.OrderingMode;
import com.logtable.core.model.ParseRequest;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;

@Component
@ConfigurationProperties(prefix = "logtable")
public class LogtableProperties {

    private Parser parser = new Parser();

    // -- Parser accessors (delegate to nested) --
    public String getBackend() { return parser.backend; }
    public ErrorPolicy getOnError() { return parser.onError; }
    public OrderingMode getOrdering() { return parser.ordering; }
    public int getParallelism() { return parser.parallelism; }
    public int getBatchSize() { return parser.batchSize; }
    public int getMaxInFlightBatches() { return parser.maxInFlightBatches; }
    public String getCharset() { return parser.charset; }
    public boolean isAllowEmpty() { return parser.allowEmpty; }
    public long getMaxResultBytes() { return parser.maxResultBytes; }
    public String getDiagnosticColumn() { return parser.diagnosticColumn; }

    public Parser getParser() { return parser; }
    public void setParser(Parser parser) { this.parser = parser; }

    /**
     * Starts a request pre-filled with the configured defaults.
     */
    public ParseRequest.Builder newRequest() {
        return ParseRequest.builder()
                .backend(parser.backend)
                .onError(parser.onError)
                .ordering(parser.ordering)
                .parallelism(parser.parallelism)
                .batchSize(parser.batchSize)
                .maxInFlightBatches(parser.maxInFlightBatches)
                .charset(Charset.forName(parser.charset))
                .allowEmpty(parser.allowEmpty)
                .maxResultBytes(parser.maxResultBytes)
                .diagnosticColumn(parser.diagnosticColumn);
    }

    public static class Parser {
        private String backend = ParseRequest.DEFAULT_BACKEND;
        private ErrorPolicy onError = ErrorPolicy.RAISE;
        private OrderingMode ordering = OrderingMode.CANONICAL;
        /** Worker threads; 0 means one per available processor. */
        private int parallelism = 0;
        private int batchSize = ParseRequest.DEFAULT_BATCH_SIZE;
        /** 0 means twice the parallelism. */
        private int maxInFlightBatches = 0;
        private String charset = "UTF-8";
        private boolean allowEmpty = false;
        /** 0 means half of the maximum heap. */
        private long maxResultBytes = 0;
        private String diagnosticColumn = ParseRequest.DEFAULT_DIAGNOSTIC_COLUMN;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
        public ErrorPolicy getOnError() { return onError; }
        public void setOnError(ErrorPolicy onError) { this.onError = onError; }
        public OrderingMode getOrdering() { return ordering; }
        public void setOrdering(OrderingMode ordering) { this.ordering = ordering; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getMaxInFlightBatches() { return maxInFlightBatches; }
        public void setMaxInFlightBatches(int maxInFlightBatches) { this.maxInFlightBatches = maxInFlightBatches; }
        public String getCharset() { return charset; }
        public void setCharset(String charset) { this.charset = charset; }
        public boolean isAllowEmpty() { return allowEmpty; }
        public void setAllowEmpty(boolean allowEmpty) { this.allowEmpty = allowEmpty; }
        public long getMaxResultBytes() { return maxResultBytes; }
        public void setMaxResultBytes(long maxResultBytes) { this.maxResultBytes = maxResultBytes; }
        public String getDiagnosticColumn() { return diagnosticColumn; }
        public void setDiagnosticColumn(String diagnosticColumn) { this.diagnosticColumn = diagnosticColumn; }
    }
}
