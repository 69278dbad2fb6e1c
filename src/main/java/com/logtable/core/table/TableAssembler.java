package com.logtable.core.table;

import com.logtable.core.errors.ResultTooLargeException;
import com.logtable.core.match.MatchWorker;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.ParseSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates retained rows into columnar storage and builds the final {@link TabularResult}.
 * <p>
 * The assembler keeps a running estimate of the table's heap footprint and throws
 * {@link ResultTooLargeException} as soon as the next row would push it past the limit.
 */
public class TableAssembler {

    /** Rough per-String overhead on a 64-bit JVM with compressed oops. */
    static final int STRING_OVERHEAD_BYTES = 40;
    static final int REFERENCE_BYTES = 8;

    private final List<String> columnNames;
    private final int valueColumns;
    private final boolean diagnostics;
    private final List<List<String>> columns;
    private final long maxBytes;

    private long estimatedBytes;
    private long rows;

    /**
     * @param columns          requested column names, in order
     * @param diagnosticColumn name of the failure-reason column, or {@code null} when failures
     *                         are not kept as rows
     * @param maxBytes         upper bound for the estimated table size
     */
    public TableAssembler(List<String> columns, String diagnosticColumn, long maxBytes) {
        var names = new ArrayList<>(columns);
        this.diagnostics = diagnosticColumn != null;
        if (diagnostics) {
            names.add(diagnosticColumn);
        }
        this.columnNames = List.copyOf(names);
        this.valueColumns = columns.size();
        this.maxBytes = maxBytes;
        this.columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            this.columns.add(new ArrayList<>());
        }
    }

    public void appendRow(List<String> values) {
        if (values.size() != valueColumns) {
            throw new IllegalArgumentException("Expected " + valueColumns + " values but got " + values.size());
        }
        reserve(values, diagnostics ? MatchWorker.SENTINEL : null);
        for (int c = 0; c < valueColumns; c++) {
            columns.get(c).add(values.get(c));
        }
        if (diagnostics) {
            columns.get(valueColumns).add(MatchWorker.SENTINEL);
        }
        rows++;
    }

    /**
     * Appends a row with every value column set to the sentinel and the diagnostic column set
     * to {@code reason}.
     *
     * @throws IllegalStateException if this assembler was built without a diagnostic column
     */
    public void appendDiagnostic(FailureReason reason) {
        if (!diagnostics) {
            throw new IllegalStateException("No diagnostic column configured");
        }
        reserve(List.of(), reason.name());
        for (int c = 0; c < valueColumns; c++) {
            columns.get(c).add(MatchWorker.SENTINEL);
        }
        columns.get(valueColumns).add(reason.name());
        rows++;
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public long rowCount() {
        return rows;
    }

    public long estimatedBytes() {
        return estimatedBytes;
    }

    public TabularResult build(ParseSummary summary) {
        return new TabularResult(columnNames, columns, summary);
    }

    private void reserve(List<String> values, String diagnostic) {
        long cost = (long) columnNames.size() * REFERENCE_BYTES;
        for (String value : values) {
            cost += STRING_OVERHEAD_BYTES + 2L * value.length();
        }
        if (diagnostic != null) {
            cost += 2L * diagnostic.length();
        }
        if (estimatedBytes + cost > maxBytes) {
            throw new ResultTooLargeException(maxBytes, rows);
        }
        estimatedBytes += cost;
    }
}
