package com.logtable.core.table;

import com.logtable.core.model.ParseSummary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Immutable in-memory table of string columns produced by one parse run.
 * <p>
 * Storage is columnar; {@link #row(int)} and {@link #rows()} build row views on demand.
 * Derived tables ({@link #head}, {@link #select}, {@link #filter}) share the run
 * {@link #summary()} of the table they came from.
 */
public final class TabularResult {

    private final List<String> columnNames;
    private final List<List<String>> columns;
    private final int rowCount;
    private final ParseSummary summary;

    TabularResult(List<String> columnNames, List<List<String>> columns, ParseSummary summary) {
        this.columnNames = List.copyOf(columnNames);
        var frozen = new ArrayList<List<String>>(columns.size());
        for (List<String> column : columns) {
            frozen.add(Collections.unmodifiableList(column));
        }
        this.columns = Collections.unmodifiableList(frozen);
        this.rowCount = columns.isEmpty() ? 0 : columns.get(0).size();
        this.summary = summary;
    }

    /**
     * A table with the given columns and no rows.
     */
    public static TabularResult empty(List<String> columnNames, ParseSummary summary) {
        var columns = new ArrayList<List<String>>();
        for (int i = 0; i < columnNames.size(); i++) {
            columns.add(List.of());
        }
        return new TabularResult(columnNames, columns, summary);
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public int columnCount() {
        return columnNames.size();
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return columnNames.contains(name);
    }

    /**
     * All values of one column, top to bottom.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<String> column(String name) {
        return columns.get(indexOf(name));
    }

    public String get(int row, String column) {
        checkRow(row);
        return columns.get(indexOf(column)).get(row);
    }

    /**
     * One row as an ordered column-name to value map.
     */
    public Map<String, String> row(int row) {
        checkRow(row);
        var values = new LinkedHashMap<String, String>();
        for (int c = 0; c < columnNames.size(); c++) {
            values.put(columnNames.get(c), columns.get(c).get(row));
        }
        return values;
    }

    /** Row values in column order. */
    public List<String> rowValues(int row) {
        checkRow(row);
        var values = new ArrayList<String>(columnNames.size());
        for (List<String> column : columns) {
            values.add(column.get(row));
        }
        return values;
    }

    public Stream<Map<String, String>> rows() {
        return IntStream.range(0, rowCount).mapToObj(this::row);
    }

    public TabularResult head(int n) {
        int limit = Math.max(0, Math.min(n, rowCount));
        var sliced = new ArrayList<List<String>>(columns.size());
        for (List<String> column : columns) {
            sliced.add(column.subList(0, limit));
        }
        return new TabularResult(columnNames, sliced, summary);
    }

    public TabularResult select(String... names) {
        var picked = new ArrayList<List<String>>(names.length);
        for (String name : names) {
            picked.add(column(name));
        }
        return new TabularResult(Arrays.asList(names), picked, summary);
    }

    public TabularResult filter(Predicate<Map<String, String>> predicate) {
        var kept = new ArrayList<List<String>>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            kept.add(new ArrayList<>());
        }
        for (int r = 0; r < rowCount; r++) {
            if (predicate.test(row(r))) {
                for (int c = 0; c < columns.size(); c++) {
                    kept.get(c).add(columns.get(c).get(r));
                }
            }
        }
        return new TabularResult(columnNames, kept, summary);
    }

    /** Metadata of the run that produced this table. */
    public ParseSummary summary() {
        return summary;
    }

    private int indexOf(String name) {
        int index = columnNames.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column " + name + "; available: " + columnNames);
        }
        return index;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
        }
    }

    @Override
    public String toString() {
        return "TabularResult[" + rowCount + " rows x " + columnNames + "]";
    }
}
