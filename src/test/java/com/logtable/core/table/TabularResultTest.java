package com.logtable.core.table;

import com.logtable.core.model.ParseSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TabularResultTest {

    private static final ParseSummary SUMMARY =
            new ParseSummary("run", "local", 1, 3, 3, 0, 0, Map.of(), 1, 5);

    private TabularResult table;

    @BeforeEach
    void setUp() {
        var assembler = new TableAssembler(List.of("level", "msg"), null, Long.MAX_VALUE);
        assembler.appendRow(List.of("INFO", "started"));
        assembler.appendRow(List.of("WARN", "slow"));
        assembler.appendRow(List.of("INFO", "stopped"));
        table = assembler.build(SUMMARY);
    }

    @Test
    @DisplayName("rows are ordered maps in column order")
    void rowView() {
        var row = table.row(1);
        assertEquals(List.of("level", "msg"), List.copyOf(row.keySet()));
        assertEquals("slow", row.get("msg"));
        assertEquals(List.of("WARN", "slow"), table.rowValues(1));
        assertEquals(3, table.rows().count());
    }

    @Test
    @DisplayName("head, select and filter derive new tables sharing the summary")
    void derivedTables() {
        assertEquals(2, table.head(2).rowCount());
        assertEquals(3, table.head(10).rowCount());
        assertEquals(0, table.head(-1).rowCount());

        var msgOnly = table.select("msg");
        assertEquals(List.of("msg"), msgOnly.columnNames());
        assertEquals(List.of("started", "slow", "stopped"), msgOnly.column("msg"));

        var info = table.filter(r -> "INFO".equals(r.get("level")));
        assertEquals(List.of("started", "stopped"), info.column("msg"));
        assertSame(SUMMARY, info.summary());
    }

    @Test
    @DisplayName("unknown columns and rows out of range are rejected")
    void invalidAccess() {
        assertThrows(IllegalArgumentException.class, () -> table.column("nope"));
        assertThrows(IndexOutOfBoundsException.class, () -> table.row(3));
        assertThrows(IndexOutOfBoundsException.class, () -> table.get(-1, "msg"));
    }

    @Test
    @DisplayName("columns are read-only")
    void immutable() {
        assertThrows(UnsupportedOperationException.class, () -> table.column("msg").add("x"));
    }

    @Test
    @DisplayName("empty table keeps its columns")
    void empty() {
        var empty = TabularResult.empty(List.of("a", "b"), SUMMARY);
        assertTrue(empty.isEmpty());
        assertEquals(2, empty.columnCount());
        assertTrue(empty.column("a").isEmpty());
    }
}
