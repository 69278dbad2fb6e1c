package com.logtable.dispatch.cli;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.logtable.core.table.TabularResult;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Renders a {@link TabularResult} as aligned text, CSV with a header row, or JSON lines.
 * The target writer is flushed but never closed.
 */
public class TableWriter {

    /** Widest cell shown in {@link TableFormat#TABLE} output before truncation. */
    static final int MAX_CELL_WIDTH = 60;

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
    private final CsvMapper csvMapper = CsvMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

    public void write(TabularResult table, TableFormat format, Writer out) throws IOException {
        switch (format) {
            case TABLE -> writeText(table, out);
            case CSV -> writeCsv(table, out);
            case JSON -> writeJsonLines(table, out);
        }
        out.flush();
    }

    private void writeCsv(TabularResult table, Writer out) throws IOException {
        var schema = CsvSchema.builder()
                .addColumns(table.columnNames(), CsvSchema.ColumnType.STRING)
                .build()
                .withHeader();
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(out)) {
            for (int r = 0; r < table.rowCount(); r++) {
                rows.write(table.row(r));
            }
        }
    }

    private void writeJsonLines(TabularResult table, Writer out) throws IOException {
        for (int r = 0; r < table.rowCount(); r++) {
            out.write(jsonMapper.writeValueAsString(table.row(r)));
            out.write(System.lineSeparator());
        }
    }

    private void writeText(TabularResult table, Writer out) throws IOException {
        List<String> names = table.columnNames();
        int[] widths = new int[names.size()];
        for (int c = 0; c < names.size(); c++) {
            widths[c] = Math.min(MAX_CELL_WIDTH, names.get(c).length());
        }
        for (int r = 0; r < table.rowCount(); r++) {
            List<String> values = table.rowValues(r);
            for (int c = 0; c < values.size(); c++) {
                widths[c] = Math.max(widths[c], Math.min(MAX_CELL_WIDTH, values.get(c).length()));
            }
        }

        writeTextRow(names, widths, out);
        var rule = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            if (c > 0) rule.append("-+-");
            rule.append("-".repeat(widths[c]));
        }
        out.write(rule.toString());
        out.write(System.lineSeparator());
        for (int r = 0; r < table.rowCount(); r++) {
            writeTextRow(table.rowValues(r), widths, out);
        }
    }

    private static void writeTextRow(List<String> values, int[] widths, Writer out) throws IOException {
        var line = new StringBuilder();
        for (int c = 0; c < values.size(); c++) {
            if (c > 0) line.append(" | ");
            String value = values.get(c);
            if (value.length() > widths[c]) {
                value = value.substring(0, widths[c] - 3) + "...";
            }
            line.append(value).append(" ".repeat(widths[c] - value.length()));
        }
        out.write(line.toString().stripTrailing());
        out.write(System.lineSeparator());
    }
}
