package com.logtable.core.model;

import java.util.List;

/**
 * A contiguous run of lines dispatched together to one worker.
 *
 * @param index sequence number of the batch in submission order
 * @param lines the lines, in canonical order
 */
public record LineBatch(long index, List<LineRecord> lines) {

    public LineBatch {
        lines = List.copyOf(lines);
    }

    public int size() {
        return lines.size();
    }
}
