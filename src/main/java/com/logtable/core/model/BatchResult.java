package com.logtable.core.model;

import java.util.List;

/**
 * Match results for one {@link LineBatch}, in the same order as its lines.
 */
public record BatchResult(long batchIndex, List<MatchResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }
}
