package com.logtable.core.match;

import com.logtable.core.model.BatchResult;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.LineBatch;
import com.logtable.core.model.LineRecord;
import com.logtable.core.model.MatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.regex.Matcher;

/**
 * Applies a {@link CompiledPattern} to lines.
 * <p>
 * Stateless: safe to call from any number of threads. Never throws for line content;
 * every line yields exactly one {@link MatchResult}.
 */
@Component
public class MatchWorker {

    /** Value used for capture groups that did not participate in the match. */
    public static final String SENTINEL = "";

    /**
     * Searches {@code line} for the pattern (search semantics, as {@link Matcher#find()}).
     */
    public MatchResult match(CompiledPattern compiled, LineRecord line) {
        if (line.isDefective()) {
            return new MatchResult.Failure(line.position(), line.file(), line.defect(), line.text(),
                    line.defect() == FailureReason.DECODE_ERROR
                            ? "Line is not valid in the configured charset"
                            : line.text());
        }

        Matcher matcher = compiled.pattern().matcher(line.text());
        if (!matcher.find()) {
            return new MatchResult.Failure(line.position(), line.file(), FailureReason.NO_MATCH,
                    line.text(), "Regex failed to match");
        }

        int groups = matcher.groupCount();
        if (groups != compiled.columnCount()) {
            return new MatchResult.Failure(line.position(), line.file(), FailureReason.SCHEMA_MISMATCH,
                    line.text(), "Match produced " + groups + " groups for "
                            + compiled.columnCount() + " columns");
        }

        var values = new ArrayList<String>(groups);
        for (int g = 1; g <= groups; g++) {
            String value = matcher.group(g);
            values.add(value != null ? value : SENTINEL);
        }
        return new MatchResult.Success(line.position(), values);
    }

    public BatchResult matchBatch(CompiledPattern compiled, LineBatch batch) {
        var results = new ArrayList<MatchResult>(batch.size());
        for (LineRecord line : batch.lines()) {
            results.add(match(compiled, line));
        }
        return new BatchResult(batch.index(), results);
    }
}
