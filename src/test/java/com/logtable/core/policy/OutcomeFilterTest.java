package com.logtable.core.policy;

import com.logtable.core.errors.DecodeException;
import com.logtable.core.errors.NoMatchException;
import com.logtable.core.model.BatchResult;
import com.logtable.core.model.CanonicalPosition;
import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.FailureReason;
import com.logtable.core.model.MatchResult;
import com.logtable.core.table.TableAssembler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OutcomeFilterTest {

    private static final Path FILE = Path.of("app.log");

    private static MatchResult success(long line, String... values) {
        return new MatchResult.Success(new CanonicalPosition(0, line), List.of(values));
    }

    private static MatchResult failure(long line, FailureReason reason, String raw) {
        return new MatchResult.Failure(new CanonicalPosition(0, line), FILE, reason, raw, "detail");
    }

    private static BatchResult batch(MatchResult... results) {
        return new BatchResult(0, List.of(results));
    }

    @Test
    @DisplayName("RAISE throws on the first failure with file, line and raw text")
    void raise() {
        var assembler = mock(TableAssembler.class);
        var filter = new OutcomeFilter(ErrorPolicy.RAISE, assembler);

        var e = assertThrows(NoMatchException.class, () -> filter.accept(batch(
                success(0, "A", "1"),
                failure(1, FailureReason.NO_MATCH, "garbage"),
                success(2, "B", "2"))));

        assertEquals(FILE, e.getFile());
        assertEquals(2, e.getLineNumber());
        assertEquals("garbage", e.getRawText());
        assertTrue(e.getMessage().contains("app.log:2"));
        verify(assembler, times(1)).appendRow(any());
    }

    @Test
    @DisplayName("RAISE maps each failure reason to its exception type")
    void raiseMapsReason() {
        var filter = new OutcomeFilter(ErrorPolicy.RAISE, mock(TableAssembler.class));
        assertThrows(DecodeException.class,
                () -> filter.accept(batch(failure(0, FailureReason.DECODE_ERROR, "�"))));
    }

    @Test
    @DisplayName("SKIP drops failures and counts them")
    void skip() {
        var assembler = mock(TableAssembler.class);
        var filter = new OutcomeFilter(ErrorPolicy.SKIP, assembler);

        filter.accept(batch(
                success(0, "A", "1"),
                failure(1, FailureReason.NO_MATCH, "garbage"),
                failure(2, FailureReason.DECODE_ERROR, "x")));

        assertEquals(3, filter.totalLines());
        assertEquals(1, filter.matchedLines());
        assertEquals(2, filter.skippedLines());
        assertEquals(0, filter.flaggedLines());
        assertEquals(1L, filter.failuresByReason().get(FailureReason.NO_MATCH));
        assertEquals(1L, filter.failuresByReason().get(FailureReason.DECODE_ERROR));
        verify(assembler).appendRow(List.of("A", "1"));
        verify(assembler, never()).appendDiagnostic(any());
    }

    @Test
    @DisplayName("INCLUDE turns failures into diagnostic rows")
    void include() {
        var assembler = mock(TableAssembler.class);
        var filter = new OutcomeFilter(ErrorPolicy.INCLUDE, assembler);

        filter.accept(batch(success(0, "A", "1"), failure(1, FailureReason.NO_MATCH, "garbage")));

        assertEquals(1, filter.flaggedLines());
        assertEquals(0, filter.skippedLines());
        verify(assembler).appendRow(List.of("A", "1"));
        verify(assembler).appendDiagnostic(FailureReason.NO_MATCH);
    }
}
