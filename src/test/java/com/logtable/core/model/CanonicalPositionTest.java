package com.logtable.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalPositionTest {

    @Test
    @DisplayName("positions order by file first, then by line")
    void ordering() {
        var expected = List.of(
                new CanonicalPosition(0, 0),
                new CanonicalPosition(0, 99),
                new CanonicalPosition(1, 0),
                new CanonicalPosition(2, 5));
        var shuffled = new ArrayList<>(expected);
        Collections.reverse(shuffled);
        Collections.sort(shuffled);
        assertEquals(expected, shuffled);
    }

    @Test
    @DisplayName("line numbers are 1-based")
    void lineNumber() {
        assertEquals(1, new CanonicalPosition(3, 0).lineNumber());
        assertEquals(100, new CanonicalPosition(0, 99).lineNumber());
    }
}
