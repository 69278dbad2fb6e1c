package com.logtable.core.match;

import com.logtable.core.errors.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompiledPatternTest {

    @Test
    @DisplayName("compiles when group count equals column count")
    void compiles() {
        var compiled = CompiledPattern.compile("^([A-Z]) (\\d+)$", List.of("letter", "num"));
        assertEquals(List.of("letter", "num"), compiled.columns());
        assertEquals(2, compiled.columnCount());
    }

    @Test
    @DisplayName("non-capturing and named groups are counted like the regex engine counts them")
    void groupKinds() {
        var compiled = CompiledPattern.compile("(?:x)(?<level>\\w+) (\\d+)", List.of("level", "code"));
        assertEquals(2, compiled.columnCount());
    }

    @Test
    @DisplayName("more columns than groups is a configuration error")
    void tooManyColumns() {
        var e = assertThrows(ConfigurationException.class,
                () -> CompiledPattern.compile("^([A-Z]) (\\d+)$", List.of("a", "b", "c")));
        assertTrue(e.getMessage().contains("do not match"));
    }

    @Test
    @DisplayName("empty regex is a configuration error")
    void emptyRegex() {
        assertThrows(ConfigurationException.class, () -> CompiledPattern.compile("", List.of("a")));
        assertThrows(ConfigurationException.class, () -> CompiledPattern.compile(null, List.of("a")));
    }

    @Test
    @DisplayName("invalid regex syntax is a configuration error")
    void invalidRegex() {
        var e = assertThrows(ConfigurationException.class,
                () -> CompiledPattern.compile("([A-Z]", List.of("a")));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("blank, missing or duplicate column names are rejected")
    void badColumns() {
        assertThrows(ConfigurationException.class, () -> CompiledPattern.compile("(a)", List.of()));
        assertThrows(ConfigurationException.class, () -> CompiledPattern.compile("(a)", List.of(" ")));
        assertThrows(ConfigurationException.class,
                () -> CompiledPattern.compile("(a)", Arrays.asList((String) null)));
        assertThrows(ConfigurationException.class,
                () -> CompiledPattern.compile("(a)(b)", List.of("x", "x")));
    }
}
