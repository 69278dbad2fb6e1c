package com.logtable.core.backend;

import com.logtable.core.errors.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BackendRegistryTest {

    private static ParseBackend backend(String name) {
        ParseBackend backend = mock(ParseBackend.class);
        when(backend.name()).thenReturn(name);
        return backend;
    }

    @Test
    @DisplayName("lookup is case-insensitive")
    void lookup() {
        var local = backend("local");
        var registry = new BackendRegistry(List.of(local, backend("Remote")));

        assertSame(local, registry.get("LOCAL"));
        assertSame(local, registry.get(" local "));
        assertEquals(Set.of("local", "remote"), registry.names());
    }

    @Test
    @DisplayName("unknown or blank names are configuration errors")
    void unknown() {
        var registry = new BackendRegistry(List.of(backend("local")));

        var e = assertThrows(ConfigurationException.class, () -> registry.get("cluster"));
        assertTrue(e.getMessage().contains("[local]"));
        assertThrows(ConfigurationException.class, () -> registry.get(" "));
        assertThrows(ConfigurationException.class, () -> registry.get(null));
    }

    @Test
    @DisplayName("two backends with the same name are rejected")
    void duplicate() {
        assertThrows(IllegalStateException.class,
                () -> new BackendRegistry(List.of(backend("local"), backend("Local"))));
    }
}
