package com.logtable.core.backend;

import com.logtable.core.errors.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Looks up {@link ParseBackend}s by name. Every backend bean in the context is registered.
 */
@Component
public class BackendRegistry {

    private final Map<String, ParseBackend> backends = new LinkedHashMap<>();

    public BackendRegistry(List<ParseBackend> backends) {
        for (ParseBackend backend : backends) {
            String key = backend.name().toLowerCase(Locale.ROOT);
            if (this.backends.putIfAbsent(key, backend) != null) {
                throw new IllegalStateException("Duplicate backend name: " + backend.name());
            }
        }
    }

    /**
     * @throws ConfigurationException if no backend has that name
     */
    public ParseBackend get(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Backend must not be blank");
        }
        ParseBackend backend = backends.get(name.trim().toLowerCase(Locale.ROOT));
        if (backend == null) {
            throw new ConfigurationException("Unknown backend " + name + "; available: " + backends.keySet());
        }
        return backend;
    }

    public Set<String> names() {
        return backends.keySet();
    }
}
