package com.logtable.dispatch.cli;

import com.logtable.core.backend.BackendRegistry;
import com.logtable.core.config.LogtableProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: logtable backends
 * <p>
 * Lists the registered execution backends and marks the configured default.
 */
@Command(name = "backends", mixinStandardHelpOptions = true, description = "List available execution backends")
@Component
public class BackendsCommand implements Runnable {

    private final BackendRegistry registry;
    private final LogtableProperties properties;

    public BackendsCommand(BackendRegistry registry, LogtableProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void run() {
        for (String name : registry.names()) {
            boolean isDefault = name.equalsIgnoreCase(properties.getBackend());
            System.out.println(name + (isDefault ? " (default)" : ""));
        }
    }
}
