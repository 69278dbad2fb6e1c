package com.logtable.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for logtable.
 * Routes to subcommands: parse, backends.
 */
@Command(
        name = "logtable",
        mixinStandardHelpOptions = true,
        version = "logtable 0.1.0",
        description = "Turns log files into tables using regex capture groups",
        subcommands = {
                ParseCommand.class,
                BackendsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LogtableCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
