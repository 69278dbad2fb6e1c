package com.logtable.dispatch.cli;

import com.logtable.core.model.FailureReason;
import com.logtable.core.model.ParseSummary;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored status output for the logtable CLI.
 * Everything goes to stderr so that table data on stdout stays machine-readable.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LOGTABLE]|@ " + message));
    }

    public static void success(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void summary(ParseSummary s) {
        System.err.println("──────────────────────────────────");
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + s.runId() + "|@ (" + s.backend() + ")"));
        System.err.println("  Files: " + s.filesResolved() + ", batches: " + s.batches());
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "  Lines: " + s.totalLines() + " read, @|fg(green) " + s.matchedLines() + " matched|@"
                        + (s.skippedLines() > 0 ? ", @|fg(yellow) " + s.skippedLines() + " skipped|@" : "")
                        + (s.flaggedLines() > 0 ? ", @|fg(yellow) " + s.flaggedLines() + " flagged|@" : "")));
        for (Map.Entry<FailureReason, Long> entry : s.failuresByReason().entrySet()) {
            System.err.println("    " + entry.getKey() + ": " + entry.getValue());
        }
        System.err.println("  Duration: " + formatDuration(s.elapsedMs()));
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
