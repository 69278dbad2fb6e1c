package com.logtable.dispatch.cli;

import com.logtable.core.config.LogtableProperties;
import com.logtable.core.engine.LogParser;
import com.logtable.core.errors.ConfigurationException;
import com.logtable.core.errors.LogtableException;
import com.logtable.core.model.ErrorPolicy;
import com.logtable.core.model.OrderingMode;
import com.logtable.core.table.TabularResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: logtable parse -p "&lt;glob&gt;" -r "&lt;regex&gt;" -c a,b,c
 * <p>
 * Parses the matching files into a table and prints it. Unset options fall back to the
 * {@code logtable.parser.*} properties.
 */
@Command(name = "parse", mixinStandardHelpOptions = true, description = "Parse log files into a table")
@Component
public class ParseCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    @Option(names = {"--path", "-p"}, required = true, arity = "1..*",
            description = "Glob pattern(s) of the files to parse")
    private List<String> paths;

    @Option(names = {"--regex", "-r"}, required = true,
            description = "Regular expression with one capture group per column")
    private String regex;

    @Option(names = {"--columns", "-c"}, required = true, split = ",",
            description = "Comma-separated column names, one per capture group")
    private List<String> columns;

    @Option(names = "--on-error", description = "raise, skip (alias ignore) or include")
    private String onError;

    @Option(names = "--backend", description = "Execution backend (see 'logtable backends')")
    private String backend;

    @Option(names = "--allow-empty", description = "Return an empty table when no file matches")
    private Boolean allowEmpty;

    @Option(names = "--unordered", description = "Append rows as workers finish instead of in file/line order")
    private boolean unordered;

    @Option(names = "--parallelism", description = "Worker threads (0 = one per processor)")
    private Integer parallelism;

    @Option(names = "--batch-size", description = "Lines per worker batch")
    private Integer batchSize;

    @Option(names = "--charset", description = "Charset of the input files")
    private String charset;

    @Option(names = "--diagnostic-column", description = "Name of the failure column under --on-error include")
    private String diagnosticColumn;

    @Option(names = {"--format", "-f"}, defaultValue = "TABLE",
            description = "Output format: ${COMPLETION-CANDIDATES}")
    private TableFormat format;

    @Option(names = {"--output", "-o"}, description = "Write the table to this file instead of stdout")
    private Path output;

    @Option(names = "--limit", description = "Print at most this many rows")
    private Integer limit;

    @Option(names = "--summary", description = "Print run statistics to stderr")
    private boolean summary;

    private final LogParser parser;
    private final LogtableProperties properties;
    private final TableWriter tableWriter = new TableWriter();

    public ParseCommand(LogParser parser, LogtableProperties properties) {
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        TabularResult table;
        try {
            var builder = properties.newRequest()
                    .paths(paths)
                    .regex(regex)
                    .columns(columns);
            if (onError != null) builder.onError(ErrorPolicy.fromName(onError));
            if (backend != null) builder.backend(backend);
            if (allowEmpty != null) builder.allowEmpty(allowEmpty);
            if (unordered) builder.ordering(OrderingMode.UNORDERED);
            if (parallelism != null) builder.parallelism(parallelism);
            if (batchSize != null) builder.batchSize(batchSize);
            if (charset != null) builder.charset(toCharset(charset));
            if (diagnosticColumn != null) builder.diagnosticColumn(diagnosticColumn);
            table = parser.parse(builder.build());
        } catch (ConfigurationException e) {
            ConsoleOutput.error("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (LogtableException e) {
            ConsoleOutput.error("Parse failed: " + e.getMessage());
            return EXIT_FAILED;
        }

        TabularResult shown = limit != null ? table.head(limit) : table;
        try {
            if (output != null) {
                try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                    tableWriter.write(shown, format, out);
                }
                ConsoleOutput.success("Wrote " + shown.rowCount() + " row(s) to " + output);
            } else {
                tableWriter.write(shown, format, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write output: " + e.getMessage());
            return EXIT_FAILED;
        }

        if (summary) {
            ConsoleOutput.summary(table.summary());
        } else if (table.summary().skippedLines() > 0) {
            ConsoleOutput.warn(table.summary().skippedLines() + " line(s) skipped");
        }
        return EXIT_OK;
    }

    private static Charset toCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigurationException("Unsupported charset: " + name, e);
        }
    }
}
