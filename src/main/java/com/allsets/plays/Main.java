package com.allsets.plays;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main entry point for the sets plays aggregator.
 * <p>
 * Modes:
 * <ul>
 *   <li>no arguments - resolve play counts for every set and print the annotated list with totals</li>
 *   <li>{@code sort} - re-order the already annotated list by descending play count</li>
 * </ul>
 * Both modes read the sets document at {@code ../all-sets.md} unless {@code PLAYS_INPUT_FILE} is set.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String SORT_MODE = "sort";
    static final int EXIT_OK = 0;
    static final int EXIT_READ_ERROR = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code = run(args, utf8Stdout(), PlaysConfig.fromEnvironment());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Standard output encoded as UTF-8 whatever the platform charset, so the markers survive a C locale.
     */
    static PrintStream utf8Stdout() {
        return new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
    }

    /**
     * Runs one invocation with the default services.
     * @return Process exit code
     */
    static int run(String[] args, PrintStream out, PlaysConfig config) {
        return run(args, out, config, new SetListParser(), new AggregationService(config), new SortService());
    }

    static int run(String[] args, PrintStream out, PlaysConfig config, SetListParserInterface parser,
                   AggregationServiceInterface aggregationService, SortService sortService) {
        applyLogLevel(config);
        Path input = Paths.get(config.inputFile());
        String mode = (args != null && args.length > 0) ? args[0] : "";

        if (mode.equals(SORT_MODE)) {
            try {
                sortService.printSorted(input, out);
                return EXIT_OK;
            } catch (IOException e) {
                out.println("Error: " + e.getMessage());
                logger.error("Failed to sort {}: {}", input, e.getMessage());
                return EXIT_READ_ERROR;
            }
        }
        if (!mode.isEmpty()) {
            out.println("Usage: all-sets-plays [sort]");
            return EXIT_USAGE;
        }

        logger.debug("Starting plays aggregation for {}", input);
        List<SetEntry> entries;
        try {
            entries = parser.parse(input);
        } catch (IOException e) {
            out.println("Error reading " + input.getFileName() + ": " + e.getMessage());
            logger.error("Failed to read sets file {}: {}", input, e.getMessage());
            return EXIT_READ_ERROR;
        }
        aggregationService.aggregate(entries, out);
        return EXIT_OK;
    }

    // PLAYS_DEBUG=true lowers the package logger to DEBUG.
    private static void applyLogLevel(PlaysConfig config) {
        Logger packageLogger = LoggerFactory.getLogger("com.allsets.plays");
        if (packageLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) packageLogger).setLevel(config.debug() ? Level.DEBUG : Level.INFO);
        }
    }
}
