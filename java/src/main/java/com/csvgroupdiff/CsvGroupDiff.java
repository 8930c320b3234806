package com.csvgroupdiff;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

import lombok.extern.java.Log;

/**
 * Compares the history rows of two CSV extracts grouped by dataset_id, then by
 * tactic_id and recency_flag, down to individual cells.
 */
@Log
public class CsvGroupDiff {

    static {
        // Load logging configuration from classpath but don't log yet
        try (InputStream loggingConfig = CsvGroupDiff.class.getResourceAsStream("/logging.properties")) {
            if (loggingConfig != null) {
                LogManager.getLogManager().readConfiguration(loggingConfig);
            } else {
                System.err.println("Warning: logging.properties not found, using default configuration");
            }
        } catch (IOException e) {
            System.err.println("Warning: Failed to load logging.properties: " + e.getMessage());
        }
    }

    private static void configureLogging(boolean debug) {
        Logger rootLogger = Logger.getLogger("");

        if (!debug) {
            // Logs only go to the file outside debug mode
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    rootLogger.removeHandler(handler);
                }
            }
        } else {
            Logger.getLogger("com.csvgroupdiff").setLevel(Level.FINE);
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }

        log.info("Logging configuration loaded - debug mode: " + debug);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    static int run(String[] args, PrintStream console) {
        boolean debug = false;
        boolean timing = false;
        String timingJson = null;
        String profileFile = null;
        String profileName = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--debug".equals(arg)) {
                debug = true;
                continue;
            }
            if ("--timing".equals(arg)) {
                timing = true;
                continue;
            }
            if (arg.startsWith("--timing-json")) {
                timingJson = optionValue(arg, args, i);
                if (!arg.contains("=")) {
                    i++;
                }
                continue;
            }
            if (arg.startsWith("--profile-file")) {
                profileFile = optionValue(arg, args, i);
                if (!arg.contains("=")) {
                    i++;
                }
                continue;
            }
            if (arg.startsWith("--profile")) {
                profileName = optionValue(arg, args, i);
                if (!arg.contains("=")) {
                    i++;
                }
                continue;
            }
            positional.add(arg);
        }

        configureLogging(debug);

        if (positional.size() < 2) {
            printUsage(console);
            return 1;
        }

        Path fileA = Path.of(positional.get(0));
        Path fileB = Path.of(positional.get(1));
        Path outputDir = positional.size() > 2 ? Path.of(positional.get(2)) : null;

        try {
            Instant start = Instant.now();
            log.info("Starting CSV group comparison");
            log.log(Level.INFO, "File A: {0}", fileA);
            log.log(Level.INFO, "File B: {0}", fileB);
            if (outputDir != null) {
                log.log(Level.INFO, "Output directory: {0}", outputDir);
            }

            DiffProfile profile = DiffProfileLoader.resolve(profileFile != null ? Path.of(profileFile) : null,
                    profileName);
            ComparisonRunner runner = new ComparisonRunner(profile, debug, timing,
                    timingJson != null ? Path.of(timingJson) : null, console);
            runner.run(fileA, fileB, outputDir);

            Duration duration = Duration.between(start, Instant.now());
            console.printf("%nCompleted in %d.%03ds%n", duration.toSeconds(), duration.toMillisPart());

            for (Handler handler : Logger.getLogger("").getHandlers()) {
                handler.flush();
            }
            if (!debug) {
                printLogFile(console);
            }

            log.log(Level.INFO, "Comparison completed successfully in {0}ms", duration.toMillis());
            return 0;
        } catch (IOException | MissingColumnsException e) {
            log.log(Level.SEVERE, "Comparison failed", e);
            console.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Unexpected failure during comparison", e);
            console.println("Error: unexpected failure: " + e);
            console.println("Please make sure both files are valid CSV files with the required columns.");
            return 1;
        }
    }

    private static String optionValue(String arg, String[] args, int i) {
        if (arg.contains("=")) {
            return arg.substring(arg.indexOf('=') + 1);
        }
        return i + 1 < args.length ? args[i + 1] : null;
    }

    private static void printUsage(PrintStream console) {
        console.println("Usage: csvgroupdiff [--debug] [--timing] [--timing-json <file>] "
                + "[--profile-file <yaml>] [--profile <name>] <file_a.csv> <file_b.csv> [output_dir]");
        console.println();
        console.println("Options:");
        console.println("  --debug         Enable detailed console logging and disable progress bars");
        console.println("  --timing        Print read/compare/write timings even without --debug");
        console.println("  --timing-json   Write timing report JSON to the given file");
        console.println("  --profile-file  YAML file with comparison profiles (default: bundled profiles)");
        console.println("  --profile       Profile to use from the profile file (default: default)");
        console.println();
        console.println("Notes:");
        console.println("  Only rows with recency_flag = history are compared; the description column is ignored.");
        console.println("  If output_dir is given, CSV and JSON reports are written there.");
    }

    private static void printLogFile(PrintStream console) {
        try (Stream<Path> paths = Files.list(Paths.get(System.getProperty("java.io.tmpdir")))) {
            paths.filter(p -> p.getFileName().toString().startsWith("csvgroupdiff")
                            && p.getFileName().toString().endsWith(".log"))
                    .max((a, b) -> Long.compare(a.toFile().lastModified(), b.toFile().lastModified()))
                    .ifPresent(logFile -> console.println("Log file: " + logFile));
        } catch (IOException e) {
            log.log(Level.FINE, "Could not locate log file", e);
        }
    }
}
