package com.nsformatter.cli;

import com.nsformatter.api.FormatterResult;
import com.nsformatter.api.error.FormatterError;
import com.nsformatter.config.ConfigurationLoader;
import com.nsformatter.config.FormatterConfig;
import com.nsformatter.core.NamespaceFormatter;
import com.nsformatter.plugins.FileType;
import com.nsformatter.plugins.clojure.ClojureFormatter;
import com.nsformatter.util.ErrorFormatter;
import com.nsformatter.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface for the Clojure ns formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".nsformatter.yml";
    private static ErrorFormatter errorFormatter = new ErrorFormatter(true);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args) {
        try {
            errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
            if (args.length < 1) {
                _printUsage();
                return 1;
            }

            LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);
            String logFile = _getOptionValue(args, "--log-file");
            if (logFile != null) {
                LoggerUtil.setLogFilePath(Paths.get(logFile));
            }

            String command = args[0];
            switch (command) {
                case "format":
                    return _processFiles(args, true);
                case "check":
                    return _processFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    System.out.println("Clojure ns formatter version " + VERSION);
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details");
            }
            return 1;
        } finally {
            LoggerUtil.shutdown();
        }
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "Clojure ns formatter CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  nsformatter init [--force]        - Write a default " + CONFIG_FILE_NAME);
        System.out.println("  nsformatter format <path>         - Rewrite ns forms of files in path");
        System.out.println("  nsformatter check <path>          - Report files whose ns forms would change");
        System.out.println("  nsformatter --help|-h             - Show this help");
        System.out.println("  nsformatter --version|-v          - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (simplified)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --log-file=<file>                 - Also write the full log to a file");
    }

    /**
     * Shared body of {@code format} and {@code check}. In format mode changed files are
     * written back; in check mode a changed file makes the run fail.
     */
    private static int _processFiles(String[] args, boolean write) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String configFile = _getOptionValue(args, "--config");
        String includePattern = _getOptionValue(args, "--include");

        FormatterConfig config = ConfigurationLoader.loadConfig(
                Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME));

        try (NamespaceFormatter formatter = _createFormatter(config)) {
            List<Path> files = formatter.findFiles(path, includePattern);
            if (!ciMode) {
                _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));
            }

            Instant start = Instant.now();
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int changed = 0;
            int failed = 0;

            for (Path file : files) {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                FormatterResult result = formatter.formatFile(file, source);

                if (!result.getErrors().isEmpty()) {
                    errorsByFile.put(file, result.getErrors());
                }
                if (!result.isSuccessful()) {
                    failed++;
                    _printError("Failed to format: " + file);
                    result.getErrors().stream()
                            .filter(e -> e.getSeverity().isBlocking())
                            .forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                }

                boolean differs = result.getFormattedCode() != null && !source.equals(result.getFormattedCode());
                if (differs) {
                    changed++;
                    if (write) {
                        Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                        _printSuccess("Formatted: " + file);
                    } else {
                        _printWarning("File needs formatting: " + file);
                    }
                    if (verbose) {
                        result.getAppliedRefactorings().forEach(r -> _printInfo("    - " + r));
                    }
                } else if (verbose) {
                    _printInfo("  Already formatted: " + file);
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            if (ciMode) {
                System.out.println("RESULT:files=" + files.size() + ";changed=" + changed + ";errors=" + failed);
            } else {
                System.out.println();
                System.out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
                System.out.println("  Processed files: " + files.size());
                System.out.println("  " + (write ? "Files rewritten: " : "Files needing formatting: ") + changed);
                System.out.println("  Files with errors: " + failed);
                if (!errorsByFile.isEmpty()) {
                    System.out.println();
                    System.out.println(errorFormatter.formatErrorSummary(errorsByFile));
                }
            }

            if (failed > 0) {
                return 1;
            }
            return !write && changed > 0 ? 1 : 0;
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return 1;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    static NamespaceFormatter _createFormatter(FormatterConfig config) {
        NamespaceFormatter formatter = new NamespaceFormatter(config);
        formatter.registerPlugin(FileType.CLOJURE, new ClojureFormatter());
        formatter.registerPlugin(FileType.CLOJURESCRIPT, new ClojureFormatter());
        formatter.registerPlugin(FileType.CLOJURE_COMMON, new ClojureFormatter());
        return formatter;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
