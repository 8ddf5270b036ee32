package com.cljformatter.cli;

import com.cljformatter.api.FormatterResult;
import com.cljformatter.api.error.FormatterError;
import com.cljformatter.api.error.SyntaxError;
import com.cljformatter.config.ConfigurationLoader;
import com.cljformatter.config.FormatterConfig;
import com.cljformatter.core.DefaultCodeFormatter;
import com.cljformatter.plugins.clojure.ClojureFormatter;
import com.cljformatter.plugins.clojure.ClojureSourceFormatter;
import com.cljformatter.util.ErrorFormatter;
import com.cljformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
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
 * Command line interface of clj-sculptor.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new FormatterCli(System.out, System.err).run(args);
        LoggerUtil.shutdown();
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        boolean verbose = _hasOption(args, "--verbose");
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        LoggerUtil.setConsoleLevel(verbose ? Level.FINE : Level.INFO);
        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            try {
                LoggerUtil.logToFile(Paths.get(logFile));
            } catch (IOException e) {
                _printError("Error: Cannot open log file " + logFile + ": " + e.getMessage());
                return EXIT_USAGE;
            }
        }

        if (args.length < 1) {
            _printUsage();
            return EXIT_USAGE;
        }

        try {
            if (_hasOption(args, "-i") || _hasOption(args, "--input")) {
                return _formatSingleFile(args);
            }

            String command = args[0];
            switch (command) {
                case "format":
                    return _formatFiles(args, true);
                case "check":
                    return _formatFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("clj-sculptor version " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "I/O failure", e);
            if (!verbose) {
                _printInfo("Use --verbose for details");
            }
            return EXIT_FAILURE;
        }
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "clj-sculptor v" + VERSION));
        out.println("Usage:");
        out.println("  clj-sculptor -i <file> [-o <file>]   - Format one file to stdout or to the output file");
        out.println("  clj-sculptor format <path>           - Format files in path");
        out.println("  clj-sculptor check <path>            - Report files that are not formatted");
        out.println("  clj-sculptor init [--force]          - Write the default configuration file");
        out.println("  clj-sculptor --help|-h               - Show this help");
        out.println("  clj-sculptor --version|-v            - Show version information");
        out.println();
        out.println("Options:");
        out.println("  -i, --input <file>                   - Input file");
        out.println("  -o, --output <file>                  - Output file (default: stdout)");
        out.println("  --config=<file>                      - Use specific config file (default: "
                + ConfigurationLoader.DEFAULT_CONFIG_FILE + ")");
        out.println("  --threads=<num>                      - Number of threads to use (1-" + ConfigurationLoader.MAX_THREADS + ")");
        out.println("  --verbose                            - Show detailed output");
        out.println("  --log-file=<file>                    - Also write detailed logs to a file");
        out.println("  --no-color                           - Disable colored output");
        out.println("  --force                              - Force overwrite (with init command)");
    }

    /**
     * {@code -i in [-o out]}: the formatted text followed by a newline.
     */
    private int _formatSingleFile(String[] args) throws IOException {
        String input = _getArgument(args, "-i", "--input");
        if (input == null) {
            _printError("Error: Missing input file");
            return EXIT_USAGE;
        }
        Path inputPath = Paths.get(input);
        if (!Files.isRegularFile(inputPath)) {
            _printError("Error: Input file does not exist: " + input);
            return EXIT_USAGE;
        }
        boolean hasOutput = _hasOption(args, "-o") || _hasOption(args, "--output");
        String output = _getArgument(args, "-o", "--output");
        if (hasOutput && output == null) {
            _printError("Error: Missing output file");
            return EXIT_USAGE;
        }

        String formatted;
        try {
            formatted = ClojureSourceFormatter.formatSource(Files.readString(inputPath, StandardCharsets.UTF_8));
        } catch (SyntaxError e) {
            _printError(input + ": " + errorFormatter.formatError(e.toFormatterError()));
            return EXIT_FAILURE;
        }

        if (output == null) {
            out.print(formatted + "\n");
            out.flush();
        } else {
            Files.writeString(Paths.get(output), formatted + "\n", StandardCharsets.UTF_8);
            logger.fine("Wrote " + output);
        }
        return EXIT_OK;
    }

    /**
     * {@code format <path>} and {@code check <path>}. Format rewrites changed files; check only
     * reports them and fails when any is not canonical.
     */
    private int _formatFiles(String[] args, boolean write) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_USAGE;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return EXIT_USAGE;
        }

        FormatterConfig config = _loadConfig(args);
        int threads = config.getThreads();
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                int requested = Integer.parseInt(threadsStr);
                if (requested < 1 || requested > ConfigurationLoader.MAX_THREADS) {
                    throw new NumberFormatException(threadsStr);
                }
                threads = requested;
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using " + threads);
            }
        }

        Instant start = Instant.now();
        Map<Path, FormatterResult> results;
        try (DefaultCodeFormatter formatter = new DefaultCodeFormatter(config)) {
            formatter.registerPlugin(new ClojureFormatter());
            if (Files.isRegularFile(path)) {
                results = new TreeMap<>();
                for (Path file : formatter.findFiles(path)) {
                    results.put(file, formatter.formatFile(file, Files.readString(file, StandardCharsets.UTF_8)));
                }
            } else {
                results = new TreeMap<>(formatter.formatDirectory(path, threads));
            }
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to close formatter", e);
        }

        int changedCount = 0;
        int errorCount = 0;
        Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();

        for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
            Path file = entry.getKey();
            FormatterResult result = entry.getValue();

            if (!result.isSuccessful()) {
                errorCount++;
                errorsByFile.put(file, result.getErrors());
                _printError("Failed to format: " + file);
                result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
            } else if (result.isChanged()) {
                changedCount++;
                if (write) {
                    Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                    _printSuccess("Formatted: " + file);
                } else {
                    _printWarning("File needs formatting: " + file);
                }
            } else {
                logger.fine("Already formatted: " + file);
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        out.println();
        out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
        out.println("  Processed files: " + results.size());
        out.println((write ? "  Formatted files: " : "  Files needing formatting: ") + changedCount);
        out.println("  Files with errors: " + errorCount);

        if (!errorsByFile.isEmpty()) {
            out.println();
            out.println(errorFormatter.formatErrorSummary(errorsByFile));
        }

        if (errorCount > 0 || (!write && changedCount > 0)) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : ConfigurationLoader.DEFAULT_CONFIG_FILE);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        Path defaultPath = Paths.get(ConfigurationLoader.DEFAULT_CONFIG_FILE);
        return Files.exists(defaultPath)
                ? ConfigurationLoader.loadConfig(defaultPath)
                : ConfigurationLoader.loadDefaultConfig();
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    /**
     * Value of {@code --option=value}.
     */
    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    /**
     * Argument following {@code -x} or {@code --long}, or {@code null}.
     */
    private static String _getArgument(String[] args, String shortOption, String longOption) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(shortOption) || args[i].equals(longOption)) {
                return args[i + 1].startsWith("-") ? null : args[i + 1];
            }
        }
        return null;
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
