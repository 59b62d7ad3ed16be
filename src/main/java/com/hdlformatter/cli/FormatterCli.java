package com.hdlformatter.cli;

import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;
import com.hdlformatter.config.ConfigurationLoader;
import com.hdlformatter.config.FormatterConfig;
import com.hdlformatter.core.SourceFormatter;
import com.hdlformatter.plugins.FileType;
import com.hdlformatter.plugins.verilog.VerilogFormatter;
import com.hdlformatter.util.ErrorFormatter;
import com.hdlformatter.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command line interface: {@code format}, {@code check} and {@code init}.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int status;
        try {
            status = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(status);
    }

    /**
     * Runs one command and returns the process exit status.
     */
    static int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color") && !_hasOption(args, "--ci"));
        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        LoggerUtil.setConsoleLevel(verbose ? Level.FINE : Level.INFO);

        try {
            return switch (args[0]) {
                case "format" -> _formatFiles(args, true);
                case "check" -> _formatFiles(args, false);
                case "init" -> _initializeConfig(args);
                case "--version", "-v" -> {
                    System.out.println("hdl-formatter version " + VERSION);
                    yield EXIT_OK;
                }
                case "--help", "-h" -> {
                    _printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    _printError("Unknown command: " + args[0]);
                    _printUsage();
                    yield EXIT_FAILURE;
                }
            };
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!verbose) {
                _printInfo("Use --verbose for details");
            }
            return EXIT_FAILURE;
        }
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "hdl-formatter v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  hdlformatter format <path>        - Format Verilog/SystemVerilog files in place");
        System.out.println("  hdlformatter check <path>         - Report files that would change (exit 1 if any)");
        System.out.println("  hdlformatter init [--force]       - Write " + ConfigurationLoader.PROJECT_CONFIG_FILE);
        System.out.println("  hdlformatter --help|-h            - Show this help");
        System.out.println("  hdlformatter --version|-v         - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: "
                + ConfigurationLoader.PROJECT_CONFIG_FILE + ")");
        System.out.println("  --include=<glob>                  - Only include files whose name matches the glob");
        System.out.println("  --range=<first>:<last>            - Only format these lines (1-based, single file)");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (no colors, no summary)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --force                           - Overwrite an existing config file (init)");
    }

    /**
     * {@code format} when {@code write} is set, {@code check} otherwise.
     */
    private static int _formatFiles(String[] args, boolean write) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }
        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + path);
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        String range = _getOptionValue(args, "--range");
        if (range != null) {
            return _formatRange(path, range, config, write);
        }

        try (SourceFormatter formatter = _createFormatter(config)) {
            List<Path> files = _findFiles(formatter, path, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));

            Instant start = Instant.now();
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();
            int changed = 0;
            int failed = 0;

            for (Path file : files) {
                try {
                    String source = Files.readString(file, StandardCharsets.UTF_8);
                    FormatterResult result = formatter.formatFile(file, source);

                    if (!result.getErrors().isEmpty()) {
                        errorsByFile.put(file, result.getErrors());
                        result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(file, e)));
                    }
                    if (!result.isSuccessful()) {
                        failed++;
                        continue;
                    }

                    if (result.isChanged()) {
                        changed++;
                        if (write) {
                            Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                            _printSuccess("Formatted: " + file);
                        } else {
                            _printWarning("Needs formatting: " + file);
                        }
                        if (verbose) {
                            result.getAppliedRefactorings().forEach(r ->
                                    _printInfo("    - " + errorFormatter.formatRefactoring(r)));
                        }
                    } else if (verbose) {
                        _printInfo("Already formatted: " + file);
                    }
                } catch (IOException e) {
                    failed++;
                    _printError("Error processing file: " + file + ": " + e.getMessage());
                    logger.log(Level.WARNING, "Error processing file: " + file, e);
                    errorsByFile.put(file, List.of(new FormatterError(Severity.ERROR, e.getMessage(), 0, 0)));
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            System.out.println();
            System.out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
            System.out.println("  Processed files: " + files.size());
            System.out.println("  " + (write ? "Reformatted: " : "Needing formatting: ") + changed);
            System.out.println("  Files with errors: " + failed);

            if (!errorsByFile.isEmpty() && !ciMode) {
                System.out.println();
                System.out.println(errorFormatter.formatErrorSummary(errorsByFile));
            }
            if (ciMode) {
                System.out.println("RESULT:files=" + files.size() + ";changed=" + changed + ";errors=" + failed);
            }

            boolean dirty = !write && changed > 0;
            return failed > 0 || dirty ? EXIT_FAILURE : EXIT_OK;
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release formatter resources", e);
        }
    }

    /**
     * Formats lines {@code first..last} (1-based, inclusive) of a single file.
     */
    private static int _formatRange(Path file, String range, FormatterConfig config, boolean write) throws IOException {
        if (!Files.isRegularFile(file)) {
            _printError("Error: --range needs a single file, got " + file);
            return EXIT_FAILURE;
        }
        String[] bounds = range.split(":", 2);
        int first;
        int last;
        try {
            first = Integer.parseInt(bounds[0].trim());
            last = bounds.length > 1 ? Integer.parseInt(bounds[1].trim()) : first;
        } catch (NumberFormatException e) {
            _printError("Error: Invalid range '" + range + "', expected <first>:<last>");
            return EXIT_FAILURE;
        }

        String source = Files.readString(file, StandardCharsets.UTF_8);
        VerilogFormatter plugin = new VerilogFormatter();
        plugin.initialize(config);

        String[] replacement;
        try {
            replacement = plugin.formatRange(file, source, first - 1, last - 1);
        } catch (IllegalArgumentException e) {
            _printError("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        String separator = source.contains("\r\n") ? "\r\n" : "\n";
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("\\r?\\n", -1)));
        int end = Math.min(last, lines.size());
        List<String> spliced = new ArrayList<>(lines.subList(0, first - 1));
        spliced.addAll(Arrays.asList(replacement));
        spliced.addAll(lines.subList(end, lines.size()));
        String formatted = String.join(separator, spliced);

        if (formatted.equals(source)) {
            _printInfo("Already formatted: " + file + " lines " + first + "-" + end);
            return EXIT_OK;
        }
        if (!write) {
            _printWarning("Needs formatting: " + file + " lines " + first + "-" + end);
            return EXIT_FAILURE;
        }
        Files.writeString(file, formatted, StandardCharsets.UTF_8);
        _printSuccess("Formatted: " + file + " lines " + first + "-" + end);
        return EXIT_OK;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String target = _getOptionValue(args, "--config");
        Path configPath = Paths.get(target != null ? target : ConfigurationLoader.PROJECT_CONFIG_FILE);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it");
            return EXIT_FAILURE;
        }

        Files.writeString(configPath, ConfigurationLoader.defaultConfigText(), StandardCharsets.UTF_8);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadProjectConfig(Paths.get("").toAbsolutePath());
    }

    private static SourceFormatter _createFormatter(FormatterConfig config) {
        SourceFormatter formatter = new SourceFormatter(config);
        VerilogFormatter plugin = new VerilogFormatter();
        for (FileType type : FileType.values()) {
            if (type.isSupported()) {
                formatter.registerPlugin(type, plugin);
            }
        }
        return formatter;
    }

    private static List<Path> _findFiles(SourceFormatter formatter, Path path, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        List<Path> files = formatter.findFiles(path);
        if (includePattern == null || includePattern.isEmpty()) {
            return files;
        }
        PathMatcher include = FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
        return files.stream()
                .filter(file -> include.matches(file.getFileName()))
                .collect(Collectors.toList());
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
