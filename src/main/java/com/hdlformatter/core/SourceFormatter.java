package com.hdlformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.hdlformatter.api.CodeFormatter;
import com.hdlformatter.api.FormatterPlugin;
import com.hdlformatter.api.FormatterResult;
import com.hdlformatter.api.error.FormatterError;
import com.hdlformatter.api.error.Severity;
import com.hdlformatter.config.FormatterConfig;
import com.hdlformatter.plugins.FileType;
import com.hdlformatter.util.LoggerUtil;

/**
 * Dispatches source files to the plugin registered for their {@link FileType}.
 * Thread-safe: directories are formatted on a fixed thread pool.
 */
public class SourceFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SourceFormatter.class);

    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger changedCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public SourceFormatter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Registers {@code plugin} for {@code fileType} and initializes it with this formatter's configuration.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for " + fileType.getDescription());
    }

    /**
     * Formats one file. Never throws: a missing plugin gives an ERROR result, an unexpected
     * exception a FATAL one, and both carry the original source.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin registered for " + fileType + ": " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No formatter for file type " + fileType.getDescription(),
                            0, 0,
                            "Supported extensions are .v, .vh, .sv and .svh"))
                    .build();
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);
            if (result.isChanged()) {
                changedCount.incrementAndGet();
            }
            if (!result.getErrors().isEmpty()) {
                logger.fine(() -> filePath + ": " + result.getErrors().stream()
                        .map(FormatterError::toString)
                        .collect(Collectors.joining("; ")));
            }
            logger.fine(() -> (result.isChanged() ? "Formatted " : "Unchanged ") + filePath);
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting " + filePath, e);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            0, 0,
                            "The file was left unchanged; see the log for the stack trace"))
                    .build();
        }
    }

    /**
     * Formats every supported file under {@code directory} with the configured thread count.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        int threads = config.getGeneralConfig("threads", Runtime.getRuntime().availableProcessors());
        return formatDirectory(directory, threads);
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to format in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> results.put(file, _formatPath(file)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Directory formatting interrupted", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Supported files under {@code directory} that have a plugin and are not matched by the
     * {@code ignoreFiles} globs (relative to {@code directory}), sorted by path.
     */
    public List<Path> findFiles(Path directory) throws IOException {
        List<PathMatcher> ignored = new ArrayList<>();
        for (String glob : config.getGeneralConfig("ignoreFiles", new ArrayList<String>())) {
            ignored.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }

        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detectByExtension(path)))
                    .filter(path -> {
                        Path relative = directory.relativize(path);
                        return ignored.stream().noneMatch(matcher -> matcher.matches(relative));
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private FormatterResult _formatPath(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read " + file, e);
            return FormatterResult.builder()
                    .successful(false)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "Failed to read file: " + e.getMessage(),
                            0, 0))
                    .build();
        }
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getChangedCount() {
        return changedCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes every plugin that holds resources. All plugins are closed even if one fails;
     * the first failure is rethrown.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get()
                + ", changed=" + changedCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
