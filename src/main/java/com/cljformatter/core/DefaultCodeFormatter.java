package com.cljformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.cljformatter.api.CodeFormatter;
import com.cljformatter.api.FormatterPlugin;
import com.cljformatter.api.FormatterResult;
import com.cljformatter.api.error.FormatterError;
import com.cljformatter.api.error.Severity;
import com.cljformatter.config.FormatterConfig;
import com.cljformatter.plugins.FileType;
import com.cljformatter.util.LoggerUtil;

/**
 * Thread-safe orchestrator: picks the plugin for each file by its type and formats whole
 * directories on a fixed thread pool. Files never depend on each other.
 */
public class DefaultCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(DefaultCodeFormatter.class);
    private static final long TASK_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public DefaultCodeFormatter(FormatterConfig config) {
        this.config = config;
        logger.fine("Code formatter initialized with configuration");
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Registers a plugin for every file type listed under its {@code extensions} setting.
     */
    public void registerPlugin(FormatterPlugin plugin) {
        for (String extension : config.getPluginExtensions(plugin.getName())) {
            FileType type = FileType.fromExtension(extension);
            if (type == FileType.UNKNOWN) {
                logger.warning("Ignoring unsupported extension '" + extension + "' for plugin " + plugin.getName());
            } else {
                registerPlugin(type, plugin);
            }
        }
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.failed(sourceCode,
                    FormatterError.of(Severity.ERROR, "No plugin registered for file type: " + fileType));
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine((result.isChanged() ? "Formatted: " : "Already canonical: ") + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " + result.getErrors());
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.failed(sourceCode, new FormatterError(
                    Severity.FATAL, "Unexpected error: " + e.getMessage(), 0, 0, "Check the log for details"));
        }
    }

    /**
     * Formats every supported file under the directory with the configured number of threads.
     * Files are not written; callers decide what to do with the results.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, config.getThreads());
    }

    /**
     * Like {@link #formatDirectory(Path)} with an explicit pool size. Results are in file order.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        Map<Path, FormatterResult> results = new LinkedHashMap<>();
        List<Path> files;
        try {
            files = findFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Cannot list files under " + directory, e);
            return results;
        }
        logger.info("Formatting " + files.size() + " files under " + directory + " with " + threadCount + " threads");
        if (files.isEmpty()) {
            return results;
        }

        List<Callable<FormatterResult>> tasks = new ArrayList<>();
        for (Path file : files) {
            tasks.add(() -> _formatPath(file));
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        try {
            List<Future<FormatterResult>> futures = executor.invokeAll(tasks, TASK_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            for (int i = 0; i < files.size(); i++) {
                results.put(files.get(i), _resultOf(files.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Interrupted while formatting " + directory, e);
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private FormatterResult _resultOf(Path file, Future<FormatterResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            errorCount.incrementAndGet();
            logger.warning("Timed out formatting " + file);
            return FormatterResult.failed(null, FormatterError.of(Severity.ERROR,
                    "Timed out after " + TASK_TIMEOUT_MINUTES + " minutes"));
        } catch (ExecutionException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Formatting task failed for " + file, e.getCause());
            return FormatterResult.failed(null, FormatterError.of(Severity.FATAL,
                    "Unexpected error: " + e.getCause()));
        }
    }

    /**
     * Supported, non-ignored files under a path, sorted. A regular file is returned as is when a
     * plugin handles it.
     */
    public List<Path> findFiles(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return supports(path) ? List.of(path) : Collections.emptyList();
        }
        if (!Files.isDirectory(path)) {
            logger.warning("Path does not exist or is not a directory: " + path);
            return Collections.emptyList();
        }

        List<PathMatcher> ignored = new ArrayList<>();
        for (String pattern : config.getIgnoreFiles()) {
            ignored.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(this::supports)
                    .filter(file -> !_isIgnored(path.relativize(file), ignored))
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
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return FormatterResult.failed(null,
                    FormatterError.of(Severity.ERROR, "Failed to read file: " + e.getMessage()));
        }
    }

    @Override
    public boolean supports(Path file) {
        FileType type = FileType.detect(file);
        return type != FileType.UNKNOWN && plugins.containsKey(type);
    }

    private static boolean _isIgnored(Path relativePath, List<PathMatcher> ignored) {
        for (PathMatcher matcher : ignored) {
            if (matcher.matches(relativePath)) {
                return true;
            }
        }
        return false;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins that hold resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
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
