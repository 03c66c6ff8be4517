package com.nsformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
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

import com.nsformatter.api.CodeFormatter;
import com.nsformatter.api.FormatterPlugin;
import com.nsformatter.api.FormatterResult;
import com.nsformatter.api.error.FormatterError;
import com.nsformatter.api.error.Severity;
import com.nsformatter.config.FormatterConfig;
import com.nsformatter.plugins.FileType;
import com.nsformatter.util.LoggerUtil;

/**
 * Thread-safe entry point for formatting Clojure sources. Dispatches each file to the
 * plugin registered for its {@link FileType}; files are independent, so a directory is
 * processed on a fixed thread pool.
 */
public class NamespaceFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(NamespaceFormatter.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public NamespaceFormatter(FormatterConfig config) {
        this.config = config;
        logger.fine("Namespace formatter initialized with configuration");
    }

    /**
     * Registers and initializes a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.ERROR,
                    "No plugin registered for file type: " + fileType,
                    1, 1));
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .filter(e -> e.getSeverity().isBlocking())
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.FATAL,
                    "Unexpected error: " + e.getMessage(),
                    1, 1));
        }
    }

    /**
     * Formats every supported file under {@code directory}. Nothing is written back; the
     * caller decides what to do with the results.
     */
    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory, null);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> results.put(file, readAndFormat(file)));
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private FormatterResult readAndFormat(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return FormatterResult.failure(null, new FormatterError(
                    Severity.FATAL,
                    "Failed to read file: " + e.getMessage(),
                    1, 1));
        }
    }

    /**
     * Lists the files under {@code root} that have a registered plugin, skipping paths that
     * match {@code general.ignoreFiles} and, when given, keeping only names matching
     * {@code includePattern}. A regular file is returned as is.
     */
    public List<Path> findFiles(Path root, String includePattern) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }

        List<String> ignorePatterns = config.getGeneralConfig("ignoreFiles", new ArrayList<String>());
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(p, root, ignorePatterns))
                    .filter(p -> matchesIncludePattern(p, includePattern))
                    .filter(p -> hasPluginFor(FileType.detect(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static boolean matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();
        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            return fileName.matches(globToRegex(includePattern));
        }
        return fileName.contains(includePattern);
    }

    static boolean isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");
        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                if (relativePath.endsWith(pattern.substring(3))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 2))) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private static String globToRegex(String glob) {
        return glob
                .replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
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

    public int getPluginCount() {
        return plugins.size();
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
