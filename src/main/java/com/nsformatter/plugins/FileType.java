package com.nsformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.nsformatter.util.LoggerUtil;

/**
 * Clojure dialects the formatter recognises, detected by extension first and by content
 * as a fallback.
 */
public enum FileType {
    CLOJURE("clj"),
    CLOJURESCRIPT("cljs"),
    CLOJURE_COMMON("cljc"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int SNIFF_BYTES = 4096;

    private static final Pattern NS_FORM_PATTERN = Pattern.compile("^\\s*\\(ns\\s", Pattern.MULTILINE);
    private static final Pattern SHEBANG_PATTERN = Pattern.compile("^#!.*\\b(bb|clojure|clj)\\b");

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the dialect of a file. Results are cached per path.
     *
     * @param filePath The path to the file
     * @return The detected FileType
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detected = detectByExtension(filePath);
        if (detected == UNKNOWN) {
            detected = detectByContent(filePath);
        }
        typeCache.put(filePath, detected);
        return detected;
    }

    static FileType detectByExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase();
        if (!name.contains(".")) {
            return UNKNOWN;
        }

        String extension = name.substring(name.lastIndexOf('.') + 1);
        return switch (extension) {
            case "clj", "bb" -> CLOJURE;
            case "cljs" -> CLOJURESCRIPT;
            case "cljc" -> CLOJURE_COMMON;
            default -> UNKNOWN;
        };
    }

    /**
     * Extensionless scripts are treated as Clojure when they start with a babashka or
     * clojure shebang, or declare a namespace near the top.
     */
    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            String head = readHead(filePath);
            if (SHEBANG_PATTERN.matcher(head).find() || NS_FORM_PATTERN.matcher(head).find()) {
                return CLOJURE;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    private static String readHead(Path filePath) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] bytes = in.readNBytes(SNIFF_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case CLOJURE -> "Clojure source file";
            case CLOJURESCRIPT -> "ClojureScript source file";
            case CLOJURE_COMMON -> "Clojure common (reader conditional) source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
