package com.nsformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the formatter and hands out per-class loggers.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static final Logger baseLogger = Logger.getLogger("com.nsformatter");
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    /**
     * Initializes logging from the bundled {@code logging.properties}, falling back to
     * a console handler when the resource is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureConsoleLogging();
            }
        } catch (IOException e) {
            configureConsoleLogging();
            Logger.getLogger(LoggerUtil.class.getName())
                    .log(Level.WARNING, "Failed to read " + DEFAULT_LOG_CONFIG + ", using console logging", e);
        }
        initialized = true;
    }

    private static void configureConsoleLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        initialize();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        if (rootLogger.getLevel() != null && rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
        if (baseLogger.getLevel() != null && baseLogger.getLevel().intValue() > level.intValue()) {
            baseLogger.setLevel(level);
        }
    }

    /**
     * Adds (or replaces) a file handler writing everything to {@code path}.
     */
    public static synchronized void setLogFilePath(Path path) {
        initialize();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }

        try {
            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file " + path, e);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
