package com.hdlformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter and hands out loggers.
 * The classpath resource {@code /logging.properties} wins; without it a console handler and a
 * {@code hdlformatter.log} file handler are installed.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger projectLogger = Logger.getLogger("com.hdlformatter");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static Path logFilePath = Paths.get("hdlformatter.log");

    /**
     * Initializes the logging system with default configuration.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            // Keep running on the JDK defaults
            initialized = true;
        }
    }

    /**
     * Sets up basic logging with console and file handlers.
     */
    private static void configureBasicLogging() throws IOException {
        // Drop the JDK default handlers
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        // Console handler
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);

        // File handler, appending across runs
        FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(fileHandler);

        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level. Lowering it below INFO also opens the formatter's own loggers.
     */
    public static synchronized void setConsoleLevel(Level level) {
        if (!initialized) {
            initialize();
        }
        consoleLevel = level;
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        // Open the project loggers too, or FINE records never reach the handler
        Level current = projectLogger.getLevel();
        if (current == null || level.intValue() < current.intValue()) {
            projectLogger.setLevel(level);
        }
    }

    /**
     * Sets the log file path and adds a file handler writing to it.
     */
    public static synchronized void setLogFilePath(Path path) {
        logFilePath = path;
        if (!initialized) {
            initialize();
        }
        try {
            // Remove existing file handlers
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof FileHandler) {
                    rootLogger.removeHandler(handler);
                    handler.close();
                }
            }

            // Add new file handler
            FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to update log file path", e);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
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
     * Closes every installed handler.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
