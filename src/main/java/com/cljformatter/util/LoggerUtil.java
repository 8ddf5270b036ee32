package com.cljformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * java.util.logging setup for clj-sculptor.
 * <p>
 * Console output is configured from {@code /logging.properties} when it is on the classpath, and
 * with an equivalent console handler otherwise. A log file is only written when one is requested
 * with {@link #logToFile(Path)}.
 */
public class LoggerUtil {
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static final String BASE_LOGGER = "com.cljformatter";
    private static final String LINE_FORMAT = "[%4$s] %3$s: %5$s%6$s%n";

    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger baseLogger = Logger.getLogger(BASE_LOGGER);
    private static boolean initialized = false;
    private static FileHandler fileHandler;

    private LoggerUtil() {
    }

    private static synchronized void _ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;
        try (InputStream in = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
                return;
            }
        } catch (IOException e) {
            System.err.println("Failed to read " + LOG_CONFIG_RESOURCE + ": " + e.getMessage());
        }
        _installConsoleHandler();
    }

    private static void _installConsoleHandler() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.INFO);
        console.setFormatter(_lineFormatter());
        rootLogger.addHandler(console);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * Single-line records in the same layout as {@code logging.properties}.
     */
    private static Formatter _lineFormatter() {
        return new Formatter() {
            @Override
            public String format(LogRecord record) {
                String message = formatMessage(record);
                String thrown = record.getThrown() == null ? "" : " " + record.getThrown();
                return String.format(LINE_FORMAT, null, record.getSourceClassName(), record.getLoggerName(),
                        record.getLevel().getLocalizedName(), message, thrown);
            }
        };
    }

    /**
     * Sets the level of console output and of the formatter's own loggers. {@code FINE} shows
     * what the engine does with each form.
     */
    public static synchronized void setConsoleLevel(Level level) {
        _ensureInitialized();
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        baseLogger.setLevel(level);
    }

    /**
     * Additionally writes every record of the formatter's loggers to {@code path}, replacing a
     * log file set earlier.
     */
    public static synchronized void logToFile(Path path) throws IOException {
        _ensureInitialized();
        FileHandler handler = new FileHandler(path.toString(), true);
        handler.setLevel(Level.ALL);
        handler.setFormatter(_lineFormatter());
        if (fileHandler != null) {
            baseLogger.removeHandler(fileHandler);
            fileHandler.close();
        }
        fileHandler = handler;
        baseLogger.addHandler(handler);
        if (baseLogger.getLevel() == null || baseLogger.getLevel().intValue() > Level.FINE.intValue()) {
            baseLogger.setLevel(Level.FINE);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        _ensureInitialized();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes all handlers. Called once before the process exits.
     */
    public static synchronized void shutdown() {
        if (fileHandler != null) {
            baseLogger.removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
        }
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
        }
    }
}
