package com.williamcallahan.series_sync_engine.util;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Warning and error logging with an optional cause attached as the throwable,
 * so job failures keep their stack traces without callers juggling argument arrays.
 */
public final class LoggingUtils {

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable cause, String message, Object... args) {
        log(logger, Level.ERROR, cause, message, args);
    }

    public static void warn(Logger logger, Throwable cause, String message, Object... args) {
        log(logger, Level.WARN, cause, message, args);
    }

    private static void log(Logger logger, Level level, Throwable cause, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        LoggingEventBuilder event = logger.atLevel(level);
        if (cause != null) {
            event = event.setCause(cause);
        }
        if (args == null || args.length == 0) {
            event.log(message);
        } else {
            event.log(message, args);
        }
    }
}
