package org.kvplane.util;

import lombok.Getter;
import lombok.Setter;
import org.kvplane.enums.LogLevel;
import org.slf4j.LoggerFactory;

/**
 * Logging utility for the routing hot path. Debug and trace output is emitted only when the
 * global level is switched on through the {@code LOG_LEVEL} environment variable or at runtime.
 *
 * <p>The {@code info} {@code warn} and {@code error} level is enabled by default.</p>
 *
 * @see LogLevel
 */
public class Logger {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger("routingLogger");

    @Getter
    @Setter
    private static LogLevel globalLogLevel;

    static {
        String logLevelStr = System.getenv("LOG_LEVEL");
        if (logLevelStr != null) {
            try {
                globalLogLevel = LogLevel.valueOf(logLevelStr.toUpperCase().trim());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid LOG_LEVEL value: '{}'. Valid values are: TRACE, DEBUG, INFO, WARN, ERROR.", logLevelStr);
            }
        }
    }

    public static void trace(String format, Object... args) {
        log(LogLevel.TRACE, () -> log.trace(format, args));
    }

    public static void debug(String format, Object... args) {
        log(LogLevel.DEBUG, () -> log.debug(format, args));
    }

    public static void info(String format, Object... args) {
        log(LogLevel.INFO, () -> log.info(format, args), false);
    }

    public static void warn(String format, Object... args) {
        log(LogLevel.WARN, () -> log.warn(format, args), false);
    }

    public static void error(String format, Object... args) {
        log(LogLevel.ERROR, () -> log.error(format, args), false);
    }

    private static void log(LogLevel targetLevel, Runnable logAction) {
        log(targetLevel, logAction, true);
    }

    private static void log(LogLevel targetLevel, Runnable logAction, boolean checkGlobalLevel) {
        if (shouldLog(targetLevel, checkGlobalLevel)) {
            logAction.run();
        }
    }

    static boolean shouldLog(LogLevel targetLevel, boolean checkGlobalLevel) {
        if (checkGlobalLevel) {
            return globalLogLevel != null && globalLogLevel.compareTo(targetLevel) <= 0;
        }
        // info, warn and error stay on until a stricter global level is set
        return globalLogLevel == null || globalLogLevel.compareTo(targetLevel) <= 0;
    }
}
