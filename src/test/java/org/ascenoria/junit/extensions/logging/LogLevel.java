package org.ascenoria.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels the watch annotations can refer to.
 */
public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logback;

    LogLevel(Level logback) {
        this.logback = logback;
    }

    Level toLogback() {
        return logback;
    }
}
