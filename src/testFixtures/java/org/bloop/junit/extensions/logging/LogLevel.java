package org.bloop.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels the watch extension reasons about.
 */
public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    Level toLogback() {
        return logbackLevel;
    }
}
