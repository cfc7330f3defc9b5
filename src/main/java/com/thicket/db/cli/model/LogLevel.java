package com.thicket.db.cli.model;

import ch.qos.logback.classic.Level;

/**
 * Values accepted by {@code -l}.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARNING(Level.WARN),
    ERROR(Level.ERROR),
    CRITICAL(Level.ERROR);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public Level getLogbackLevel() {
        return logbackLevel;
    }
}
