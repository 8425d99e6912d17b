package com.streamwarden.common.logging;

import java.util.Map;

/**
 * Log levels accepted in the {@code logging.level} config key.
 */
public enum LogLevel {
    OFF,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("off", OFF),
            Map.entry("silent", OFF),
            Map.entry("none", OFF),
            Map.entry("fatal", ERROR),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE),
            Map.entry("verbose", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Lower is more severe; OFF sorts after everything.
     */
    public int priority() {
        return this == OFF ? Integer.MAX_VALUE : ordinal();
    }

    /**
     * A message at this level is emitted when the configured minimum is at
     * least as verbose.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (this == OFF || minLevel == OFF) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
