package io.relaypipes.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public static LogLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String value = raw.trim();
        if ("warn".equalsIgnoreCase(value)) {
            return WARNING;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: " + raw);
    }
}
