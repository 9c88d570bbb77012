package org.kioskfleet.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a device log entry.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used for device-reported entries: an unknown or blank level
     * yields empty instead of failing the whole heartbeat.
     */
    public static Optional<LogLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
