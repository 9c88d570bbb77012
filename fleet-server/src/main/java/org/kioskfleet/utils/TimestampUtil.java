package org.kioskfleet.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * Parsing of device-supplied timestamps. Devices report ISO-8601 strings
 * (with or without offset) or epoch milliseconds; anything else, including
 * instants outside [1970, 9999], falls back to the server's clock.
 */
public class TimestampUtil {

    static final Instant EARLIEST = Instant.EPOCH;
    static final Instant LATEST = Instant.parse("9999-12-31T23:59:59.999999Z");

    public static Instant parseOrDefault(String raw, Instant fallback) {
        Instant parsed = parse(raw, fallback);
        if (parsed.isBefore(EARLIEST) || parsed.isAfter(LATEST)) {
            return fallback;
        }
        return parsed;
    }

    private static Instant parse(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(value));
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC); // devices without offset report UTC
        } catch (DateTimeException | NumberFormatException e) {
            return fallback;
        }
    }
}
