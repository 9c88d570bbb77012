package org.kioskfleet.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampUtilTest {

    private static final Instant FALLBACK = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void parsesIsoWithOffset() {
        assertThat(TimestampUtil.parseOrDefault("2024-05-01T12:30:00+02:00", FALLBACK))
                .isEqualTo(Instant.parse("2024-05-01T10:30:00Z"));
        assertThat(TimestampUtil.parseOrDefault("2024-05-01T09:15:00.123Z", FALLBACK))
                .isEqualTo(Instant.parse("2024-05-01T09:15:00.123Z"));
    }

    @Test
    void localTimestampIsTakenAsUtc() {
        assertThat(TimestampUtil.parseOrDefault("2024-05-01T09:15:00", FALLBACK))
                .isEqualTo(Instant.parse("2024-05-01T09:15:00Z"));
    }

    @Test
    void parsesEpochMillis() {
        assertThat(TimestampUtil.parseOrDefault("1714557600000", FALLBACK))
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void unusableValuesFallBack() {
        assertThat(TimestampUtil.parseOrDefault(null, FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("  ", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("yesterday", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("99999999999999999999999", FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void instantsOutsideStorableRangeFallBack() {
        assertThat(TimestampUtil.parseOrDefault("9000000000000000000", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("+999999999-12-31T00:00Z", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("1969-12-31T23:59:59Z", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TimestampUtil.parseOrDefault("9999-12-31T00:00:00Z", FALLBACK))
                .isEqualTo(Instant.parse("9999-12-31T00:00:00Z"));
    }
}
