package org.kioskfleet.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceStatusTest {

    @Test
    void parsesWireValuesCaseInsensitively() {
        assertThat(DeviceStatus.fromValue("online")).isEqualTo(DeviceStatus.ONLINE);
        assertThat(DeviceStatus.fromValue(" Maintenance ")).isEqualTo(DeviceStatus.MAINTENANCE);
        assertThat(DeviceStatus.ERROR.wireValue()).isEqualTo("error");
    }

    @Test
    void rejectsUnknownStatus() {
        assertThatThrownBy(() -> DeviceStatus.fromValue("sleeping"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sleeping");
    }

    @Test
    void logLevelParseIsLenient() {
        assertThat(LogLevel.parse("WARN")).contains(LogLevel.WARN);
        assertThat(LogLevel.parse("verbose")).isEmpty();
        assertThat(LogLevel.parse("  ")).isEmpty();
        assertThat(LogLevel.parse(null)).isEmpty();
    }
}
