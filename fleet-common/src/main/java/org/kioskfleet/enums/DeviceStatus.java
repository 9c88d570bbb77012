package org.kioskfleet.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operational state of a managed device.
 * Serialized in lowercase on the wire ("online", "offline", ...).
 */
public enum DeviceStatus {

    /**
     * Heartbeating within the staleness window.
     */
    ONLINE,

    /**
     * Initial state, and the state a device is demoted to once its heartbeats stop.
     */
    OFFLINE,

    /**
     * Declared by an operator. Heartbeats do not leave this state.
     */
    MAINTENANCE,

    /**
     * Declared by an operator after a fault. Heartbeats do not leave this state.
     */
    ERROR;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeviceStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DeviceStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }
}
