package org.kioskfleet.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeviceType {
    KIOSK,
    TABLET,
    DISPLAY,
    SIGNAGE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeviceType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DeviceType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid device type: " + value);
    }
}
