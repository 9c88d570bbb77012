package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.kioskfleet.enums.DeviceStatus;

import java.time.Instant;

/**
 * Fast-path status answer; {@code source} tells whether it came from the
 * cache or from the database.
 */
public record DeviceStatusView(@JsonProperty("device_id") String deviceId,
                               DeviceStatus status,
                               @JsonProperty("last_seen") Instant lastSeen,
                               String source) {

    public static final String SOURCE_CACHE = "cache";
    public static final String SOURCE_DATABASE = "database";
}
