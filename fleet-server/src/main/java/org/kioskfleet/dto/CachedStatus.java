package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.kioskfleet.enums.DeviceStatus;

import java.time.Instant;

/**
 * Value stored under {@code device:{id}:status} in Redis. {@code version} is
 * the device row version the value was read from; the cache never replaces an
 * entry with an older one.
 */
public record CachedStatus(DeviceStatus status,
                           @JsonProperty("last_seen") Instant lastSeen,
                           Long version) {
}
