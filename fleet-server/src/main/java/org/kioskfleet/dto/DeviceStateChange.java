package org.kioskfleet.dto;

import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.state.StateTransition;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * What a committed write did to one device. Built inside the transaction,
 * consumed after commit to refresh the cache and notify subscribers.
 * {@code version} is the row version the change committed.
 */
public record DeviceStateChange(UUID id,
                                String deviceId,
                                StateTransition transition,
                                Instant lastSeen,
                                Long version,
                                List<DeviceLogView> acceptedLogs) {

    public DeviceStatus status() {
        return transition.next();
    }

    public CachedStatus toCachedStatus() {
        return new CachedStatus(transition.next(), lastSeen, version);
    }

    public DeviceStatusChangedEvent toEvent() {
        return DeviceStatusChangedEvent.builder()
                .deviceId(id)
                .deviceIdString(deviceId)
                .status(transition.next())
                .previousStatus(transition.previous())
                .lastSeen(lastSeen)
                .version(version)
                .build();
    }
}
