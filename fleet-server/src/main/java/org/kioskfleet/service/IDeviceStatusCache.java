package org.kioskfleet.service;

import org.kioskfleet.dto.CachedStatus;

import java.util.Optional;

/**
 * Fast-path copy of each device's status. Implementations never throw: a
 * failed write leaves a stale or missing entry, a failed read is a miss.
 */
public interface IDeviceStatusCache {

    void put(String deviceId, CachedStatus status);

    Optional<CachedStatus> get(String deviceId);

    void evict(String deviceId);
}
