package org.kioskfleet.service.imp;

import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.HeartbeatRequest;
import org.kioskfleet.dto.HeartbeatResult;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.StoreUnavailableException;
import org.kioskfleet.service.IDeviceStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Heartbeat ingestion, shared by the REST endpoint and the device WebSocket.
 *
 * Flow:
 * 1. Transactional write (lock, transition, documents, timestamps, logs)
 * 2. Cache refresh, best effort
 * 3. Status-changed event, only when the status actually moved
 * 4. Log event, only when entries were accepted
 */
@Service
public class HeartbeatIngestionService {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatIngestionService.class);

    private final DeviceStateWriter stateWriter;
    private final IDeviceStatusCache statusCache;
    private final DeviceEventPublisher eventPublisher;
    private final Clock clock;

    public HeartbeatIngestionService(DeviceStateWriter stateWriter,
                                     IDeviceStatusCache statusCache,
                                     DeviceEventPublisher eventPublisher,
                                     Clock clock) {
        this.stateWriter = stateWriter;
        this.statusCache = statusCache;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @throws DeviceNotFoundException   if the device is not registered
     * @throws StoreUnavailableException if the write did not commit; nothing was changed
     */
    public HeartbeatResult ingest(String deviceId, HeartbeatRequest request) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        HeartbeatRequest body = request != null ? request : new HeartbeatRequest();

        DeviceStateChange change;
        try {
            change = stateWriter.applyHeartbeat(deviceId, body, now);
        } catch (DeviceNotFoundException e) {
            log.warn("Heartbeat from unknown device: deviceId={}", deviceId);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Heartbeat write failed: deviceId={}, error={}", deviceId, e.getMessage());
            throw new StoreUnavailableException("Heartbeat could not be recorded for device " + deviceId, e);
        }

        refreshCache(change);

        if (change.transition().changed()) {
            eventPublisher.statusChanged(change);
        }
        if (!change.acceptedLogs().isEmpty()) {
            eventPublisher.logsReceived(change);
        }

        log.debug("Heartbeat recorded: deviceId={}, status={}, logs={}",
                deviceId, change.status(), change.acceptedLogs().size());
        return new HeartbeatResult(deviceId, change.status(), change.transition().changed(),
                change.acceptedLogs().size());
    }

    private void refreshCache(DeviceStateChange change) {
        try {
            statusCache.put(change.deviceId(), change.toCachedStatus());
        } catch (RuntimeException e) {
            log.warn("Cache refresh failed: deviceId={}, error={}", change.deviceId(), e.getMessage());
        }
    }
}
