package org.kioskfleet.service.imp;

import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.model.Device;
import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.service.IDeviceStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Background job that marks devices offline once they stop heartbeating.
 *
 * Each candidate is demoted by its own conditional update, so one failing
 * device does not abort the sweep and a heartbeat that lands mid-sweep keeps
 * the device online.
 */
@Service
public class StalenessSweeper {

    private static final Logger log = LoggerFactory.getLogger(StalenessSweeper.class);

    private final DeviceRepository deviceRepository;
    private final DeviceStateWriter stateWriter;
    private final IDeviceStatusCache statusCache;
    private final DeviceEventPublisher eventPublisher;
    private final Clock clock;
    private final long stalenessTimeoutSeconds;

    public StalenessSweeper(DeviceRepository deviceRepository,
                            DeviceStateWriter stateWriter,
                            IDeviceStatusCache statusCache,
                            DeviceEventPublisher eventPublisher,
                            Clock clock,
                            @Value("${fleet.heartbeat.staleness-timeout-seconds:300}") long stalenessTimeoutSeconds) {
        this.deviceRepository = deviceRepository;
        this.stateWriter = stateWriter;
        this.statusCache = statusCache;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.stalenessTimeoutSeconds = stalenessTimeoutSeconds;
    }

    @Scheduled(fixedRateString = "${fleet.sweeper.interval-ms:60000}",
               initialDelayString = "${fleet.sweeper.initial-delay-ms:30000}")
    public void sweep() {
        sweepNow();
    }

    /**
     * Runs one sweep immediately. Also called from the admin API.
     *
     * @return Number of devices demoted to offline
     */
    public int sweepNow() {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        Instant cutoff = now.minusSeconds(stalenessTimeoutSeconds);

        List<Device> candidates;
        try {
            candidates = deviceRepository.findStaleCandidates(DeviceStatus.ONLINE, cutoff);
        } catch (DataAccessException e) {
            log.error("Sweep aborted, candidate query failed: {}", e.getMessage());
            return 0;
        }

        if (candidates.isEmpty()) {
            log.debug("Sweep found no stale devices");
            return 0;
        }

        log.info("Sweep found {} stale device(s), cutoff={}", candidates.size(), cutoff);

        int demoted = 0;
        for (Device candidate : candidates) {
            try {
                Optional<DeviceStateChange> change = stateWriter.demoteIfStale(candidate, cutoff, now);
                if (change.isEmpty()) {
                    log.debug("Device refreshed during sweep, skipped: deviceId={}", candidate.getDeviceId());
                    continue;
                }
                demoted++;
                invalidateCache(change.get());
                eventPublisher.statusChanged(change.get());
            } catch (RuntimeException e) {
                log.error("Failed to sweep deviceId {}: {}", candidate.getDeviceId(), e.getMessage());
            }
        }

        log.info("Sweep complete: demoted={}", demoted);
        return demoted;
    }

    // A heartbeat may commit right after the demotion; the next read repopulates from the database
    private void invalidateCache(DeviceStateChange change) {
        try {
            statusCache.evict(change.deviceId());
        } catch (RuntimeException e) {
            log.warn("Cache evict failed: deviceId={}, error={}", change.deviceId(), e.getMessage());
        }
    }
}
