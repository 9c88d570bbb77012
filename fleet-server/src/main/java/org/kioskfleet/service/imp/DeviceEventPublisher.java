package org.kioskfleet.service.imp;

import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.DeviceStatusChangedEvent;
import org.kioskfleet.hub.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Notifies subscribers of committed device changes: the admin channel of the
 * hub, plus Kafka when status export is enabled. Fire-and-forget; nothing
 * here can fail the write that triggered it.
 *
 * Writers publish after their transactions commit and can overtake each
 * other. A status event whose row version is not newer than the last one
 * published for the device is dropped.
 */
@Service
public class DeviceEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventPublisher.class);

    public static final String DEVICE_LOGS_EVENT = "device:logs";
    public static final String DEVICE_DELETED_EVENT = "device:deleted";

    private final BroadcastHub hub;
    private final ObjectProvider<DeviceStatusEventProducer> statusEventProducer;
    private final ConcurrentMap<String, Long> publishedVersions = new ConcurrentHashMap<>();

    public DeviceEventPublisher(BroadcastHub hub, ObjectProvider<DeviceStatusEventProducer> statusEventProducer) {
        this.hub = hub;
        this.statusEventProducer = statusEventProducer;
    }

    public void statusChanged(DeviceStateChange change) {
        if (!claimVersion(change.deviceId(), change.version())) {
            log.debug("Superseded status event dropped: deviceId={}, status={}, version={}",
                    change.deviceId(), change.status(), change.version());
            return;
        }
        DeviceStatusChangedEvent event = change.toEvent();
        int admins = hub.toAdmins(DeviceStatusChangedEvent.EVENT_NAME, event);
        log.info("Device status changed: deviceId={}, from={}, to={}, admins={}",
                change.deviceId(), change.transition().previous(), change.transition().next(), admins);
        statusEventProducer.ifAvailable(producer -> producer.publish(event));
    }

    public void logsReceived(DeviceStateChange change) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", change.id());
        payload.put("device_id_string", change.deviceId());
        payload.put("logs", change.acceptedLogs());
        hub.toAdmins(DEVICE_LOGS_EVENT, payload);
    }

    public void deviceDeleted(UUID id, String deviceId) {
        publishedVersions.remove(deviceId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", id);
        payload.put("device_id_string", deviceId);
        hub.toAdmins(DEVICE_DELETED_EVENT, payload);
    }

    private boolean claimVersion(String deviceId, Long version) {
        if (version == null) {
            return true;
        }
        AtomicBoolean newest = new AtomicBoolean(false);
        publishedVersions.compute(deviceId, (id, published) -> {
            if (published != null && published >= version) {
                return published;
            }
            newest.set(true);
            return version;
        });
        return newest.get();
    }
}
