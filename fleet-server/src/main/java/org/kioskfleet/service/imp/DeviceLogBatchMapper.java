package org.kioskfleet.service.imp;

import org.kioskfleet.dto.DeviceLogPayload;
import org.kioskfleet.enums.LogLevel;
import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceLogEntry;
import org.kioskfleet.utils.TimestampUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the log batch of one heartbeat into entities. Only the first
 * {@code maxLogs} entries are considered; of those, entries without a message
 * or with an unknown level are dropped without failing the heartbeat. Overlong
 * categories are clipped to the column width.
 */
@Component
public class DeviceLogBatchMapper {

    private static final Logger log = LoggerFactory.getLogger(DeviceLogBatchMapper.class);

    private final int maxLogs;

    public DeviceLogBatchMapper(@Value("${fleet.heartbeat.max-logs-per-heartbeat:50}") int maxLogs) {
        this.maxLogs = maxLogs;
    }

    public List<DeviceLogEntry> toEntries(Device device, List<DeviceLogPayload> logs, Instant receivedAt) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        if (logs.size() > maxLogs) {
            log.debug("Truncating log batch: deviceId={}, received={}, kept={}",
                    device.getDeviceId(), logs.size(), maxLogs);
        }
        List<DeviceLogEntry> entries = new ArrayList<>();
        for (DeviceLogPayload payload : logs.subList(0, Math.min(logs.size(), maxLogs))) {
            if (payload == null || payload.getMessage() == null || payload.getMessage().isBlank()) {
                continue;
            }
            Optional<LogLevel> level = LogLevel.parse(payload.getLevel());
            if (level.isEmpty()) {
                continue;
            }
            entries.add(DeviceLogEntry.builder()
                    .device(device)
                    .level(level.get())
                    .message(payload.getMessage())
                    .category(category(payload.getCategory()))
                    .metadata(payload.getMetadata())
                    .loggedAt(TimestampUtil.parseOrDefault(payload.getTimestamp(), receivedAt))
                    .build());
        }
        return entries;
    }

    static String category(String raw) {
        if (raw == null || raw.isBlank()) {
            return DeviceLogEntry.DEFAULT_CATEGORY;
        }
        String category = raw.trim();
        return category.length() > DeviceLogEntry.CATEGORY_MAX_LENGTH
                ? category.substring(0, DeviceLogEntry.CATEGORY_MAX_LENGTH)
                : category;
    }
}
