package org.kioskfleet.dto;

import org.kioskfleet.enums.LogLevel;
import org.kioskfleet.model.DeviceLogEntry;

import java.time.Instant;
import java.util.Map;

public record DeviceLogView(LogLevel level,
                            String message,
                            String category,
                            Map<String, Object> metadata,
                            Instant timestamp) {

    public static DeviceLogView from(DeviceLogEntry entry) {
        return new DeviceLogView(entry.getLevel(), entry.getMessage(), entry.getCategory(),
                entry.getMetadata(), entry.getLoggedAt());
    }
}
