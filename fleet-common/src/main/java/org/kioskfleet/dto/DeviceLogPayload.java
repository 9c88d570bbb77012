package org.kioskfleet.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One log entry as reported by a device. Level and timestamp are kept as raw
 * strings so a malformed entry can be dropped without rejecting the heartbeat.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceLogPayload {
    private String level; // debug, info, warn, error, fatal

    private String message;

    private String category;

    private Map<String, Object> metadata;

    private String timestamp; // ISO-8601 or epoch millis
}
