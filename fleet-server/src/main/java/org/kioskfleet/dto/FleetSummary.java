package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.kioskfleet.enums.DeviceStatus;

import java.util.Map;

/**
 * Device counts per status plus the number of live hub connections.
 */
public record FleetSummary(long total,
                           Map<DeviceStatus, Long> byStatus,
                           @JsonProperty("live_connections") int liveConnections) {
}
