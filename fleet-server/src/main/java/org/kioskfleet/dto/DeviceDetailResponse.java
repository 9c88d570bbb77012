package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DeviceDetailResponse(DeviceResponse device,
                                   @JsonProperty("recent_logs") List<DeviceLogView> recentLogs) {
}
