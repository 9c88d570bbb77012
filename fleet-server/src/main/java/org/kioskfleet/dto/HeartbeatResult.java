package org.kioskfleet.dto;

import org.kioskfleet.enums.DeviceStatus;

public record HeartbeatResult(String deviceId, DeviceStatus status, boolean statusChanged, int acceptedLogs) {
}
