package org.kioskfleet.dto;

/**
 * Outcome of an operator update: the refreshed device view plus the status
 * transition it caused (possibly a no-op).
 */
public record OperatorUpdateResult(DeviceResponse device, DeviceStateChange change) {
}
