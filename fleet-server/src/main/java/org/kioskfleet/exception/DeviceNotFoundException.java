package org.kioskfleet.exception;

/**
 * Thrown when a heartbeat, command or query names a device id that is not
 * registered. Heartbeats never create devices.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device not found: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
