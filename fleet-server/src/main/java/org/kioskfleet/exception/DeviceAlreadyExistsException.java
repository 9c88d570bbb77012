package org.kioskfleet.exception;

/**
 * Thrown when registering a device whose device_id is already taken.
 */
public class DeviceAlreadyExistsException extends RuntimeException {

    public DeviceAlreadyExistsException(String deviceId) {
        super("Device ID already exists: " + deviceId);
    }
}
