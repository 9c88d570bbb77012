package org.kioskfleet.exception;

import java.util.UUID;

public class DeviceGroupNotFoundException extends RuntimeException {

    public DeviceGroupNotFoundException(UUID groupId) {
        super("Device group not found: " + groupId);
    }
}
