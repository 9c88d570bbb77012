package org.kioskfleet.state;

import org.kioskfleet.enums.DeviceStatus;

/**
 * Result of applying one event to one device status.
 */
public record StateTransition(DeviceStatus previous, DeviceStatus next) {

    public boolean changed() {
        return previous != next;
    }
}
