package org.kioskfleet.state;

import org.kioskfleet.enums.DeviceStatus;

import java.util.Objects;

/**
 * Input to the device state machine.
 */
public final class DeviceEvent {

    public enum Kind {
        /**
         * A heartbeat arrived from the device.
         */
        HEARTBEAT_RECEIVED,

        /**
         * The sweeper found no heartbeat within the staleness timeout.
         */
        STALENESS_TIMEOUT_EXCEEDED,

        /**
         * An administrator explicitly set the status.
         */
        OPERATOR_SET_STATUS
    }

    private static final DeviceEvent HEARTBEAT = new DeviceEvent(Kind.HEARTBEAT_RECEIVED, null);
    private static final DeviceEvent TIMEOUT = new DeviceEvent(Kind.STALENESS_TIMEOUT_EXCEEDED, null);

    private final Kind kind;
    private final DeviceStatus target;

    private DeviceEvent(Kind kind, DeviceStatus target) {
        this.kind = kind;
        this.target = target;
    }

    public static DeviceEvent heartbeatReceived() {
        return HEARTBEAT;
    }

    public static DeviceEvent stalenessTimeoutExceeded() {
        return TIMEOUT;
    }

    public static DeviceEvent operatorSetStatus(DeviceStatus target) {
        return new DeviceEvent(Kind.OPERATOR_SET_STATUS, Objects.requireNonNull(target, "target"));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Requested status, only set for {@link Kind#OPERATOR_SET_STATUS}.
     */
    public DeviceStatus target() {
        return target;
    }

    @Override
    public String toString() {
        return target == null ? kind.name() : kind.name() + "(" + target.wireValue() + ")";
    }
}
