package org.kioskfleet.state;

import org.kioskfleet.enums.DeviceStatus;
import org.springframework.stereotype.Component;

/**
 * Pure transition function for device status. Holds no state and performs no
 * I/O, so heartbeat ingestion, operator updates and the sweeper all share it.
 *
 * Transitions:
 * - HEARTBEAT_RECEIVED: offline -> online, online -> online; maintenance and
 *   error are left alone, a device under load must not clear an operator fault.
 * - STALENESS_TIMEOUT_EXCEEDED: online -> offline; nothing else moves.
 * - OPERATOR_SET_STATUS: any -> target. The only way in or out of
 *   maintenance and error.
 */
@Component
public class DeviceStateMachine {

    public StateTransition apply(DeviceStatus current, DeviceEvent event) {
        DeviceStatus from = current == null ? DeviceStatus.OFFLINE : current;
        DeviceStatus to = switch (event.kind()) {
            case HEARTBEAT_RECEIVED -> from == DeviceStatus.OFFLINE ? DeviceStatus.ONLINE : from;
            case STALENESS_TIMEOUT_EXCEEDED -> from == DeviceStatus.ONLINE ? DeviceStatus.OFFLINE : from;
            case OPERATOR_SET_STATUS -> event.target();
        };
        return new StateTransition(from, to);
    }
}
