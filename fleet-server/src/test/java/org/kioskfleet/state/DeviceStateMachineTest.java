package org.kioskfleet.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.kioskfleet.enums.DeviceStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceStateMachineTest {

    private final DeviceStateMachine stateMachine = new DeviceStateMachine();

    @ParameterizedTest
    @CsvSource({
            "OFFLINE, ONLINE, true",
            "ONLINE, ONLINE, false",
            "MAINTENANCE, MAINTENANCE, false",
            "ERROR, ERROR, false"
    })
    void heartbeatOnlyBringsOfflineDevicesOnline(DeviceStatus from, DeviceStatus to, boolean changed) {
        StateTransition transition = stateMachine.apply(from, DeviceEvent.heartbeatReceived());

        assertThat(transition.previous()).isEqualTo(from);
        assertThat(transition.next()).isEqualTo(to);
        assertThat(transition.changed()).isEqualTo(changed);
    }

    @ParameterizedTest
    @CsvSource({
            "ONLINE, OFFLINE, true",
            "OFFLINE, OFFLINE, false",
            "MAINTENANCE, MAINTENANCE, false",
            "ERROR, ERROR, false"
    })
    void timeoutOnlyDemotesOnlineDevices(DeviceStatus from, DeviceStatus to, boolean changed) {
        StateTransition transition = stateMachine.apply(from, DeviceEvent.stalenessTimeoutExceeded());

        assertThat(transition.next()).isEqualTo(to);
        assertThat(transition.changed()).isEqualTo(changed);
    }

    @Test
    void operatorOverrideReachesAnyState() {
        for (DeviceStatus from : DeviceStatus.values()) {
            for (DeviceStatus target : DeviceStatus.values()) {
                StateTransition transition = stateMachine.apply(from, DeviceEvent.operatorSetStatus(target));
                assertThat(transition.next()).isEqualTo(target);
                assertThat(transition.changed()).isEqualTo(from != target);
            }
        }
    }

    @Test
    void maintenanceSurvivesHeartbeatsUntilOperatorClearsIt() {
        DeviceStatus status = stateMachine.apply(DeviceStatus.ONLINE,
                DeviceEvent.operatorSetStatus(DeviceStatus.MAINTENANCE)).next();

        status = stateMachine.apply(status, DeviceEvent.heartbeatReceived()).next();
        assertThat(status).isEqualTo(DeviceStatus.MAINTENANCE);

        status = stateMachine.apply(status, DeviceEvent.operatorSetStatus(DeviceStatus.OFFLINE)).next();
        status = stateMachine.apply(status, DeviceEvent.heartbeatReceived()).next();
        assertThat(status).isEqualTo(DeviceStatus.ONLINE);
    }

    @Test
    void missingStatusIsTreatedAsOffline() {
        StateTransition transition = stateMachine.apply(null, DeviceEvent.heartbeatReceived());

        assertThat(transition.previous()).isEqualTo(DeviceStatus.OFFLINE);
        assertThat(transition.next()).isEqualTo(DeviceStatus.ONLINE);
    }

    @Test
    void operatorEventRequiresTarget() {
        assertThatThrownBy(() -> DeviceEvent.operatorSetStatus(null))
                .isInstanceOf(NullPointerException.class);
    }
}
