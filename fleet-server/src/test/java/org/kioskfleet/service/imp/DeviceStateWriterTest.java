package org.kioskfleet.service.imp;

import org.junit.jupiter.api.Test;
import org.kioskfleet.dto.DeviceLogPayload;
import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.DeviceUpdateRequest;
import org.kioskfleet.dto.HeartbeatRequest;
import org.kioskfleet.dto.OperatorUpdateResult;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceLogEntry;
import org.kioskfleet.repository.DeviceLogRepository;
import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.state.DeviceStateMachine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({DeviceStateWriter.class, DeviceStateMachine.class, DeviceLogBatchMapper.class})
class DeviceStateWriterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private DeviceStateWriter writer;
    @Autowired
    private DeviceRepository deviceRepository;
    @Autowired
    private DeviceLogRepository logRepository;
    @Autowired
    private TestEntityManager entityManager;

    @Test
    void heartbeatBringsOfflineDeviceOnline() {
        register("KIOSK-001", DeviceStatus.OFFLINE);

        DeviceStateChange change = writer.applyHeartbeat("KIOSK-001", new HeartbeatRequest(), NOW);

        assertThat(change.transition().previous()).isEqualTo(DeviceStatus.OFFLINE);
        assertThat(change.status()).isEqualTo(DeviceStatus.ONLINE);
        Device stored = reload("KIOSK-001");
        assertThat(stored.getStatus()).isEqualTo(DeviceStatus.ONLINE);
        assertThat(stored.getLastHeartbeat()).isEqualTo(NOW);
        assertThat(stored.getLastSeen()).isEqualTo(NOW);
    }

    @Test
    void heartbeatDoesNotClearMaintenance() {
        register("KIOSK-001", DeviceStatus.MAINTENANCE);

        DeviceStateChange change = writer.applyHeartbeat("KIOSK-001", new HeartbeatRequest(), NOW);

        assertThat(change.transition().changed()).isFalse();
        Device stored = reload("KIOSK-001");
        assertThat(stored.getStatus()).isEqualTo(DeviceStatus.MAINTENANCE);
        assertThat(stored.getLastHeartbeat()).isEqualTo(NOW);
    }

    @Test
    void heartbeatReplacesProvidedDocumentsAndKeepsOthers() {
        Device device = register("KIOSK-001", DeviceStatus.ONLINE);
        device.setSoftwareInfo(Map.of("agent", "1.0"));
        device.setHardwareInfo(Map.of("cpu", "x86", "disk_gb", 64));
        deviceRepository.saveAndFlush(device);

        HeartbeatRequest request = HeartbeatRequest.builder()
                .hardwareInfo(Map.of("cpu", "arm64"))
                .build();
        writer.applyHeartbeat("KIOSK-001", request, NOW);

        Device stored = reload("KIOSK-001");
        assertThat(stored.getHardwareInfo()).containsOnlyKeys("cpu").containsEntry("cpu", "arm64");
        assertThat(stored.getSoftwareInfo()).containsEntry("agent", "1.0");
    }

    @Test
    void heartbeatPersistsOnlyValidLogEntries() {
        Device device = register("KIOSK-001", DeviceStatus.ONLINE);
        HeartbeatRequest request = HeartbeatRequest.builder()
                .logs(List.of(
                        DeviceLogPayload.builder().level("info").message("screen on").build(),
                        DeviceLogPayload.builder().level("error").build(),
                        DeviceLogPayload.builder().level("warn").message("temp high").category("sensors").build()))
                .build();

        DeviceStateChange change = writer.applyHeartbeat("KIOSK-001", request, NOW);

        assertThat(change.acceptedLogs()).hasSize(2);
        entityManager.flush();
        assertThat(logRepository.countByDevice(device)).isEqualTo(2);
    }

    @Test
    void oversizedLogContentDoesNotFailTheHeartbeat() {
        Device device = register("KIOSK-001", DeviceStatus.OFFLINE);
        String longMessage = "x".repeat(20_000);
        String longCategory = "c".repeat(80);
        HeartbeatRequest request = HeartbeatRequest.builder()
                .logs(List.of(DeviceLogPayload.builder()
                        .level("error").message(longMessage).category(longCategory).build()))
                .build();

        writer.applyHeartbeat("KIOSK-001", request, NOW);
        entityManager.flush();
        entityManager.clear();

        assertThat(reload("KIOSK-001").getStatus()).isEqualTo(DeviceStatus.ONLINE);
        List<DeviceLogEntry> logs = logRepository.findTop10ByDeviceOrderByLoggedAtDesc(device);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getMessage()).hasSize(20_000);
        assertThat(logs.get(0).getCategory()).hasSize(DeviceLogEntry.CATEGORY_MAX_LENGTH);
    }

    @Test
    void committedChangesCarryTheRowVersion() {
        register("KIOSK-001", DeviceStatus.OFFLINE);

        DeviceStateChange heartbeat = writer.applyHeartbeat("KIOSK-001", new HeartbeatRequest(), NOW);
        assertThat(heartbeat.version()).isEqualTo(reload("KIOSK-001").getVersion());

        OperatorUpdateResult override = writer.applyOperatorUpdate("KIOSK-001",
                DeviceUpdateRequest.builder().status(DeviceStatus.ERROR).build(), "alice", NOW.plusSeconds(1));
        assertThat(override.change().version()).isGreaterThan(heartbeat.version());
        assertThat(override.change().version()).isEqualTo(reload("KIOSK-001").getVersion());
    }

    @Test
    void heartbeatForUnknownDeviceFails() {
        assertThatThrownBy(() -> writer.applyHeartbeat("GHOST", new HeartbeatRequest(), NOW))
                .isInstanceOf(DeviceNotFoundException.class);
    }

    @Test
    void operatorOverrideAppliesFieldsAndRecordsSystemLog() {
        Device device = register("KIOSK-001", DeviceStatus.ONLINE);
        DeviceUpdateRequest request = DeviceUpdateRequest.builder()
                .name("  Front desk  ")
                .status(DeviceStatus.MAINTENANCE)
                .build();

        OperatorUpdateResult result = writer.applyOperatorUpdate("KIOSK-001", request, "alice", NOW);

        assertThat(result.change().transition().changed()).isTrue();
        assertThat(result.device().name()).isEqualTo("Front desk");
        assertThat(result.device().status()).isEqualTo(DeviceStatus.MAINTENANCE);
        entityManager.flush();
        List<DeviceLogEntry> logs = logRepository.findTop10ByDeviceOrderByLoggedAtDesc(device);
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getCategory()).isEqualTo(DeviceLogEntry.SYSTEM_CATEGORY);
        assertThat(logs.get(0).getMetadata()).containsEntry("updated_by", "alice");
    }

    @Test
    void emptyOperatorUpdateIsRejected() {
        register("KIOSK-001", DeviceStatus.ONLINE);

        assertThatThrownBy(() -> writer.applyOperatorUpdate("KIOSK-001", new DeviceUpdateRequest(), "alice", NOW))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("No valid fields to update");
    }

    @Test
    void sweeperDemotionLosesToFreshHeartbeat() {
        Device device = register("KIOSK-001", DeviceStatus.ONLINE);
        device.setLastHeartbeat(NOW.minus(10, ChronoUnit.MINUTES));
        deviceRepository.saveAndFlush(device);
        Device candidate = reload("KIOSK-001");

        // heartbeat commits between candidate read and demotion
        writer.applyHeartbeat("KIOSK-001", new HeartbeatRequest(), NOW);
        entityManager.flush();

        Optional<DeviceStateChange> change = writer.demoteIfStale(candidate, NOW.minus(5, ChronoUnit.MINUTES), NOW);

        assertThat(change).isEmpty();
        assertThat(reload("KIOSK-001").getStatus()).isEqualTo(DeviceStatus.ONLINE);
    }

    @Test
    void sweeperDemotesStaleDevice() {
        Device device = register("KIOSK-001", DeviceStatus.ONLINE);
        device.setLastHeartbeat(NOW.minus(10, ChronoUnit.MINUTES));
        deviceRepository.saveAndFlush(device);

        Optional<DeviceStateChange> change = writer.demoteIfStale(reload("KIOSK-001"),
                NOW.minus(5, ChronoUnit.MINUTES), NOW);

        assertThat(change).isPresent();
        assertThat(change.get().status()).isEqualTo(DeviceStatus.OFFLINE);
        Device stored = reload("KIOSK-001");
        assertThat(stored.getStatus()).isEqualTo(DeviceStatus.OFFLINE);
        assertThat(change.get().version()).isEqualTo(stored.getVersion());
    }

    private Device register(String deviceId, DeviceStatus status) {
        return deviceRepository.saveAndFlush(Device.builder()
                .deviceId(deviceId)
                .name("Lobby kiosk")
                .status(status)
                .createdAt(NOW.minus(1, ChronoUnit.DAYS))
                .updatedAt(NOW.minus(1, ChronoUnit.DAYS))
                .build());
    }

    private Device reload(String deviceId) {
        entityManager.flush();
        entityManager.clear();
        return deviceRepository.findByDeviceId(deviceId).orElseThrow();
    }
}
