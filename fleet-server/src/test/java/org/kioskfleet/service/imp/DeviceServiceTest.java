package org.kioskfleet.service.imp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.CachedStatus;
import org.kioskfleet.dto.DeviceResponse;
import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.DeviceStatusView;
import org.kioskfleet.dto.DeviceUpdateRequest;
import org.kioskfleet.dto.OperatorUpdateResult;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.hub.ChannelRegistry;
import org.kioskfleet.hub.HubConnection;
import org.kioskfleet.model.Device;
import org.kioskfleet.repository.DeviceGroupRepository;
import org.kioskfleet.repository.DeviceLogRepository;
import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.service.IDeviceStatusCache;
import org.kioskfleet.state.StateTransition;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceServiceTest {

    private static final Instant SEEN = Instant.parse("2024-05-01T09:58:00Z");
    private static final AuthenticatedPrincipal ALICE =
            new AuthenticatedPrincipal("1", "alice", AuthenticatedPrincipal.ROLE_ADMIN);

    @Mock
    private DeviceRepository deviceRepository;
    @Mock
    private DeviceLogRepository logRepository;
    @Mock
    private DeviceGroupRepository groupRepository;
    @Mock
    private DeviceStateWriter stateWriter;
    @Mock
    private IDeviceStatusCache statusCache;
    @Mock
    private DeviceEventPublisher eventPublisher;

    private ChannelRegistry registry;
    private DeviceService service;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry();
        service = new DeviceService(deviceRepository, logRepository, groupRepository, stateWriter,
                statusCache, eventPublisher, registry,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void statusIsServedFromCacheWhenPresent() {
        when(statusCache.get("KIOSK-001")).thenReturn(Optional.of(new CachedStatus(DeviceStatus.ONLINE, SEEN, 3L)));

        DeviceStatusView view = service.getStatus("KIOSK-001");

        assertThat(view.status()).isEqualTo(DeviceStatus.ONLINE);
        assertThat(view.source()).isEqualTo(DeviceStatusView.SOURCE_CACHE);
        verifyNoInteractions(deviceRepository);
    }

    @Test
    void cacheMissFallsBackToDatabaseAndRepopulates() {
        when(statusCache.get("KIOSK-001")).thenReturn(Optional.empty());
        when(deviceRepository.findByDeviceId("KIOSK-001")).thenReturn(Optional.of(Device.builder()
                .id(UUID.randomUUID()).deviceId("KIOSK-001").name("Lobby")
                .status(DeviceStatus.MAINTENANCE).lastSeen(SEEN).version(3L).build()));

        DeviceStatusView view = service.getStatus("KIOSK-001");

        assertThat(view.status()).isEqualTo(DeviceStatus.MAINTENANCE);
        assertThat(view.source()).isEqualTo(DeviceStatusView.SOURCE_DATABASE);
        verify(statusCache).put("KIOSK-001", new CachedStatus(DeviceStatus.MAINTENANCE, SEEN, 3L));
    }

    @Test
    void statusOfUnknownDeviceIsNotFound() {
        when(statusCache.get("GHOST")).thenReturn(Optional.empty());
        when(deviceRepository.findByDeviceId("GHOST")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus("GHOST")).isInstanceOf(DeviceNotFoundException.class);
        verify(statusCache, never()).put(any(), any());
    }

    @Test
    void pageSizeIsBounded() {
        assertThatThrownBy(() -> service.listDevices(1, 101, null, null, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.listDevices(0, 20, null, null, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.getLogs("KIOSK-001", 1, 1001, null, null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void deleteEvictsCacheAndNotifiesAdmins() {
        UUID id = UUID.randomUUID();
        when(deviceRepository.findByDeviceId("KIOSK-001"))
                .thenReturn(Optional.of(Device.builder().id(id).deviceId("KIOSK-001").name("Lobby").build()));

        service.deleteDevice("KIOSK-001", null);

        verify(deviceRepository).deleteById(id);
        verify(statusCache).evict("KIOSK-001");
        verify(eventPublisher).deviceDeleted(id, "KIOSK-001");
    }

    @Test
    void deleteClosesLiveDeviceConnections() {
        UUID id = UUID.randomUUID();
        when(deviceRepository.findByDeviceId("KIOSK-001"))
                .thenReturn(Optional.of(Device.builder().id(id).deviceId("KIOSK-001").name("Lobby").build()));
        HubConnection connection = mock(HubConnection.class);
        when(connection.id()).thenReturn("session-1");
        registry.join(ChannelRegistry.deviceChannel("KIOSK-001"), connection);
        registry.join(ChannelRegistry.DEVICES_CHANNEL, connection);

        service.deleteDevice("KIOSK-001", null);

        verify(connection).close();
        assertThat(registry.hasMembers(ChannelRegistry.DEVICES_CHANNEL)).isFalse();
        assertThat(registry.hasMembers(ChannelRegistry.deviceChannel("KIOSK-001"))).isFalse();
    }

    @Test
    void operatorOverrideRefreshesCacheAndEmitsOneEvent() {
        DeviceUpdateRequest request = DeviceUpdateRequest.builder().status(DeviceStatus.MAINTENANCE).build();
        DeviceStateChange change = new DeviceStateChange(UUID.randomUUID(), "KIOSK-001",
                new StateTransition(DeviceStatus.ONLINE, DeviceStatus.MAINTENANCE), SEEN, 12L, List.of());
        when(stateWriter.applyOperatorUpdate(eq("KIOSK-001"), eq(request), eq("alice"), any()))
                .thenReturn(new OperatorUpdateResult(response(DeviceStatus.MAINTENANCE), change));

        DeviceResponse updated = service.updateDevice("KIOSK-001", request, ALICE);

        assertThat(updated.status()).isEqualTo(DeviceStatus.MAINTENANCE);
        verify(statusCache).put("KIOSK-001", new CachedStatus(DeviceStatus.MAINTENANCE, SEEN, 12L));
        verify(eventPublisher, times(1)).statusChanged(change);
    }

    @Test
    void overrideToCurrentStatusEmitsNothing() {
        DeviceUpdateRequest request = DeviceUpdateRequest.builder().status(DeviceStatus.ONLINE).build();
        DeviceStateChange change = new DeviceStateChange(UUID.randomUUID(), "KIOSK-001",
                new StateTransition(DeviceStatus.ONLINE, DeviceStatus.ONLINE), SEEN, 12L, List.of());
        when(stateWriter.applyOperatorUpdate(eq("KIOSK-001"), eq(request), eq("alice"), any()))
                .thenReturn(new OperatorUpdateResult(response(DeviceStatus.ONLINE), change));

        service.updateDevice("KIOSK-001", request, ALICE);

        verify(statusCache, never()).put(any(), any());
        verify(eventPublisher, never()).statusChanged(any());
    }

    private static DeviceResponse response(DeviceStatus status) {
        return DeviceResponse.from(Device.builder()
                .id(UUID.randomUUID()).deviceId("KIOSK-001").name("Lobby").status(status).lastSeen(SEEN).build());
    }
}
