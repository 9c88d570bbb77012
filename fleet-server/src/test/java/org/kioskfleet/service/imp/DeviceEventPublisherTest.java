package org.kioskfleet.service.imp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.DeviceStatusChangedEvent;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.hub.BroadcastHub;
import org.kioskfleet.hub.ChannelRegistry;
import org.kioskfleet.hub.HubConnection;
import org.kioskfleet.state.StateTransition;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceEventPublisherTest {

    private static final UUID ID = UUID.fromString("5f0c6a3e-8a1b-4c55-9d8e-0a1b2c3d4e5f");
    private static final Instant SEEN = Instant.parse("2024-05-01T09:58:00Z");

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private HubConnection admin;
    private DeviceStatusEventProducer producer;
    private DeviceEventPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        ChannelRegistry registry = new ChannelRegistry();
        BroadcastHub hub = new BroadcastHub(registry,
                mapper, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        admin = mock(HubConnection.class);
        when(admin.id()).thenReturn("a1");
        when(admin.isOpen()).thenReturn(true);
        registry.join(ChannelRegistry.ADMIN_CHANNEL, admin);

        producer = mock(DeviceStatusEventProducer.class);
        ObjectProvider<DeviceStatusEventProducer> provider = mock(ObjectProvider.class);
        doAnswer(invocation -> {
            invocation.<Consumer<DeviceStatusEventProducer>>getArgument(0).accept(producer);
            return null;
        }).when(provider).ifAvailable(any());
        publisher = new DeviceEventPublisher(hub, provider);
    }

    @Test
    void statusEventCarriesWireFieldsToAdmins() throws Exception {
        publisher.statusChanged(change(DeviceStatus.ONLINE, DeviceStatus.OFFLINE, 4L));

        List<String> frames = sentFrames(1);
        JsonNode frame = mapper.readTree(frames.get(0));
        assertThat(frame.get("type").asText()).isEqualTo(DeviceStatusChangedEvent.EVENT_NAME);
        JsonNode data = frame.get("data");
        assertThat(data.get("device_id").asText()).isEqualTo(ID.toString());
        assertThat(data.get("device_id_string").asText()).isEqualTo("KIOSK-001");
        assertThat(data.get("status").asText()).isEqualTo("offline");
        assertThat(data.get("previous_status").asText()).isEqualTo("online");
        assertThat(data.hasNonNull("last_seen")).isTrue();
        assertThat(data.get("version").asLong()).isEqualTo(4L);

        ArgumentCaptor<DeviceStatusChangedEvent> exported = ArgumentCaptor.forClass(DeviceStatusChangedEvent.class);
        verify(producer).publish(exported.capture());
        assertThat(exported.getValue().getStatus()).isEqualTo(DeviceStatus.OFFLINE);
    }

    @Test
    void eventOvertakenByNewerVersionIsDropped() throws Exception {
        publisher.statusChanged(change(DeviceStatus.OFFLINE, DeviceStatus.ONLINE, 5L));
        publisher.statusChanged(change(DeviceStatus.ONLINE, DeviceStatus.OFFLINE, 4L));

        List<String> frames = sentFrames(1);
        assertThat(mapper.readTree(frames.get(0)).get("data").get("status").asText()).isEqualTo("online");
        verify(producer, times(1)).publish(any());
    }

    @Test
    void deletionResetsVersionTracking() throws Exception {
        publisher.statusChanged(change(DeviceStatus.OFFLINE, DeviceStatus.ONLINE, 9L));
        publisher.deviceDeleted(ID, "KIOSK-001");
        publisher.statusChanged(change(DeviceStatus.OFFLINE, DeviceStatus.ONLINE, 1L));

        List<String> frames = sentFrames(3);
        assertThat(mapper.readTree(frames.get(1)).get("type").asText())
                .isEqualTo(DeviceEventPublisher.DEVICE_DELETED_EVENT);
        assertThat(mapper.readTree(frames.get(2)).get("data").get("version").asLong()).isEqualTo(1L);
    }

    private List<String> sentFrames(int expected) throws Exception {
        ArgumentCaptor<String> frames = ArgumentCaptor.forClass(String.class);
        verify(admin, times(expected)).send(frames.capture());
        return frames.getAllValues();
    }

    private static DeviceStateChange change(DeviceStatus from, DeviceStatus to, long version) {
        return new DeviceStateChange(ID, "KIOSK-001", new StateTransition(from, to), SEEN, version, List.of());
    }
}
