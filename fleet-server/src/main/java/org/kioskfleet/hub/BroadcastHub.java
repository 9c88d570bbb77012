package org.kioskfleet.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.kioskfleet.dto.CommandDispatch;
import org.kioskfleet.dto.HubMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fan-out of events to channel members. Every message is serialized once and
 * written to each member; a member that is closed or whose send fails is
 * dropped from all channels. Delivery failures never reach the caller.
 */
@Component
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    public static final String COMMAND_EVENT = "command";

    private final ChannelRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BroadcastHub(ChannelRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return Number of admin connections the event was written to
     */
    public int toAdmins(String type, Object data) {
        return publish(ChannelRegistry.ADMIN_CHANNEL, type, data);
    }

    public int toDevices(String type, Object data) {
        return publish(ChannelRegistry.DEVICES_CHANNEL, type, data);
    }

    /**
     * @return true if at least one connection of the device received the event
     */
    public boolean toDevice(String deviceId, String type, Object data) {
        int delivered = publish(ChannelRegistry.deviceChannel(deviceId), type, data);
        if (delivered == 0) {
            log.debug("Channel not connected: deviceId={}, type={}", deviceId, type);
        }
        return delivered > 0;
    }

    public boolean routeCommand(CommandDispatch dispatch) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("command", dispatch.getCommand());
        if (dispatch.getParameters() != null) {
            payload.put("parameters", dispatch.getParameters());
        }
        return toDevice(dispatch.getDeviceId(), COMMAND_EVENT, payload);
    }

    /**
     * Direct reply on one connection (acks, errors, join confirmations).
     */
    public boolean sendTo(HubConnection connection, String type, Object data) {
        String frame = serialize(type, data);
        return frame != null && deliver(connection, frame);
    }

    private int publish(String channel, String type, Object data) {
        Set<HubConnection> members = registry.members(channel);
        if (members.isEmpty()) {
            return 0;
        }
        String frame = serialize(type, data);
        if (frame == null) {
            return 0;
        }
        int delivered = 0;
        for (HubConnection connection : members) {
            if (deliver(connection, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(HubConnection connection, String frame) {
        if (!connection.isOpen()) {
            prune(connection);
            return false;
        }
        try {
            connection.send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send failed, dropping connection: connectionId={}, error={}", connection.id(), e.getMessage());
            prune(connection);
            connection.close();
            return false;
        }
    }

    private void prune(HubConnection connection) {
        Set<String> left = registry.leaveAll(connection);
        if (!left.isEmpty()) {
            log.debug("Pruned connection: connectionId={}, channels={}", connection.id(), left);
        }
    }

    private String serialize(String type, Object data) {
        try {
            return objectMapper.writeValueAsString(new HubMessage(type, data, Instant.now(clock)));
        } catch (JsonProcessingException e) {
            log.error("Unable to serialize hub message: type={}, error={}", type, e.getMessage());
            return null;
        }
    }
}
