package org.kioskfleet.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.kioskfleet.dto.HeartbeatRequest;
import org.kioskfleet.dto.HeartbeatResult;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.StoreUnavailableException;
import org.kioskfleet.service.imp.HeartbeatIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device connections. A device joins its own channel and the broadcast
 * channel; heartbeats sent over the socket take the same ingestion path as
 * REST heartbeats.
 */
@Component
public class DeviceSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DeviceSocketHandler.class);

    public static final String STATUS_UPDATE_EVENT = "device:status:update";

    private final ChannelRegistry registry;
    private final BroadcastHub hub;
    private final HeartbeatIngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DeviceSocketHandler(ChannelRegistry registry,
                               BroadcastHub hub,
                               HeartbeatIngestionService ingestionService,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.registry = registry;
        this.hub = hub;
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String deviceId = deviceId(session);
        HubConnection connection = WebSocketHubConnection.of(session);
        registry.join(ChannelRegistry.deviceChannel(deviceId), connection);
        registry.join(ChannelRegistry.DEVICES_CHANNEL, connection);
        hub.sendTo(connection, "device:registered", Map.of("success", true, "device_id", deviceId));
        log.info("Device connected: deviceId={}, connectionId={}", deviceId, session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.leaveAll(WebSocketHubConnection.of(session));
        log.info("Device disconnected: deviceId={}, connectionId={}, status={}",
                deviceId(session), session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Device transport error: deviceId={}, error={}", deviceId(session), exception.getMessage());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        HubConnection connection = WebSocketHubConnection.of(session);
        String deviceId = deviceId(session);
        try {
            HubFrame frame = objectMapper.readValue(message.getPayload(), HubFrame.class);
            handleFrame(connection, deviceId, frame);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Bad device frame: deviceId={}, error={}", deviceId, e.getMessage());
            hub.sendTo(connection, "error", Map.of("message", "Invalid message"));
        } catch (DeviceNotFoundException e) {
            hub.sendTo(connection, "error", Map.of("message", "Device not found"));
        } catch (StoreUnavailableException e) {
            hub.sendTo(connection, "error", Map.of("message", "Heartbeat not recorded, retry later"));
        } catch (RuntimeException e) {
            log.error("Device frame failed: deviceId={}", deviceId, e);
            hub.sendTo(connection, "error", Map.of("message", "Internal server error"));
        }
    }

    void handleFrame(HubConnection connection, String deviceId, HubFrame frame) throws JsonProcessingException {
        String type = frame.type() == null ? "" : frame.type();
        switch (type) {
            case "heartbeat", "device:heartbeat" -> {
                HeartbeatRequest request = frame.data() == null || frame.data().isNull()
                        ? new HeartbeatRequest()
                        : objectMapper.treeToValue(frame.data(), HeartbeatRequest.class);
                HeartbeatResult result = ingestionService.ingest(deviceId, request);
                Map<String, Object> ack = new LinkedHashMap<>();
                ack.put("status", result.status());
                ack.put("timestamp", Instant.now(clock));
                hub.sendTo(connection, "heartbeat:ack", ack);
            }
            case "device:status" -> {
                ObjectNode payload = objectMapper.createObjectNode();
                payload.put("device_id", deviceId);
                if (frame.data() != null && frame.data().isObject()) {
                    payload.setAll((ObjectNode) frame.data());
                    payload.put("device_id", deviceId);
                }
                hub.toAdmins(STATUS_UPDATE_EVENT, payload);
            }
            case "pong" -> log.trace("Pong: deviceId={}", deviceId);
            default -> hub.sendTo(connection, "error", Map.of("message", "Unknown message type: " + type));
        }
    }

    private static String deviceId(WebSocketSession session) {
        return (String) session.getAttributes().get(DeviceHandshakeInterceptor.DEVICE_ID_ATTRIBUTE);
    }
}
