package org.kioskfleet.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.CommandDispatch;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.service.imp.DeviceCommandService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * Administrator console connections. Joins the admin channel and hands
 * command, configuration and deployment frames to {@link DeviceCommandService},
 * the same path the REST endpoints use.
 */
@Component
public class AdminSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminSocketHandler.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ChannelRegistry registry;
    private final BroadcastHub hub;
    private final DeviceCommandService commandService;
    private final ObjectMapper objectMapper;

    public AdminSocketHandler(ChannelRegistry registry, BroadcastHub hub,
                              DeviceCommandService commandService, ObjectMapper objectMapper) {
        this.registry = registry;
        this.hub = hub;
        this.commandService = commandService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        HubConnection connection = WebSocketHubConnection.of(session);
        registry.join(ChannelRegistry.ADMIN_CHANNEL, connection);
        hub.sendTo(connection, "admin:joined", Map.of("success", true));
        AuthenticatedPrincipal principal = principal(session);
        log.info("Admin connected: connectionId={}, user={}", session.getId(),
                principal != null ? principal.username() : null);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.leaveAll(WebSocketHubConnection.of(session));
        log.info("Admin disconnected: connectionId={}, status={}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Admin transport error: connectionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        HubConnection connection = WebSocketHubConnection.of(session);
        try {
            HubFrame frame = objectMapper.readValue(message.getPayload(), HubFrame.class);
            handleFrame(connection, principal(session), frame);
        } catch (JsonProcessingException e) {
            log.debug("Bad admin frame: connectionId={}, error={}", session.getId(), e.getMessage());
            hub.sendTo(connection, "error", Map.of("message", "Invalid message"));
        }
    }

    void handleFrame(HubConnection connection, AuthenticatedPrincipal principal, HubFrame frame) {
        String type = frame.type() == null ? "" : frame.type();
        JsonNode data = frame.data();
        try {
            switch (type) {
                case "device:command" -> {
                    CommandDispatch dispatch = objectMapper.treeToValue(data, CommandDispatch.class);
                    String deviceId = requireDeviceId(dispatch == null ? null : dispatch.getDeviceId());
                    if (dispatch.getCommand() == null || dispatch.getCommand().isBlank()) {
                        throw new IllegalArgumentException("command is required");
                    }
                    commandService.dispatchCommand(deviceId, dispatch.getCommand(), dispatch.getParameters(), principal);
                }
                case "config:update" -> commandService.pushConfig(
                        requireDeviceId(text(data, "device_id", "deviceId")), payload(data, "config"));
                case "app:deploy" -> commandService.deployApplication(
                        requireDeviceId(text(data, "device_id", "deviceId")), payload(data, "appData"));
                default -> hub.sendTo(connection, "error", Map.of("message", "Unknown message type: " + type));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Bad admin frame: connectionId={}, type={}, error={}", connection.id(), type, e.getMessage());
            hub.sendTo(connection, "error", Map.of("message", "Invalid message"));
        } catch (DeviceNotFoundException e) {
            hub.sendTo(connection, "error", Map.of("message", "Device not found", "device_id", e.getDeviceId()));
        } catch (RuntimeException e) {
            log.error("Admin frame failed: connectionId={}, type={}", connection.id(), type, e);
            hub.sendTo(connection, "error", Map.of("message", "Internal server error"));
        }
    }

    private Map<String, Object> payload(JsonNode data, String field) {
        if (data == null || !data.hasNonNull(field)) {
            return Map.of();
        }
        return objectMapper.convertValue(data.get(field), PAYLOAD_TYPE);
    }

    private static AuthenticatedPrincipal principal(WebSocketSession session) {
        return (AuthenticatedPrincipal) session.getAttributes().get(AdminHandshakeInterceptor.PRINCIPAL_ATTRIBUTE);
    }

    private static String text(JsonNode data, String... fields) {
        if (data == null) {
            return null;
        }
        for (String field : fields) {
            if (data.hasNonNull(field)) {
                return data.get(field).asText();
            }
        }
        return null;
    }

    private static String requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }
        return deviceId;
    }
}
