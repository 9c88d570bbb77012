package org.kioskfleet.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Hub connection over a Spring WebSocket session. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} so a slow peer is bounded by a
 * send-time and buffer limit instead of stalling the broadcasting thread.
 */
public class WebSocketHubConnection implements HubConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketHubConnection.class);

    static final String SESSION_ATTRIBUTE = "hubConnection";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketHubConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    /**
     * Returns the connection bound to the session, creating it on first use.
     */
    public static HubConnection of(WebSocketSession session) {
        Object existing = session.getAttributes().get(SESSION_ATTRIBUTE);
        if (existing instanceof HubConnection connection) {
            return connection;
        }
        HubConnection connection = new WebSocketHubConnection(session);
        session.getAttributes().put(SESSION_ATTRIBUTE, connection);
        return connection;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close failed: connectionId={}, error={}", id(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketHubConnection[" + id() + "]";
    }
}
