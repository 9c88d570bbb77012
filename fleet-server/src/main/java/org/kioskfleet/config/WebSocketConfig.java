package org.kioskfleet.config;

import org.kioskfleet.hub.AdminHandshakeInterceptor;
import org.kioskfleet.hub.AdminSocketHandler;
import org.kioskfleet.hub.DeviceHandshakeInterceptor;
import org.kioskfleet.hub.DeviceSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Plain WebSocket endpoints for the real-time hub: one for administrator
 * consoles, one per device.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AdminSocketHandler adminSocketHandler;
    private final DeviceSocketHandler deviceSocketHandler;
    private final AdminHandshakeInterceptor adminHandshakeInterceptor;
    private final DeviceHandshakeInterceptor deviceHandshakeInterceptor;

    public WebSocketConfig(AdminSocketHandler adminSocketHandler,
                           DeviceSocketHandler deviceSocketHandler,
                           AdminHandshakeInterceptor adminHandshakeInterceptor,
                           DeviceHandshakeInterceptor deviceHandshakeInterceptor) {
        this.adminSocketHandler = adminSocketHandler;
        this.deviceSocketHandler = deviceSocketHandler;
        this.adminHandshakeInterceptor = adminHandshakeInterceptor;
        this.deviceHandshakeInterceptor = deviceHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(adminSocketHandler, "/ws/admin")
                .addInterceptors(adminHandshakeInterceptor)
                .setAllowedOriginPatterns("*"); // Allow all origins for dev - restrict in prod

        registry.addHandler(deviceSocketHandler, "/ws/devices/*")
                .addInterceptors(deviceHandshakeInterceptor)
                .setAllowedOriginPatterns("*");
    }
}
