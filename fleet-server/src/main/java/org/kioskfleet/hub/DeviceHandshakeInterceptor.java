package org.kioskfleet.hub;

import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.service.IAuthenticationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * Binds a device connection to its device id, taken from the last path
 * segment of {@code /ws/devices/{deviceId}}. The device must be registered
 * and, when configured, present the shared device key.
 */
@Component
public class DeviceHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(DeviceHandshakeInterceptor.class);

    static final String DEVICE_ID_ATTRIBUTE = "deviceId";

    private final IAuthenticationService authenticationService;
    private final DeviceRepository deviceRepository;

    public DeviceHandshakeInterceptor(IAuthenticationService authenticationService,
                                      DeviceRepository deviceRepository) {
        this.authenticationService = authenticationService;
        this.deviceRepository = deviceRepository;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        UriComponents uri = UriComponentsBuilder.fromUri(request.getURI()).build();
        List<String> segments = uri.getPathSegments();
        String deviceId = segments.isEmpty() ? null : segments.get(segments.size() - 1);
        if (deviceId == null || deviceId.isBlank() || "devices".equals(deviceId)) {
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }

        String key = request.getHeaders().getFirst("X-Device-Key");
        if (key == null) {
            key = uri.getQueryParams().getFirst("key");
        }
        if (!authenticationService.authenticateDevice(key)) {
            log.warn("Device handshake rejected: deviceId={}, reason=bad device key", deviceId);
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        if (!deviceRepository.existsByDeviceId(deviceId)) {
            log.warn("Device handshake rejected: deviceId={}, reason=not registered", deviceId);
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }

        attributes.put(DEVICE_ID_ATTRIBUTE, deviceId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
