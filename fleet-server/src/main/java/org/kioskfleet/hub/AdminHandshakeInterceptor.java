package org.kioskfleet.hub;

import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.exception.AuthenticationException;
import org.kioskfleet.service.IAuthenticationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates administrator consoles before the upgrade. The token comes
 * from the Authorization header or, for browsers, the {@code token} query
 * parameter; role admin or manager is required.
 */
@Component
public class AdminHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminHandshakeInterceptor.class);

    static final String PRINCIPAL_ATTRIBUTE = "principal";

    private final IAuthenticationService authenticationService;

    public AdminHandshakeInterceptor(IAuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        AuthenticatedPrincipal principal;
        try {
            principal = authenticationService.authenticate(token(request));
        } catch (AuthenticationException e) {
            log.warn("Admin handshake rejected: remote={}, reason={}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        if (!authenticationService.authorize(principal, AuthenticatedPrincipal.ROLE_ADMIN,
                AuthenticatedPrincipal.ROLE_MANAGER)) {
            log.warn("Admin handshake rejected: user={}, role={}", principal.username(), principal.role());
            response.setStatusCode(HttpStatus.FORBIDDEN);
            return false;
        }
        attributes.put(PRINCIPAL_ATTRIBUTE, principal);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private static String token(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst("Authorization");
        if (header != null && header.startsWith("Bearer ")) {
            return header.substring("Bearer ".length());
        }
        return UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
    }
}
