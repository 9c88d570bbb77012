package org.kioskfleet.service;

import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.exception.AuthenticationException;
import org.kioskfleet.exception.ForbiddenException;

import java.util.Arrays;

/**
 * Verifies credentials issued elsewhere. Used by the REST filter and by the
 * WebSocket handshake interceptors.
 */
public interface IAuthenticationService {

    /**
     * @param credential Bearer token, without the "Bearer " prefix
     * @return The principal the token was issued to
     * @throws AuthenticationException if the token is missing, malformed, expired or badly signed
     */
    AuthenticatedPrincipal authenticate(String credential);

    boolean authorize(AuthenticatedPrincipal principal, String... roles);

    /**
     * Checks the shared key presented by devices. Always true when no key is configured.
     */
    boolean authenticateDevice(String apiKey);

    default void requireRole(AuthenticatedPrincipal principal, String... roles) {
        if (principal == null) {
            throw new AuthenticationException("Authentication required");
        }
        if (!authorize(principal, roles)) {
            throw new ForbiddenException("Requires role: " + String.join(" or ", Arrays.asList(roles)));
        }
    }
}
