package org.kioskfleet.service.imp;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.exception.AuthenticationException;
import org.kioskfleet.service.IAuthenticationService;
import org.kioskfleet.utils.JwtUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Service
public class JwtAuthenticationService implements IAuthenticationService {

    private final String jwtKey;
    private final String deviceApiKey;

    public JwtAuthenticationService(@Value("${jwt.secret-key}") String jwtKey,
                                    @Value("${fleet.device.api-key:}") String deviceApiKey) {
        this.jwtKey = jwtKey;
        this.deviceApiKey = deviceApiKey;
    }

    @Override
    public AuthenticatedPrincipal authenticate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException("Access token required");
        }
        Claims claims;
        try {
            claims = JwtUtil.extractAllClaims(credential.trim(), jwtKey);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid or expired token", e);
        }
        String userId = claims.getSubject();
        String role = claims.get(JwtUtil.CLAIM_ROLE, String.class);
        if (userId == null || role == null) {
            throw new AuthenticationException("Token is missing subject or role");
        }
        return new AuthenticatedPrincipal(userId, claims.get(JwtUtil.CLAIM_USERNAME, String.class), role);
    }

    @Override
    public boolean authorize(AuthenticatedPrincipal principal, String... roles) {
        if (principal == null) {
            return false;
        }
        if (roles == null || roles.length == 0) {
            return true;
        }
        for (String role : roles) {
            if (role.equalsIgnoreCase(principal.role())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean authenticateDevice(String apiKey) {
        if (deviceApiKey == null || deviceApiKey.isBlank()) {
            return true;
        }
        if (apiKey == null) {
            return false;
        }
        return MessageDigest.isEqual(deviceApiKey.getBytes(StandardCharsets.UTF_8),
                apiKey.getBytes(StandardCharsets.UTF_8));
    }
}
