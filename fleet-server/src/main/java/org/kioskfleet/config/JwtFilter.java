package org.kioskfleet.config;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.exception.AuthenticationException;
import org.kioskfleet.service.IAuthenticationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import java.io.IOException;
import java.util.Arrays;

/**
 * Authenticates every /api request. Operators present a bearer token (header
 * or AUTH_TOKEN cookie); devices posting heartbeats present the shared device
 * key in X-Device-Key. The resolved principal is stored under the
 * {@value #PRINCIPAL_ATTRIBUTE} request attribute.
 */
@Component
public class JwtFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(JwtFilter.class);

    public static final String PRINCIPAL_ATTRIBUTE = "principal";
    public static final String DEVICE_KEY_HEADER = "X-Device-Key";
    public static final String AUTH_COOKIE = "AUTH_TOKEN";

    private static final String[] PUBLIC_URLS = {
            "/api/health"
    };

    private static final String[] DEVICE_URLS = {
            "/api/devices/*/heartbeat"
    };

    private final IAuthenticationService authenticationService;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public JwtFilter(IAuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        String path = request.getRequestURI().substring(request.getContextPath().length());

        if (matches(PUBLIC_URLS, path)) {
            chain.doFilter(request, response);
            return;
        }

        if (matches(DEVICE_URLS, path) && "POST".equalsIgnoreCase(request.getMethod())) {
            if (authenticationService.authenticateDevice(request.getHeader(DEVICE_KEY_HEADER))) {
                chain.doFilter(request, response);
            } else {
                log.warn("Rejected device request: path={}, reason=bad device key", path);
                unauthorized(response, "Invalid device key");
            }
            return;
        }

        String token = getToken(request);
        try {
            AuthenticatedPrincipal principal = authenticationService.authenticate(token);
            request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        } catch (AuthenticationException e) {
            log.debug("Rejected request: path={}, reason={}", path, e.getMessage());
            unauthorized(response, e.getMessage());
            return;
        }
        chain.doFilter(request, response);
    }

    private String getToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith("Bearer ")) {
            return header.substring("Bearer ".length());
        }
        if (request.getCookies() == null) return null;

        return Arrays.stream(request.getCookies())
                .filter(c -> AUTH_COOKIE.equals(c.getName()))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);
    }

    private boolean matches(String[] patterns, String path) {
        for (String pattern : patterns) {
            if (pathMatcher.match(pattern, path)) return true;
        }
        return false;
    }

    private void unauthorized(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"" + message.replace("\"", "'") + "\"}");
    }
}
