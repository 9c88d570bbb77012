package org.kioskfleet.dto;

/**
 * Identity resolved from a bearer credential by the authentication service.
 * Roles follow the user directory: admin, manager, user.
 */
public record AuthenticatedPrincipal(String userId, String username, String role) {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_MANAGER = "manager";
    public static final String ROLE_USER = "user";
}
