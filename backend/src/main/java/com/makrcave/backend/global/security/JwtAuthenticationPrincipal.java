package com.makrcave.backend.global.security;

import java.util.Set;
import java.util.UUID;

/**
 * Authenticated caller as asserted by the bearer token.
 *
 * @param userId       member id of the caller
 * @param role         primary role code ({@code super_admin}, {@code makerspace_admin}, {@code staff}, ...)
 * @param makerspaceId tenant of the caller, {@code null} for platform operators
 * @param permissions  explicit capability codes granted to the caller
 */
public record JwtAuthenticationPrincipal(UUID userId, String role, UUID makerspaceId, Set<String> permissions) {

    public static final String SUPER_ADMIN_ROLE = "super_admin";

    public JwtAuthenticationPrincipal {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public boolean isSuperAdmin() {
        return SUPER_ADMIN_ROLE.equalsIgnoreCase(role);
    }

    public boolean holdsPermission(String code) {
        return permissions.contains(code);
    }
}
