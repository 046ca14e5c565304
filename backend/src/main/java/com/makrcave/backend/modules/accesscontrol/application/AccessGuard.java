package com.makrcave.backend.modules.accesscontrol.application;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;

/**
 * Capability checks for the access control endpoints.
 * <p>
 * A super admin may do everything. Anyone else needs the capability in the token's permission
 * list, or a primary role whose implied capabilities include it.
 */
@Component
public class AccessGuard {

    public static final String VIEW_MEMBERS = "view_members";
    public static final String CREATE_MEMBERS = "create_members";
    public static final String EDIT_MEMBERS = "edit_members";
    public static final String SUSPEND_MEMBERS = "suspend_members";
    public static final String VIEW_ROLES = "view_roles";
    public static final String MANAGE_ROLES = "manage_roles";
    public static final String VIEW_PERMISSIONS = "view_permissions";
    public static final String MANAGE_PERMISSIONS = "manage_permissions";
    public static final String VIEW_SESSIONS = "view_sessions";
    public static final String MANAGE_SESSIONS = "manage_sessions";
    public static final String VIEW_SETTINGS = "view_settings";
    public static final String MANAGE_SETTINGS = "manage_settings";
    public static final String VIEW_ANALYTICS = "view_analytics";
    public static final String VIEW_AUDIT_LOGS = "view_audit_logs";
    public static final String VIEW_SECURITY_ALERTS = "view_security_alerts";
    public static final String EXPORT_ROLES = "export_roles";

    private static final Map<String, Set<String>> IMPLIED_BY_PRIMARY_ROLE = Map.of(
            "makerspace_admin", Set.of(
                    VIEW_MEMBERS, CREATE_MEMBERS, EDIT_MEMBERS, SUSPEND_MEMBERS,
                    VIEW_ROLES, MANAGE_ROLES,
                    VIEW_SESSIONS, MANAGE_SESSIONS,
                    VIEW_SETTINGS, MANAGE_SETTINGS,
                    VIEW_ANALYTICS, EXPORT_ROLES
            ),
            "staff", Set.of(
                    VIEW_MEMBERS, CREATE_MEMBERS, EDIT_MEMBERS,
                    VIEW_SESSIONS, VIEW_SETTINGS
            )
    );

    public boolean isAllowed(JwtAuthenticationPrincipal principal, String capability) {
        Objects.requireNonNull(capability, "capability is required");
        if (principal == null) {
            return false;
        }
        if (principal.isSuperAdmin() || principal.holdsPermission(capability)) {
            return true;
        }
        String primaryRole = principal.role() == null ? "" : principal.role().toLowerCase();
        return IMPLIED_BY_PRIMARY_ROLE.getOrDefault(primaryRole, Set.of()).contains(capability);
    }

    public void require(JwtAuthenticationPrincipal principal, String capability) {
        if (!isAllowed(principal, capability)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Insufficient permissions: " + capability + " required");
        }
    }

    public void requireSuperAdmin(JwtAuthenticationPrincipal principal) {
        if (principal == null || !principal.isSuperAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden", "Super admin access required");
        }
    }

    /**
     * Allows the caller on their own record, otherwise requires {@code capability}.
     */
    public void requireSelfOr(JwtAuthenticationPrincipal principal, UUID userId, String capability) {
        if (principal != null && principal.userId() != null && principal.userId().equals(userId)) {
            return;
        }
        require(principal, capability);
    }

    /**
     * Non super admins may only act inside their own makerspace. Global resources
     * ({@code makerspaceId == null}) are reserved to super admins.
     */
    public void requireMakerspaceAccess(JwtAuthenticationPrincipal principal, UUID makerspaceId) {
        if (principal != null && principal.isSuperAdmin()) {
            return;
        }
        if (principal == null || makerspaceId == null || !makerspaceId.equals(principal.makerspaceId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Resource belongs to another makerspace");
        }
    }

    /**
     * Makerspace a listing should be restricted to: the caller's own unless they are a super admin,
     * in which case the requested one (possibly {@code null} for all).
     */
    public UUID scopeMakerspace(JwtAuthenticationPrincipal principal, UUID requested) {
        if (principal != null && principal.isSuperAdmin()) {
            return requested;
        }
        return principal != null ? principal.makerspaceId() : null;
    }
}
