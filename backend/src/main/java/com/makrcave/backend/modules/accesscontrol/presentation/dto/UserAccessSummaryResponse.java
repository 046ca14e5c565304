package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record UserAccessSummaryResponse(
        UUID userId,
        String userEmail,
        String userName,
        List<RoleSummaryResponse> roles,
        List<String> permissions,
        long activeSessions,
        OffsetDateTime lastLogin,
        boolean accountLocked,
        OffsetDateTime accountLockedUntil,
        OffsetDateTime passwordExpiresAt,
        boolean requiresPasswordChange,
        boolean twoFactorEnabled,
        Map<String, Object> featureFlags,
        Map<String, Object> dashboardConfig,
        Map<String, Object> menuRestrictions
) {
}
