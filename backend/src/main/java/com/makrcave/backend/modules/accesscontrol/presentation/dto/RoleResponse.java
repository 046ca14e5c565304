package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RoleResponse(
        UUID id,
        String name,
        String description,
        String roleType,
        boolean system,
        boolean active,
        boolean assignable,
        Integer maxAssignments,
        UUID makerspaceId,
        boolean defaultRole,
        int priorityLevel,
        UUID parentRoleId,
        int sessionTimeoutMinutes,
        List<String> allowedIpRanges,
        boolean requiresTwoFactor,
        int maxConcurrentSessions,
        Map<String, Object> featureFlags,
        Map<String, Object> dashboardConfig,
        Map<String, Object> menuRestrictions,
        List<String> requiredMembershipPlans,
        List<String> excludedMembershipPlans,
        List<String> permissions,
        List<String> effectivePermissions,
        long userCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        UUID createdBy,
        UUID lastModifiedBy
) {
}
