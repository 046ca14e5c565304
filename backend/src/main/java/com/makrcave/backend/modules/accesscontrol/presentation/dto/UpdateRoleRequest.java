package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} leaves a field unchanged. {@code clearParentRole} detaches the
 * parent, since a {@code null} parent id cannot express that.
 */
public record UpdateRoleRequest(
        @Size(min = 1, max = 100) String name,
        String description,
        Boolean active,
        Boolean assignable,
        @Positive Integer maxAssignments,
        Boolean defaultRole,
        @Min(0) @Max(1000) Integer priorityLevel,
        UUID parentRoleId,
        Boolean clearParentRole,
        @Positive @Max(43200) Integer sessionTimeoutMinutes,
        List<String> allowedIpRanges,
        Boolean requiresTwoFactor,
        @Positive @Max(100) Integer maxConcurrentSessions,
        Map<String, Object> featureFlags,
        Map<String, Object> dashboardConfig,
        Map<String, Object> menuRestrictions,
        List<String> requiredMembershipPlans,
        List<String> excludedMembershipPlans,
        List<UUID> permissionIds
) {
}
