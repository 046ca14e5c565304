package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import com.makrcave.backend.modules.accesscontrol.domain.RoleType;

/**
 * New custom role. Permissions may be given by id, by codename, or both; the union is granted.
 */
public record CreateRoleRequest(
        @NotBlank @Size(max = 100) String name,
        String description,
        RoleType roleType,
        UUID makerspaceId,
        Boolean active,
        Boolean assignable,
        @Positive Integer maxAssignments,
        Boolean defaultRole,
        @Min(0) @Max(1000) Integer priorityLevel,
        UUID parentRoleId,
        @Positive @Max(43200) Integer sessionTimeoutMinutes,
        List<String> allowedIpRanges,
        Boolean requiresTwoFactor,
        @Positive @Max(100) Integer maxConcurrentSessions,
        Map<String, Object> featureFlags,
        Map<String, Object> dashboardConfig,
        Map<String, Object> menuRestrictions,
        List<String> requiredMembershipPlans,
        List<String> excludedMembershipPlans,
        List<UUID> permissionIds,
        List<String> permissionCodenames
) {
}
