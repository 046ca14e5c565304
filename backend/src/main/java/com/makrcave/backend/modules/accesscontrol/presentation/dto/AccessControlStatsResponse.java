package com.makrcave.backend.modules.accesscontrol.presentation.dto;

public record AccessControlStatsResponse(
        long totalUsers,
        long activeUsers,
        long lockedUsers,
        long usersRequiringPasswordChange,
        long usersWithTwoFactor,
        long totalRoles,
        long systemRoles,
        long customRoles,
        long totalPermissions,
        long activeSessions,
        long recentLoginAttempts,
        long failedLoginAttempts
) {
}
