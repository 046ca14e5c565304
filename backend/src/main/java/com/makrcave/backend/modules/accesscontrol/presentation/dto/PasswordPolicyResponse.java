package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record PasswordPolicyResponse(
        UUID id,
        UUID makerspaceId,
        int minLength,
        int maxLength,
        boolean requireUppercase,
        boolean requireLowercase,
        boolean requireNumbers,
        boolean requireSpecialChars,
        String allowedSpecialChars,
        int preventReuseCount,
        int maxAgeDays,
        int warnBeforeExpiryDays,
        int maxFailedAttempts,
        int lockoutDurationMinutes,
        boolean progressiveLockout,
        boolean requireTwoFactor,
        List<String> requireTwoFactorForRoles,
        List<String> allowedTwoFactorMethods,
        int sessionTimeoutMinutes,
        int idleTimeoutMinutes,
        int maxConcurrentSessions,
        boolean forceLogoutOnPasswordChange,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        UUID createdBy
) {
}
