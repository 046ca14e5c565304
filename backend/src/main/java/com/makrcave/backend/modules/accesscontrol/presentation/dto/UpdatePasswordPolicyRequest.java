package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public record UpdatePasswordPolicyRequest(
        @Min(1) @Max(128) Integer minLength,
        @Min(8) @Max(512) Integer maxLength,
        Boolean requireUppercase,
        Boolean requireLowercase,
        Boolean requireNumbers,
        Boolean requireSpecialChars,
        @Size(min = 1, max = 100) String allowedSpecialChars,
        @Min(0) @Max(50) Integer preventReuseCount,
        @Min(0) @Max(365) Integer maxAgeDays,
        @Min(0) @Max(30) Integer warnBeforeExpiryDays,
        @Min(1) @Max(20) Integer maxFailedAttempts,
        @Min(1) @Max(1440) Integer lockoutDurationMinutes,
        Boolean progressiveLockout,
        Boolean requireTwoFactor,
        List<String> requireTwoFactorForRoles,
        List<String> allowedTwoFactorMethods,
        @Min(1) @Max(43200) Integer sessionTimeoutMinutes,
        @Min(1) @Max(1440) Integer idleTimeoutMinutes,
        @Min(1) @Max(20) Integer maxConcurrentSessions,
        Boolean forceLogoutOnPasswordChange,
        Boolean active
) {
}
