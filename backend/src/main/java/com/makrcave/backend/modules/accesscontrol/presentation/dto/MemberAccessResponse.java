package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record MemberAccessResponse(
        UUID id,
        String email,
        String fullName,
        UUID makerspaceId,
        String primaryRole,
        boolean active,
        boolean accountLocked,
        int failedLoginAttempts,
        OffsetDateTime lastLogin,
        boolean twoFactorEnabled,
        boolean requiresPasswordChange,
        List<RoleSummaryResponse> roles
) {
}
