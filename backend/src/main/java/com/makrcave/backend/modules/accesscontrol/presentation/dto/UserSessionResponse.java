package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserSessionResponse(
        UUID id,
        UUID userId,
        String ipAddress,
        String userAgent,
        String location,
        boolean active,
        boolean expired,
        OffsetDateTime lastActivity,
        OffsetDateTime expiresAt,
        boolean twoFactorVerified,
        String loginMethod,
        String deviceFingerprint,
        OffsetDateTime createdAt,
        OffsetDateTime endedAt,
        String endReason
) {
}
