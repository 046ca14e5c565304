package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateSessionRequest(
        @NotNull UUID userId,
        @NotBlank @Size(max = 255) String sessionToken,
        @Size(max = 45) String ipAddress,
        String userAgent,
        @Size(max = 255) String location,
        OffsetDateTime expiresAt,
        boolean twoFactorVerified,
        @Size(max = 50) String loginMethod,
        @Size(max = 255) String deviceFingerprint
) {
}
