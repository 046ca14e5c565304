package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssignRoleRequest(
        @NotNull UUID userId,
        @Size(max = 1000) String reason,
        OffsetDateTime effectiveDate,
        OffsetDateTime expiryDate
) {
}
