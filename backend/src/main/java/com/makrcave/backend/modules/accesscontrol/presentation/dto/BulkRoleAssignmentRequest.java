package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record BulkRoleAssignmentRequest(
        @NotEmpty @Size(max = 500) List<UUID> userIds,
        @NotEmpty @Size(max = 50) List<UUID> roleIds,
        @NotBlank @Pattern(regexp = "^(assign|revoke)$", message = "action must be assign or revoke") String action,
        @Size(max = 1000) String reason,
        OffsetDateTime effectiveDate,
        OffsetDateTime expiryDate
) {
}
