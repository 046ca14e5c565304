package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record RoleAssignmentLogResponse(
        UUID id,
        UUID roleId,
        String roleName,
        UUID userId,
        UUID modifiedBy,
        String action,
        List<String> previousPermissions,
        List<String> newPermissions,
        String reason,
        OffsetDateTime effectiveDate,
        OffsetDateTime expiryDate,
        OffsetDateTime createdAt
) {
}
