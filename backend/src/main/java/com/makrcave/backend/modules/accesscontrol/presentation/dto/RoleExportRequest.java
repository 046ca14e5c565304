package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Pattern;

public record RoleExportRequest(
        @Pattern(regexp = "^(json|csv|xlsx)$", message = "format must be json, csv or xlsx") String format,
        Boolean includePermissions,
        Boolean includeUsers,
        UUID makerspaceId
) {
}
