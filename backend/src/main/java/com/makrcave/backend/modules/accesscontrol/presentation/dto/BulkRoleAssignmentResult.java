package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkRoleAssignmentResult(
        UUID userId,
        UUID roleId,
        String action,
        boolean success,
        String error
) {
}
