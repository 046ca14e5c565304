package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionResponse(
        UUID id,
        String name,
        String codename,
        String description,
        String permissionType,
        String accessScope,
        boolean system,
        boolean active,
        boolean requiresTwoFactor,
        List<String> resourceTypes,
        Map<String, Object> fieldRestrictions,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        UUID createdBy
) {
}
