package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Partial update. The codename is intentionally absent: it is the stable key of a permission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdatePermissionRequest(
        @Size(min = 1, max = 100) String name,
        String description,
        Boolean active,
        Boolean requiresTwoFactor,
        List<String> resourceTypes,
        Map<String, Object> fieldRestrictions
) {
}
