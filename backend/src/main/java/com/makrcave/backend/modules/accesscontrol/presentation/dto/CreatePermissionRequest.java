package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import com.makrcave.backend.modules.accesscontrol.domain.AccessScope;
import com.makrcave.backend.modules.accesscontrol.domain.PermissionType;

public record CreatePermissionRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank
        @Size(max = 100)
        @Pattern(regexp = "^[a-z][a-z0-9_]*$", message = "codename must be lower snake case")
        String codename,
        String description,
        @NotNull PermissionType permissionType,
        AccessScope accessScope,
        Boolean active,
        Boolean requiresTwoFactor,
        List<String> resourceTypes,
        Map<String, Object> fieldRestrictions
) {
}
