package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * @param skipInvalid {@code null} is treated as {@code true}
 */
public record RoleImportRequest(
        @NotNull List<@Valid CreateRoleRequest> roles,
        boolean updateExisting,
        Boolean skipInvalid
) {

    public boolean skipInvalidOrDefault() {
        return skipInvalid == null || skipInvalid;
    }
}
