package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoleExportEntry(
        @JsonUnwrapped RoleResponse role,
        List<PermissionDetail> permissionDetails,
        List<RoleHolder> users
) {

    public record PermissionDetail(String codename, String name, String description) {
    }

    public record RoleHolder(UUID id, String email, String name) {
    }
}
