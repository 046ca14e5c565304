package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;

public record RoleImportResponse(
        List<String> created,
        List<String> updated,
        List<String> errors
) {
}
