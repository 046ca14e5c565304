package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record RoleExportResponse(
        String format,
        OffsetDateTime exportedAt,
        int totalRoles,
        List<RoleExportEntry> data
) {
}
