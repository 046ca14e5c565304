package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

public record RoleSummaryResponse(
        UUID id,
        String name,
        String roleType,
        int priorityLevel,
        UUID makerspaceId,
        boolean active
) {
}
