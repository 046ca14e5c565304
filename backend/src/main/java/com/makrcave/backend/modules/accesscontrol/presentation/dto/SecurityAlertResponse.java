package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record SecurityAlertResponse(
        UUID id,
        String alertType,
        String severity,
        String title,
        String description,
        String ipAddress,
        Map<String, Object> details,
        boolean resolved,
        OffsetDateTime firstSeenAt,
        OffsetDateTime lastSeenAt
) {
}
