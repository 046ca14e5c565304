package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogResponse(
        UUID id,
        String actionType,
        String resourceType,
        String resourceKey,
        UUID actorUserId,
        UUID makerspaceId,
        UUID sessionId,
        String ipAddress,
        String userAgent,
        boolean success,
        String failureReason,
        UUID correlationId,
        Map<String, Object> detail,
        OffsetDateTime createdAt
) {
}
