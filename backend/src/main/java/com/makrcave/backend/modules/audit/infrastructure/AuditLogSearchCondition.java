package com.makrcave.backend.modules.audit.infrastructure;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AuditLogSearchCondition(
        UUID actorUserId,
        UUID makerspaceId,
        String actionType,
        String resourceType,
        OffsetDateTime from,
        OffsetDateTime to,
        Boolean success,
        String ipAddress
) {
}
