package com.makrcave.backend.modules.member.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Filters for the member access listing. {@code now} is required whenever {@code hasActiveSession}
 * is set, since session liveness depends on it.
 */
public record MemberSearchCondition(
        List<UUID> memberIds,
        UUID makerspaceId,
        Boolean active,
        Boolean hasActiveSession,
        UUID roleId,
        String search,
        OffsetDateTime now
) {
}
