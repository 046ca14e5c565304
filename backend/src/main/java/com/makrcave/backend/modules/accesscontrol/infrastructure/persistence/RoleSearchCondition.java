package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.UUID;

import com.makrcave.backend.modules.accesscontrol.domain.RoleType;

/**
 * @param makerspaceId when set, roles of that makerspace plus global roles
 * @param includeGlobal whether global roles are listed alongside a makerspace's own roles
 */
public record RoleSearchCondition(
        RoleType roleType,
        Boolean active,
        Boolean assignable,
        UUID makerspaceId,
        boolean includeGlobal
) {
}
