package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.makrcave.backend.modules.accesscontrol.domain.Role;

public interface RoleRepositoryCustom {

    List<Role> searchRoles(RoleSearchCondition condition);

    /**
     * Counts roles visible to a makerspace (its own plus global ones), or all roles when
     * {@code makerspaceId} is {@code null}.
     */
    long countRoles(UUID makerspaceId, Boolean system);
}
