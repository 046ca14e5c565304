package com.makrcave.backend.modules.accesscontrol.domain;

public enum RoleAssignmentAction {
    ASSIGNED,
    REVOKED
}
