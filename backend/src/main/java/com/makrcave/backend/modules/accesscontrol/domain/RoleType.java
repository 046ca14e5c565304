package com.makrcave.backend.modules.accesscontrol.domain;

public enum RoleType {
    SUPER_ADMIN,
    MAKERSPACE_ADMIN,
    STAFF,
    MEMBER,
    SERVICE_PROVIDER,
    GUEST,
    CUSTOM
}
