package com.makrcave.backend.modules.accesscontrol.domain;

public enum AccessScope {
    GLOBAL,
    MAKERSPACE,
    SELF
}
