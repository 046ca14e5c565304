package com.makrcave.backend.modules.accesscontrol.application;

/**
 * Action and resource type names written to the audit log by this module.
 */
final class AccessAuditActions {

    static final String PERMISSION_CREATE = "PERMISSION_CREATE";
    static final String PERMISSION_UPDATE = "PERMISSION_UPDATE";
    static final String PERMISSION_DELETE = "PERMISSION_DELETE";
    static final String ROLE_CREATE = "ROLE_CREATE";
    static final String ROLE_UPDATE = "ROLE_UPDATE";
    static final String ROLE_DELETE = "ROLE_DELETE";
    static final String ROLE_ASSIGN = "ROLE_ASSIGN";
    static final String ROLE_REVOKE = "ROLE_REVOKE";
    static final String ROLE_IMPORT = "ROLE_IMPORT";
    static final String SESSION_CREATE = "SESSION_CREATE";
    static final String SESSION_TERMINATE = "SESSION_TERMINATE";
    static final String SESSION_EXTEND = "SESSION_EXTEND";
    static final String SESSION_TERMINATE_ALL = "SESSION_TERMINATE_ALL";
    static final String ACCOUNT_LOCK = "ACCOUNT_LOCK";
    static final String ACCOUNT_UNLOCK = "ACCOUNT_UNLOCK";
    static final String PASSWORD_POLICY_CREATE = "PASSWORD_POLICY_CREATE";
    static final String PASSWORD_POLICY_UPDATE = "PASSWORD_POLICY_UPDATE";
    static final String DEFAULTS_SETUP = "DEFAULTS_SETUP";

    static final String RESOURCE_PERMISSION = "PERMISSION";
    static final String RESOURCE_ROLE = "ROLE";
    static final String RESOURCE_MEMBER = "MEMBER";
    static final String RESOURCE_SESSION = "USER_SESSION";
    static final String RESOURCE_PASSWORD_POLICY = "PASSWORD_POLICY";
    static final String RESOURCE_MAKERSPACE = "MAKERSPACE";

    private AccessAuditActions() {
    }
}
