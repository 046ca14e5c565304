package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.UUID;

/**
 * Raised when a parent-role chain is longer than the configured bound. This points at corrupt
 * or hostile role data and is never silently truncated.
 */
public class RoleHierarchyDepthExceededException extends RuntimeException {

    private final UUID roleId;
    private final int maxDepth;

    public RoleHierarchyDepthExceededException(UUID roleId, int maxDepth) {
        super("Parent chain of role " + roleId + " exceeds the maximum depth of " + maxDepth);
        this.roleId = roleId;
        this.maxDepth = maxDepth;
    }

    public UUID getRoleId() {
        return roleId;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
