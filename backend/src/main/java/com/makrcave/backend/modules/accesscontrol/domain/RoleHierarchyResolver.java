package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves effective permissions along parent-role chains.
 * <p>
 * The walk is iterative and remembers every role it has visited, so a cyclic chain ends as soon as
 * it returns to a known role (that role's permissions are already in the result). Chains longer than
 * {@code maxDepth} parent hops raise {@link RoleHierarchyDepthExceededException}.
 */
@Component
public class RoleHierarchyResolver {

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final int maxDepth;

    public RoleHierarchyResolver(@Value("${makrcave.access-control.max-hierarchy-depth:50}") int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1");
        }
        this.maxDepth = maxDepth;
    }

    public Set<Permission> effectivePermissions(Role role) {
        Set<Permission> result = new LinkedHashSet<>();
        Set<Object> visited = new HashSet<>();
        Role current = role;
        int hops = 0;
        while (current != null && visited.add(keyOf(current))) {
            if (hops > maxDepth) {
                throw new RoleHierarchyDepthExceededException(role.getId(), maxDepth);
            }
            result.addAll(current.getPermissions());
            current = current.getParentRole();
            hops++;
        }
        return result;
    }

    public SortedSet<String> effectivePermissionCodes(Role role) {
        SortedSet<String> codes = new TreeSet<>();
        for (Permission permission : effectivePermissions(role)) {
            codes.add(permission.getCodename());
        }
        return codes;
    }

    /**
     * Union of the effective permission codes of every given role, sorted for stable snapshots.
     */
    public SortedSet<String> effectivePermissionCodes(Collection<Role> roles) {
        SortedSet<String> codes = new TreeSet<>();
        for (Role role : roles) {
            codes.addAll(effectivePermissionCodes(role));
        }
        return codes;
    }

    /**
     * Whether pointing {@code role} at {@code proposedParent} would put {@code role} on its own parent chain.
     */
    public boolean wouldCreateCycle(Role role, Role proposedParent) {
        Object target = keyOf(role);
        Set<Object> visited = new HashSet<>();
        Role current = proposedParent;
        int hops = 0;
        while (current != null && visited.add(keyOf(current))) {
            if (target.equals(keyOf(current))) {
                return true;
            }
            if (hops > maxDepth) {
                throw new RoleHierarchyDepthExceededException(proposedParent.getId(), maxDepth);
            }
            current = current.getParentRole();
            hops++;
        }
        return false;
    }

    /**
     * Checks the chain {@code role} would have under {@code proposedParent} without re-parenting it.
     */
    public void verifyDepth(Role role, Role proposedParent) {
        Set<Object> visited = new HashSet<>();
        visited.add(keyOf(role));
        Role current = proposedParent;
        int hops = 1;
        while (current != null && visited.add(keyOf(current))) {
            if (hops > maxDepth) {
                throw new RoleHierarchyDepthExceededException(role.getId(), maxDepth);
            }
            current = current.getParentRole();
            hops++;
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    // unsaved roles have no id yet; fall back to object identity
    private static Object keyOf(Role role) {
        return role.getId() != null ? role.getId() : new IdentityKey(role);
    }

    private record IdentityKey(Role role) {

        @Override
        public boolean equals(Object other) {
            return other instanceof IdentityKey key && key.role == role;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(role);
        }
    }
}
