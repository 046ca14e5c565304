package com.makrcave.backend.modules.accesscontrol.domain;

import static com.makrcave.backend.support.AccessControlFixtures.permission;
import static com.makrcave.backend.support.AccessControlFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoleHierarchyResolverTest {

    private final RoleHierarchyResolver resolver = new RoleHierarchyResolver(RoleHierarchyResolver.DEFAULT_MAX_DEPTH);

    @Test
    @DisplayName("effective permissions are the union over the whole parent chain")
    void unionOverParentChain() {
        Role root = role("Root", permission("view_members"));
        Role middle = role("Middle", permission("edit_members"));
        Role leaf = role("Leaf", permission("manage_inventory"));
        middle.setParentRole(root);
        leaf.setParentRole(middle);

        assertThat(resolver.effectivePermissionCodes(leaf))
                .containsExactly("edit_members", "manage_inventory", "view_members");
        assertThat(resolver.effectivePermissionCodes(root)).containsExactly("view_members");
    }

    @Test
    void duplicatePermissionsAcrossChainAreCollapsed() {
        Permission shared = permission("view_members");
        Role parent = role("Parent", shared);
        Role child = role("Child", shared, permission("edit_members"));
        child.setParentRole(parent);

        assertThat(resolver.effectivePermissions(child)).hasSize(2);
    }

    @Test
    @DisplayName("a cycle in the parent chain terminates with a finite set")
    void cycleTerminates() {
        Role first = role("First", permission("view_members"));
        Role second = role("Second", permission("edit_members"));
        first.setParentRole(second);
        second.setParentRole(first);

        assertThat(resolver.effectivePermissionCodes(first)).containsExactly("edit_members", "view_members");
    }

    @Test
    void selfParentTerminates() {
        Role role = role("Loop", permission("view_members"));
        role.setParentRole(role);

        assertThat(resolver.effectivePermissionCodes(role)).containsExactly("view_members");
    }

    @Test
    void chainAtMaximumDepthResolves() {
        List<Role> chain = chain(RoleHierarchyResolver.DEFAULT_MAX_DEPTH + 1);

        assertThat(resolver.effectivePermissionCodes(chain.get(0))).hasSize(chain.size());
    }

    @Test
    void chainBeyondMaximumDepthIsRejected() {
        List<Role> chain = chain(RoleHierarchyResolver.DEFAULT_MAX_DEPTH + 2);

        assertThatThrownBy(() -> resolver.effectivePermissions(chain.get(0)))
                .isInstanceOf(RoleHierarchyDepthExceededException.class);
    }

    @Test
    @DisplayName("depth under a proposed parent is checked without re-parenting the role")
    void verifyDepthLeavesRoleUntouched() {
        Role candidate = role("Candidate");

        resolver.verifyDepth(candidate, chain(RoleHierarchyResolver.DEFAULT_MAX_DEPTH).get(0));
        resolver.verifyDepth(candidate, null);

        List<Role> tooLong = chain(RoleHierarchyResolver.DEFAULT_MAX_DEPTH + 1);
        assertThatThrownBy(() -> resolver.verifyDepth(candidate, tooLong.get(0)))
                .isInstanceOf(RoleHierarchyDepthExceededException.class);
        assertThat(candidate.getParentRole()).isNull();
    }

    @Test
    void detectsCycleBeforeParentIsSet() {
        Role grandParent = role("GrandParent");
        Role parent = role("Parent");
        Role child = role("Child");
        parent.setParentRole(grandParent);
        child.setParentRole(parent);

        assertThat(resolver.wouldCreateCycle(grandParent, child)).isTrue();
        assertThat(resolver.wouldCreateCycle(grandParent, grandParent)).isTrue();
        assertThat(resolver.wouldCreateCycle(child, grandParent)).isFalse();
    }

    @Test
    void unionOfSeveralRoles() {
        Role staff = role("Staff", permission("view_members"));
        Role billing = role("Billing", permission("view_billing"));

        assertThat(resolver.effectivePermissionCodes(List.of(staff, billing)))
                .containsExactly("view_billing", "view_members");
        assertThat(resolver.effectivePermissionCodes(List.of())).isEmpty();
    }

    private static List<Role> chain(int length) {
        List<Role> roles = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            Role role = role("Level " + i, permission("perm_" + i));
            if (!roles.isEmpty()) {
                roles.get(roles.size() - 1).setParentRole(role);
            }
            roles.add(role);
        }
        return roles;
    }
}
