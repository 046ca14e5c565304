package com.makrcave.backend.modules.accesscontrol.application;

import static com.makrcave.backend.support.AccessControlFixtures.member;
import static com.makrcave.backend.support.AccessControlFixtures.permission;
import static com.makrcave.backend.support.AccessControlFixtures.role;
import static com.makrcave.backend.support.AccessControlFixtures.systemRole;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService.AssignRoleCommand;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentAction;
import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentLog;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyResolver;
import com.makrcave.backend.modules.accesscontrol.domain.RoleType;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleAssignmentLogRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleAssignmentLogResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RoleAssignmentServiceTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private RoleAssignmentLogRepository roleAssignmentLogRepository;

    @Mock
    private AuditLogService auditLogService;

    private RoleAssignmentService roleAssignmentService;

    private Member member;
    private Role staff;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        roleAssignmentService = new RoleAssignmentService(
                memberRepository,
                roleRepository,
                roleAssignmentLogRepository,
                new RoleHierarchyResolver(RoleHierarchyResolver.DEFAULT_MAX_DEPTH),
                auditLogService,
                clock
        );
        member = member("maker@example.com");
        staff = role("Staff", permission("view_members"));
        staff.setPriorityLevel(500);
    }

    @Test
    @DisplayName("assigning records one ledger entry with before and after snapshots")
    void assignWritesLedgerEntry() {
        Role maker = role("Maker", permission("view_equipment"));
        member.addRole(maker);
        stubLookups(member, staff);
        when(roleRepository.countHolders(staff.getId())).thenReturn(0L);
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        RoleAssignmentLogResponse response = roleAssignmentService.assign(command("onboarding"));

        assertThat(member.holdsRole(staff)).isTrue();
        assertThat(response.action()).isEqualTo("assigned");
        assertThat(response.reason()).isEqualTo("onboarding");
        assertThat(response.previousPermissions()).containsExactly("view_equipment");
        assertThat(response.newPermissions()).containsExactly("view_equipment", "view_members");
        assertThat(response.effectiveDate()).isEqualTo(NOW);
        assertThat(response.modifiedBy()).isEqualTo(ADMIN_ID);

        ArgumentCaptor<RoleAssignmentLog> captor = ArgumentCaptor.forClass(RoleAssignmentLog.class);
        verify(roleAssignmentLogRepository).save(captor.capture());
        assertThat(captor.getValue().getAction()).isEqualTo(RoleAssignmentAction.ASSIGNED);
        assertThat(captor.getValue().getRoleName()).isEqualTo("Staff");
        verify(memberRepository).saveAndFlush(member);
        verify(auditLogService).record(any(AuditLogService.AuditLogCommand.class));
    }

    @Test
    @DisplayName("a second assignment of the same role fails without another ledger entry")
    void secondAssignmentIsRejected() {
        stubLookups(member, staff);
        when(roleRepository.countHolders(staff.getId())).thenReturn(0L, 1L);
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        roleAssignmentService.assign(command(null));

        assertThatThrownBy(() -> roleAssignmentService.assign(command(null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.role_already_assigned"));
        verify(roleAssignmentLogRepository, times(1)).save(any(RoleAssignmentLog.class));
    }

    @Test
    void roleAtItsCapIsNotAssignable() {
        staff.setMaxAssignments(2);
        List<Member> members = List.of(member("a@example.com"), member("b@example.com"), member("c@example.com"));
        for (Member candidate : members) {
            when(memberRepository.findByIdForUpdate(candidate.getId())).thenReturn(Optional.of(candidate));
        }
        when(roleRepository.findByIdForUpdate(staff.getId())).thenReturn(Optional.of(staff));
        when(roleRepository.countHolders(staff.getId())).thenReturn(0L, 1L, 2L);
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        roleAssignmentService.assign(commandFor(members.get(0)));
        roleAssignmentService.assign(commandFor(members.get(1)));

        assertThatThrownBy(() -> roleAssignmentService.assign(commandFor(members.get(2))))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.role_not_assignable"));
        assertThat(members.get(2).holdsRole(staff)).isFalse();
        verify(roleAssignmentLogRepository, times(2)).save(any(RoleAssignmentLog.class));
    }

    @Test
    void inactiveRoleIsNotAssignable() {
        staff.setActive(false);
        stubLookups(member, staff);
        when(roleRepository.countHolders(staff.getId())).thenReturn(0L);

        assertThatThrownBy(() -> roleAssignmentService.assign(command(null)))
                .isInstanceOf(ProblemException.class);
        verify(memberRepository, never()).saveAndFlush(any());
        verify(auditLogService, never()).record(any());
    }

    @Test
    void unknownMemberIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(memberRepository.findByIdForUpdate(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> roleAssignmentService.assign(
                new AssignRoleCommand(unknown, staff.getId(), ADMIN_ID, false, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.member_not_found"));
    }

    @Test
    @DisplayName("only a super admin may hand out a super admin role")
    void superAdminRoleNeedsSuperAdminActor() {
        Role superAdmin = systemRole("Super Admin", RoleType.SUPER_ADMIN);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(roleRepository.findByIdForUpdate(superAdmin.getId())).thenReturn(Optional.of(superAdmin));

        assertThatThrownBy(() -> roleAssignmentService.assign(
                new AssignRoleCommand(member.getId(), superAdmin.getId(), member.getId(), false, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.forbidden"));
        assertThat(member.holdsRole(superAdmin)).isFalse();
        verify(memberRepository, never()).saveAndFlush(any());
        verify(roleAssignmentLogRepository, never()).save(any());
    }

    @Test
    void superAdminMayAssignSuperAdminRole() {
        Role superAdmin = systemRole("Super Admin", RoleType.SUPER_ADMIN);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(roleRepository.findByIdForUpdate(superAdmin.getId())).thenReturn(Optional.of(superAdmin));
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        RoleAssignmentLogResponse response = roleAssignmentService.assign(
                new AssignRoleCommand(member.getId(), superAdmin.getId(), ADMIN_ID, true, null, null, null));

        assertThat(response.action()).isEqualTo("assigned");
        assertThat(member.holdsRole(superAdmin)).isTrue();
    }

    @Test
    @DisplayName("revoking drops the role's permissions and records a revoked entry")
    void revokeWritesLedgerEntry() {
        member.addRole(staff);
        stubLookups(member, staff);
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        RoleAssignmentLogResponse response = roleAssignmentService.revoke(member.getId(), staff.getId(), ADMIN_ID, "offboarding");

        assertThat(member.holdsRole(staff)).isFalse();
        assertThat(response.action()).isEqualTo("revoked");
        assertThat(response.previousPermissions()).containsExactly("view_members");
        assertThat(response.newPermissions()).isEmpty();
    }

    @Test
    void revokeKeepsPermissionsGrantedByAnotherRole() {
        Role supervisor = role("Supervisor", permission("view_members"));
        member.addRole(staff);
        member.addRole(supervisor);
        stubLookups(member, staff);
        when(roleAssignmentLogRepository.save(any(RoleAssignmentLog.class))).thenAnswer(inv -> inv.getArgument(0));

        RoleAssignmentLogResponse response = roleAssignmentService.revoke(member.getId(), staff.getId(), ADMIN_ID, null);

        assertThat(response.newPermissions()).containsExactly("view_members");
    }

    @Test
    void revokingARoleThatIsNotHeldIsNotFound() {
        stubLookups(member, staff);

        assertThatThrownBy(() -> roleAssignmentService.revoke(member.getId(), staff.getId(), ADMIN_ID, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.role_not_assigned"));
        verify(roleAssignmentLogRepository, never()).save(any());
    }

    private void stubLookups(Member target, Role role) {
        when(memberRepository.findByIdForUpdate(target.getId())).thenReturn(Optional.of(target));
        when(roleRepository.findByIdForUpdate(role.getId())).thenReturn(Optional.of(role));
    }

    private AssignRoleCommand command(String reason) {
        return new AssignRoleCommand(member.getId(), staff.getId(), ADMIN_ID, false, reason, null, null);
    }

    private AssignRoleCommand commandFor(Member target) {
        return new AssignRoleCommand(target.getId(), staff.getId(), ADMIN_ID, false, null, null, null);
    }
}
