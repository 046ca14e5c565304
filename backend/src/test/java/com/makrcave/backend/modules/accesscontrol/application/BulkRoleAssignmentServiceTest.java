package com.makrcave.backend.modules.accesscontrol.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService.AssignRoleCommand;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResult;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class BulkRoleAssignmentServiceTest {

    private static final UUID ADMIN_ID = UUID.randomUUID();
    private static final JwtAuthenticationPrincipal ADMIN = new JwtAuthenticationPrincipal(
            ADMIN_ID, "makerspace_admin", UUID.randomUUID(), Set.of("manage_roles"));

    @Mock
    private RoleAssignmentService roleAssignmentService;

    @InjectMocks
    private BulkRoleAssignmentService bulkRoleAssignmentService;

    @Test
    void oneFailingPairDoesNotStopTheOthers() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        UUID staff = UUID.randomUUID();
        when(roleAssignmentService.assign(any(AssignRoleCommand.class))).thenAnswer(invocation -> {
            AssignRoleCommand command = invocation.getArgument(0);
            if (command.userId().equals(bob)) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_already_assigned",
                        "User already has role 'Staff'");
            }
            return null;
        });

        BulkRoleAssignmentResponse response = bulkRoleAssignmentService.apply(
                new BulkRoleAssignmentRequest(List.of(alice, bob), List.of(staff), "assign", "term start", null, null),
                ADMIN);

        assertThat(response.successCount()).isEqualTo(1);
        assertThat(response.failureCount()).isEqualTo(1);
        assertThat(response.results()).extracting(BulkRoleAssignmentResult::userId).containsExactly(alice, bob);
        BulkRoleAssignmentResult failed = response.results().get(1);
        assertThat(failed.success()).isFalse();
        assertThat(failed.error()).isEqualTo("User already has role 'Staff'");
        verify(roleAssignmentService, times(2)).assign(any(AssignRoleCommand.class));
    }

    @Test
    void assignCarriesTheActorsSuperAdminStanding() {
        UUID alice = UUID.randomUUID();
        UUID superAdminRole = UUID.randomUUID();
        when(roleAssignmentService.assign(any(AssignRoleCommand.class))).thenThrow(
                new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden", "Only super admins may assign role 'Super Admin'"));

        BulkRoleAssignmentResponse response = bulkRoleAssignmentService.apply(
                new BulkRoleAssignmentRequest(List.of(alice), List.of(superAdminRole), "assign", null, null, null),
                ADMIN);

        ArgumentCaptor<AssignRoleCommand> command = ArgumentCaptor.forClass(AssignRoleCommand.class);
        verify(roleAssignmentService).assign(command.capture());
        assertThat(command.getValue().actorId()).isEqualTo(ADMIN_ID);
        assertThat(command.getValue().actorIsSuperAdmin()).isFalse();
        assertThat(response.failureCount()).isEqualTo(1);
        assertThat(response.results().get(0).error()).contains("Super Admin");
    }

    @Test
    void unexpectedErrorsAreReportedPerPair() {
        UUID alice = UUID.randomUUID();
        UUID staff = UUID.randomUUID();
        UUID lead = UUID.randomUUID();
        when(roleAssignmentService.revoke(any(UUID.class), any(UUID.class), any(UUID.class), any())).thenAnswer(invocation -> {
            if (staff.equals(invocation.getArgument(1))) {
                throw new IllegalStateException("boom");
            }
            return null;
        });

        BulkRoleAssignmentResponse response = bulkRoleAssignmentService.apply(
                new BulkRoleAssignmentRequest(List.of(alice), List.of(staff, lead), "revoke", null, null, null),
                ADMIN);

        assertThat(response.results()).extracting(BulkRoleAssignmentResult::success).containsExactly(false, true);
        assertThat(response.results().get(0).error()).isEqualTo("boom");
        verify(roleAssignmentService).revoke(alice, lead, ADMIN_ID, null);
    }

    @Test
    void unsupportedActionFailsEveryPairWithoutCallingTheService() {
        BulkRoleAssignmentResponse response = bulkRoleAssignmentService.apply(
                new BulkRoleAssignmentRequest(List.of(UUID.randomUUID()), List.of(UUID.randomUUID()), "grant", null, null, null),
                ADMIN);

        assertThat(response.failureCount()).isEqualTo(1);
        assertThat(response.results().get(0).error()).contains("grant");
        verifyNoInteractions(roleAssignmentService);
    }
}
