package com.makrcave.backend.modules.accesscontrol.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.common.time.TimeConfig;
import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.RestAccessDeniedHandler;
import com.makrcave.backend.global.security.RestAuthenticationEntryPoint;
import com.makrcave.backend.global.security.SecurityConfig;
import com.makrcave.backend.modules.accesscontrol.application.AccessControlReadService;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.BulkRoleAssignmentService;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService.AssignRoleCommand;
import com.makrcave.backend.modules.accesscontrol.application.RoleService;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResult;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleAssignmentLogResponse;
import com.makrcave.backend.modules.auth.application.JwtTokenService;
import com.makrcave.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.makrcave.backend.support.TestAccessTokens;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = RoleController.class)
@Import({
        SecurityConfig.class,
        RestAuthenticationEntryPoint.class,
        RestAccessDeniedHandler.class,
        JwtTokenService.class,
        JwtTokenProvider.class,
        TimeConfig.class,
        AccessGuard.class
})
class RoleControllerTest {

    private static final UUID MAKERSPACE_ID = UUID.fromString("6f1c2b1e-0000-4000-8000-00000000d001");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private Clock clock;

    @MockBean
    private RoleService roleService;

    @MockBean
    private RoleAssignmentService roleAssignmentService;

    @MockBean
    private BulkRoleAssignmentService bulkRoleAssignmentService;

    @MockBean
    private AccessControlReadService accessControlReadService;

    @Test
    void makerspaceAdminAssignsRole() throws Exception {
        UUID roleId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        UUID adminId = UUID.randomUUID();
        when(roleAssignmentService.assign(any(AssignRoleCommand.class))).thenReturn(new RoleAssignmentLogResponse(
                UUID.randomUUID(), roleId, "Laser Operator", userId, adminId, "assigned",
                List.of(), List.of("operate_laser"), "certified", null, null, OffsetDateTime.now()));

        mockMvc.perform(post("/access-control/roles/{roleId}/assign", roleId)
                        .header("Authorization", "Bearer " + token(adminId, "makerspace_admin", List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s","reason":"certified"}
                                """.formatted(userId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.action").value("assigned"))
                .andExpect(jsonPath("$.newPermissions[0]").value("operate_laser"))
                .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void makerspaceAdminCannotAssignSuperAdminRole() throws Exception {
        UUID superAdminRoleId = UUID.randomUUID();
        UUID adminId = UUID.randomUUID();
        when(roleAssignmentService.assign(any(AssignRoleCommand.class))).thenAnswer(invocation -> {
            AssignRoleCommand command = invocation.getArgument(0);
            if (!command.actorIsSuperAdmin()) {
                throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                        "Only super admins may assign role 'Super Admin'");
            }
            return null;
        });

        mockMvc.perform(post("/access-control/roles/{roleId}/assign", superAdminRoleId)
                        .header("Authorization", "Bearer " + token(adminId, "makerspace_admin", List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s"}
                                """.formatted(adminId)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden"));

        ArgumentCaptor<AssignRoleCommand> command = ArgumentCaptor.forClass(AssignRoleCommand.class);
        verify(roleAssignmentService).assign(command.capture());
        assertThat(command.getValue().actorId()).isEqualTo(adminId);
        assertThat(command.getValue().roleId()).isEqualTo(superAdminRoleId);
        assertThat(command.getValue().actorIsSuperAdmin()).isFalse();
    }

    @Test
    void bulkAssignRunsAsTheCaller() throws Exception {
        UUID adminId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        UUID roleId = UUID.randomUUID();
        when(bulkRoleAssignmentService.apply(any(BulkRoleAssignmentRequest.class), any(JwtAuthenticationPrincipal.class)))
                .thenReturn(BulkRoleAssignmentResponse.of(List.of(
                        new BulkRoleAssignmentResult(userId, roleId, "assign", false, "Only super admins may assign role 'Super Admin'"))));

        mockMvc.perform(post("/access-control/roles/bulk-assign")
                        .header("Authorization", "Bearer " + token(adminId, "makerspace_admin", List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userIds":["%s"],"roleIds":["%s"],"action":"assign"}
                                """.formatted(userId, roleId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failureCount").value(1));

        ArgumentCaptor<JwtAuthenticationPrincipal> actor = ArgumentCaptor.forClass(JwtAuthenticationPrincipal.class);
        verify(bulkRoleAssignmentService).apply(any(BulkRoleAssignmentRequest.class), actor.capture());
        assertThat(actor.getValue().userId()).isEqualTo(adminId);
        assertThat(actor.getValue().isSuperAdmin()).isFalse();
    }

    @Test
    void staffCannotManageRoles() throws Exception {
        mockMvc.perform(post("/access-control/roles/{roleId}/assign", UUID.randomUUID())
                        .header("Authorization", "Bearer " + token(UUID.randomUUID(), "staff", List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.forbidden"));

        verifyNoInteractions(roleAssignmentService);
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/access-control/roles"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void tamperedTokenIsUnauthorized() throws Exception {
        String token = token(UUID.randomUUID(), "super_admin", List.of());

        mockMvc.perform(get("/access-control/roles")
                        .header("Authorization", "Bearer " + token.substring(0, token.length() - 2) + "xx"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void missingUserIdIsValidationError() throws Exception {
        mockMvc.perform(post("/access-control/roles/{roleId}/assign", UUID.randomUUID())
                        .header("Authorization", "Bearer " + token(UUID.randomUUID(), "makerspace_admin", List.of()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void serviceProblemsBecomeProblemResponses() throws Exception {
        UUID roleId = UUID.randomUUID();
        when(roleService.getRole(any(UUID.class), any())).thenThrow(
                new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_found", "Role " + roleId + " not found"));

        mockMvc.perform(get("/access-control/roles/{roleId}", roleId)
                        .header("Authorization", "Bearer " + token(UUID.randomUUID(), "makerspace_admin", List.of())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("access.role_not_found"))
                .andExpect(jsonPath("$.detail").value("Role " + roleId + " not found"));
    }

    @Test
    void unfilteredLedgerIsReservedToSuperAdmins() throws Exception {
        String auditor = token(UUID.randomUUID(), "maker", List.of(AccessGuard.VIEW_AUDIT_LOGS));

        mockMvc.perform(get("/access-control/role-assignment-logs")
                        .header("Authorization", "Bearer " + auditor))
                .andExpect(status().isForbidden());

        verifyNoInteractions(roleAssignmentService);
    }

    @Test
    void ledgerPageSizeIsCapped() throws Exception {
        UUID userId = UUID.randomUUID();
        when(roleAssignmentService.history(any(), any(), any())).thenReturn(new PagedResponse<>(List.of(), 0, 500, 0));

        mockMvc.perform(get("/access-control/role-assignment-logs")
                        .param("userId", userId.toString())
                        .param("size", "5000")
                        .header("Authorization", "Bearer " + token(UUID.randomUUID(), "super_admin", List.of())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(roleAssignmentService).history(eq(userId), isNull(), pageable.capture());
        assertThat(pageable.getValue().getPageSize()).isEqualTo(500);
    }

    private String token(UUID userId, String role, List<String> permissions) {
        return new TestAccessTokens(jwtTokenProvider, clock).issue(userId, role, MAKERSPACE_ID, permissions);
    }
}
