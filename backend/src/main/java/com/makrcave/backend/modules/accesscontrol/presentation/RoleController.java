package com.makrcave.backend.modules.accesscontrol.presentation;

import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.SecurityUtils;
import com.makrcave.backend.modules.accesscontrol.application.AccessControlReadService;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.BulkRoleAssignmentService;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService.AssignRoleCommand;
import com.makrcave.backend.modules.accesscontrol.application.RoleService;
import com.makrcave.backend.modules.accesscontrol.domain.RoleType;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleSearchCondition;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AssignRoleRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreateRoleRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleAssignmentLogResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleExportRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleExportResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleImportRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleImportResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdateRoleRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access-control")
public class RoleController {

    private final RoleService roleService;
    private final RoleAssignmentService roleAssignmentService;
    private final BulkRoleAssignmentService bulkRoleAssignmentService;
    private final AccessControlReadService accessControlReadService;
    private final AccessGuard accessGuard;

    public RoleController(
            RoleService roleService,
            RoleAssignmentService roleAssignmentService,
            BulkRoleAssignmentService bulkRoleAssignmentService,
            AccessControlReadService accessControlReadService,
            AccessGuard accessGuard
    ) {
        this.roleService = roleService;
        this.roleAssignmentService = roleAssignmentService;
        this.bulkRoleAssignmentService = bulkRoleAssignmentService;
        this.accessControlReadService = accessControlReadService;
        this.accessGuard = accessGuard;
    }

    @Operation(
            summary = "Create a role",
            description = """
                    Creates a role with its own permissions and an optional parent role. \
                    Callers other than super admins always create roles in their own makerspace.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Role created"),
            @ApiResponse(responseCode = "400", description = "Unknown permission or invalid parent role"),
            @ApiResponse(responseCode = "409", description = "A role with the same name already exists in the makerspace")
    })
    @PostMapping("/roles")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        return ResponseEntity.status(HttpStatus.CREATED).body(roleService.createRole(request, principal));
    }

    @Operation(summary = "List roles", description = "Roles of the makerspace and global roles, highest priority first.")
    @GetMapping("/roles")
    public ResponseEntity<List<RoleResponse>> listRoles(
            @RequestParam(name = "roleType", required = false) RoleType roleType,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "assignable", required = false) Boolean assignable,
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_ROLES);
        RoleSearchCondition condition = new RoleSearchCondition(
                roleType, active, assignable, accessGuard.scopeMakerspace(principal, makerspaceId), true);
        return ResponseEntity.ok(roleService.listRoles(condition));
    }

    @GetMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("roleId") UUID roleId) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_ROLES);
        return ResponseEntity.ok(roleService.getRole(roleId, principal));
    }

    @Operation(summary = "Update a role", description = "System roles cannot be modified. Parent changes are checked for cycles.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Role updated"),
            @ApiResponse(responseCode = "400", description = "System role, cycle in the hierarchy or invalid parent"),
            @ApiResponse(responseCode = "409", description = "Hierarchy deeper than the configured maximum")
    })
    @PutMapping("/roles/{roleId}")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        return ResponseEntity.ok(roleService.updateRole(roleId, request, principal));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Role deleted"),
            @ApiResponse(responseCode = "400", description = "System role, role still held or role with child roles")
    })
    @DeleteMapping("/roles/{roleId}")
    public ResponseEntity<Void> deleteRole(@PathVariable("roleId") UUID roleId) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        roleService.deleteRole(roleId, principal);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Assign a role to a user",
            description = """
                    Grants the role and appends a ledger entry holding the user's effective permissions \
                    before and after the change.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Role assigned; body is the ledger entry"),
            @ApiResponse(responseCode = "400", description = "Role not assignable to the user or already held"),
            @ApiResponse(responseCode = "403", description = "Super admin roles need a super admin caller"),
            @ApiResponse(responseCode = "404", description = "Unknown user or role")
    })
    @PostMapping("/roles/{roleId}/assign")
    public ResponseEntity<RoleAssignmentLogResponse> assignRole(
            @PathVariable("roleId") UUID roleId,
            @Valid @RequestBody AssignRoleRequest request
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        accessControlReadService.requireMemberInScope(principal, request.userId());
        AssignRoleCommand command = new AssignRoleCommand(
                request.userId(), roleId, principal.userId(), principal.isSuperAdmin(), request.reason(),
                request.effectiveDate(), request.expiryDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(roleAssignmentService.assign(command));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Role revoked"),
            @ApiResponse(responseCode = "404", description = "Unknown user or role, or role not held")
    })
    @DeleteMapping("/roles/{roleId}/revoke/{userId}")
    public ResponseEntity<Void> revokeRole(
            @PathVariable("roleId") UUID roleId,
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "reason", required = false) String reason
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        accessControlReadService.requireMemberInScope(principal, userId);
        roleAssignmentService.revoke(userId, roleId, principal.userId(), reason);
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Assign or revoke roles in bulk",
            description = "Every user and role pair is applied on its own; one failing pair does not undo the others."
    )
    @PostMapping("/roles/bulk-assign")
    public ResponseEntity<BulkRoleAssignmentResponse> bulkAssign(@Valid @RequestBody BulkRoleAssignmentRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        request.userIds().forEach(userId -> accessControlReadService.requireMemberInScope(principal, userId));
        return ResponseEntity.ok(bulkRoleAssignmentService.apply(request, principal));
    }

    @Operation(summary = "Export roles as JSON")
    @PostMapping("/roles/export")
    public ResponseEntity<RoleExportResponse> exportRoles(@Valid @RequestBody RoleExportRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.EXPORT_ROLES);
        return ResponseEntity.ok(roleService.exportRoles(request,
                accessGuard.scopeMakerspace(principal, request.makerspaceId())));
    }

    @Operation(
            summary = "Import roles",
            description = """
                    Creates the listed roles, or updates roles with the same name when `updateExisting` is set. \
                    Unless `skipInvalid` is true the first invalid entry aborts the whole import.
                    """
    )
    @PostMapping("/roles/import")
    public ResponseEntity<RoleImportResponse> importRoles(@Valid @RequestBody RoleImportRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_ROLES);
        return ResponseEntity.ok(roleService.importRoles(request, principal));
    }

    @Operation(summary = "Role assignment ledger", description = "Newest entries first, optionally filtered by user and role.")
    @GetMapping("/role-assignment-logs")
    public ResponseEntity<PagedResponse<RoleAssignmentLogResponse>> roleAssignmentLogs(
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "roleId", required = false) UUID roleId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_AUDIT_LOGS);
        if (userId == null && roleId == null) {
            accessGuard.requireSuperAdmin(principal);
        }
        if (userId != null) {
            accessControlReadService.requireMemberInScope(principal, userId);
        }
        if (roleId != null) {
            roleService.getRole(roleId, principal);
        }
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 500));
        return ResponseEntity.ok(roleAssignmentService.history(userId, roleId, pageable));
    }
}
