package com.makrcave.backend.modules.accesscontrol.presentation;

import java.util.UUID;

import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.SecurityUtils;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.PermissionService;
import com.makrcave.backend.modules.accesscontrol.domain.AccessScope;
import com.makrcave.backend.modules.accesscontrol.domain.PermissionType;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreatePermissionRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PermissionResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdatePermissionRequest;

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
@RequestMapping("/access-control/permissions")
public class PermissionController {

    private final PermissionService permissionService;
    private final AccessGuard accessGuard;

    public PermissionController(PermissionService permissionService, AccessGuard accessGuard) {
        this.permissionService = permissionService;
        this.accessGuard = accessGuard;
    }

    @Operation(summary = "Create a permission")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Permission created"),
            @ApiResponse(responseCode = "409", description = "Codename or name already in use")
    })
    @PostMapping
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_PERMISSIONS);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(permissionService.createPermission(request, principal.userId()));
    }

    @GetMapping
    public ResponseEntity<PagedResponse<PermissionResponse>> listPermissions(
            @RequestParam(name = "permissionType", required = false) PermissionType permissionType,
            @RequestParam(name = "accessScope", required = false) AccessScope accessScope,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "100") int size
    ) {
        accessGuard.require(SecurityUtils.getCurrentPrincipal(), AccessGuard.VIEW_PERMISSIONS);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 1000));
        return ResponseEntity.ok(permissionService.listPermissions(permissionType, accessScope, active, pageable));
    }

    @GetMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> getPermission(@PathVariable("permissionId") UUID permissionId) {
        accessGuard.require(SecurityUtils.getCurrentPrincipal(), AccessGuard.VIEW_PERMISSIONS);
        return ResponseEntity.ok(permissionService.getPermission(permissionId));
    }

    @Operation(summary = "Update a permission", description = "System permissions cannot be modified.")
    @PutMapping("/{permissionId}")
    public ResponseEntity<PermissionResponse> updatePermission(
            @PathVariable("permissionId") UUID permissionId,
            @Valid @RequestBody UpdatePermissionRequest request
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_PERMISSIONS);
        return ResponseEntity.ok(permissionService.updatePermission(permissionId, request, principal.userId()));
    }

    @DeleteMapping("/{permissionId}")
    public ResponseEntity<Void> deletePermission(@PathVariable("permissionId") UUID permissionId) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_PERMISSIONS);
        permissionService.deletePermission(permissionId, principal.userId());
        return ResponseEntity.noContent().build();
    }
}
