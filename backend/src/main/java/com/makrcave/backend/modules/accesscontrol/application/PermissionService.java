package com.makrcave.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.domain.AccessScope;
import com.makrcave.backend.modules.accesscontrol.domain.Permission;
import com.makrcave.backend.modules.accesscontrol.domain.PermissionType;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PermissionRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreatePermissionRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PermissionResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdatePermissionRequest;
import com.makrcave.backend.modules.audit.application.AuditLogService;

@Service
@Transactional
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final AuditLogService auditLogService;

    public PermissionService(PermissionRepository permissionRepository, AuditLogService auditLogService) {
        this.permissionRepository = permissionRepository;
        this.auditLogService = auditLogService;
    }

    public PermissionResponse createPermission(@NonNull CreatePermissionRequest request, UUID actorId) {
        String codename = request.codename().trim();
        String name = request.name().trim();
        if (permissionRepository.existsByCodename(codename)) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.permission_already_exists",
                    "Permission with codename '" + codename + "' already exists");
        }
        if (permissionRepository.existsByNameIgnoreCase(name)) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.permission_already_exists",
                    "Permission named '" + name + "' already exists");
        }

        Permission permission = new Permission(codename, name, request.permissionType(), false);
        permission.setDescription(request.description());
        if (request.accessScope() != null) {
            permission.setAccessScope(request.accessScope());
        }
        if (request.active() != null) {
            permission.setActive(request.active());
        }
        if (request.requiresTwoFactor() != null) {
            permission.setRequiresTwoFactor(request.requiresTwoFactor());
        }
        if (request.resourceTypes() != null) {
            permission.setResourceTypes(new ArrayList<>(request.resourceTypes()));
        }
        if (request.fieldRestrictions() != null) {
            permission.setFieldRestrictions(new HashMap<>(request.fieldRestrictions()));
        }

        Permission saved = permissionRepository.save(permission);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.PERMISSION_CREATE,
                AccessAuditActions.RESOURCE_PERMISSION,
                saved.getCodename(),
                actorId,
                null,
                Map.of("permissionType", saved.getPermissionType().getCode())
        ));
        return AccessControlDtoMapper.toPermissionResponse(saved);
    }

    @Transactional(readOnly = true)
    public PagedResponse<PermissionResponse> listPermissions(
            PermissionType type,
            AccessScope scope,
            Boolean active,
            Pageable pageable
    ) {
        Page<Permission> page = permissionRepository.search(type, scope, active, pageable);
        return PagedResponse.from(page, AccessControlDtoMapper::toPermissionResponse);
    }

    @Transactional(readOnly = true)
    public PermissionResponse getPermission(@NonNull UUID permissionId) {
        return AccessControlDtoMapper.toPermissionResponse(loadPermission(permissionId));
    }

    public PermissionResponse updatePermission(
            @NonNull UUID permissionId,
            @NonNull UpdatePermissionRequest request,
            UUID actorId
    ) {
        Permission permission = loadPermission(permissionId);
        if (permission.isSystem()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.system_permission_immutable",
                    "Cannot modify system permissions");
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        if (StringUtils.hasText(request.name()) && !request.name().trim().equals(permission.getName())) {
            String name = request.name().trim();
            if (permissionRepository.existsByNameIgnoreCase(name)) {
                throw new ProblemException(HttpStatus.CONFLICT, "access.permission_already_exists",
                        "Permission named '" + name + "' already exists");
            }
            permission.setName(name);
            changes.put("name", name);
        }
        if (request.description() != null) {
            permission.setDescription(request.description());
            changes.put("description", request.description());
        }
        if (request.active() != null) {
            permission.setActive(request.active());
            changes.put("active", request.active());
        }
        if (request.requiresTwoFactor() != null) {
            permission.setRequiresTwoFactor(request.requiresTwoFactor());
            changes.put("requiresTwoFactor", request.requiresTwoFactor());
        }
        if (request.resourceTypes() != null) {
            permission.setResourceTypes(new ArrayList<>(request.resourceTypes()));
            changes.put("resourceTypes", request.resourceTypes());
        }
        if (request.fieldRestrictions() != null) {
            permission.setFieldRestrictions(new HashMap<>(request.fieldRestrictions()));
            changes.put("fieldRestrictions", request.fieldRestrictions());
        }

        Permission saved = permissionRepository.save(permission);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.PERMISSION_UPDATE,
                AccessAuditActions.RESOURCE_PERMISSION,
                saved.getCodename(),
                actorId,
                null,
                changes
        ));
        return AccessControlDtoMapper.toPermissionResponse(saved);
    }

    public void deletePermission(@NonNull UUID permissionId, UUID actorId) {
        Permission permission = loadPermission(permissionId);
        if (permission.isSystem()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.system_permission_immutable",
                    "Cannot delete system permissions");
        }
        permissionRepository.delete(permission);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.PERMISSION_DELETE,
                AccessAuditActions.RESOURCE_PERMISSION,
                permission.getCodename(),
                actorId,
                null,
                null
        ));
    }

    private Permission loadPermission(UUID permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.permission_not_found",
                        "Permission " + permissionId + " not found"));
    }
}
