package com.makrcave.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.makrcave.backend.modules.accesscontrol.application.DefaultCatalogLoader.DefaultCatalog;
import com.makrcave.backend.modules.accesscontrol.application.DefaultCatalogLoader.PermissionSeed;
import com.makrcave.backend.modules.accesscontrol.application.DefaultCatalogLoader.RoleSeed;
import com.makrcave.backend.modules.accesscontrol.domain.Permission;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PermissionRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.DefaultSetupResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;

/**
 * Seeds the system permissions and a makerspace's system roles. Running it again only adds what
 * is missing.
 */
@Service
@Transactional
public class DefaultAccessSetupService {

    private static final Logger log = LoggerFactory.getLogger(DefaultAccessSetupService.class);

    private final DefaultCatalogLoader defaultCatalogLoader;
    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final AuditLogService auditLogService;

    public DefaultAccessSetupService(
            DefaultCatalogLoader defaultCatalogLoader,
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            AuditLogService auditLogService
    ) {
        this.defaultCatalogLoader = defaultCatalogLoader;
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.auditLogService = auditLogService;
    }

    public DefaultSetupResponse setupDefaults(@NonNull UUID makerspaceId, UUID actorId) {
        DefaultCatalog catalog = defaultCatalogLoader.load();

        List<String> createdPermissions = new ArrayList<>();
        for (PermissionSeed seed : catalog.permissions()) {
            if (permissionRepository.existsByCodename(seed.codename())) {
                continue;
            }
            Permission permission = new Permission(seed.codename(), seed.name(), seed.permissionType(), true);
            permission.setDescription(seed.description());
            permissionRepository.save(permission);
            createdPermissions.add(seed.codename());
        }

        List<String> createdRoles = new ArrayList<>();
        for (RoleSeed seed : catalog.roles()) {
            if (roleRepository.findByNameIgnoreCaseAndMakerspaceId(seed.name(), makerspaceId).isPresent()) {
                continue;
            }
            Role role = new Role(seed.name(), seed.roleType(), true);
            role.setMakerspaceId(makerspaceId);
            role.setDescription(seed.description());
            role.setPriorityLevel(seed.priorityLevel());
            role.setRequiresTwoFactor(seed.requiresTwoFactor());
            role.setDefaultRole(seed.defaultRole());
            role.replacePermissions(new LinkedHashSet<>(permissionRepository.findByCodenameIn(seed.permissions())));
            roleRepository.save(role);
            createdRoles.add(seed.name());
        }

        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.DEFAULTS_SETUP,
                AccessAuditActions.RESOURCE_MAKERSPACE,
                makerspaceId.toString(),
                actorId,
                makerspaceId,
                Map.of("createdPermissions", createdPermissions.size(), "createdRoles", createdRoles.size())
        ));
        log.info("Default access catalog applied to makerspace {}: {} permissions, {} roles created",
                makerspaceId, createdPermissions.size(), createdRoles.size());
        return new DefaultSetupResponse(makerspaceId, createdPermissions, createdRoles);
    }
}
