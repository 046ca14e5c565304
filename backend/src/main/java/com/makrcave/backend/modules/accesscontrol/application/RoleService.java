package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.domain.Permission;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyDepthExceededException;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyResolver;
import com.makrcave.backend.modules.accesscontrol.domain.RoleType;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PermissionRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleSearchCondition;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreateRoleRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleExportEntry;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleExportRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleExportResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleImportRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleImportResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdateRoleRequest;
import com.makrcave.backend.modules.audit.application.AuditLogService;

@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    static final String EXPORT_FORMAT_JSON = "json";

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RoleHierarchyResolver hierarchyResolver;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RoleService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RoleHierarchyResolver hierarchyResolver,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.hierarchyResolver = hierarchyResolver;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public RoleResponse createRole(@NonNull CreateRoleRequest request, @NonNull JwtAuthenticationPrincipal principal) {
        Role saved = roleRepository.save(buildRole(request, principal));
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.ROLE_CREATE,
                AccessAuditActions.RESOURCE_ROLE,
                saved.getId().toString(),
                principal.userId(),
                saved.getMakerspaceId(),
                Map.of("name", saved.getName(), "roleType", saved.getRoleType().name())
        ));
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles(RoleSearchCondition condition) {
        return roleRepository.searchRoles(condition).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(@NonNull UUID roleId, @NonNull JwtAuthenticationPrincipal principal) {
        Role role = loadRole(roleId);
        ensureVisible(role, principal);
        return toResponse(role);
    }

    public RoleResponse updateRole(
            @NonNull UUID roleId,
            @NonNull UpdateRoleRequest request,
            @NonNull JwtAuthenticationPrincipal principal
    ) {
        Role role = loadRole(roleId);
        ensureMutable(role, principal);

        Set<Permission> permissions = request.permissionIds() == null
                ? null
                : resolvePermissions(request.permissionIds(), null);
        List<String> changedFields = applyUpdate(role, request, permissions);

        Role saved = roleRepository.save(role);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.ROLE_UPDATE,
                AccessAuditActions.RESOURCE_ROLE,
                saved.getId().toString(),
                principal.userId(),
                saved.getMakerspaceId(),
                Map.of("changedFields", changedFields)
        ));
        return toResponse(saved);
    }

    public void deleteRole(@NonNull UUID roleId, @NonNull JwtAuthenticationPrincipal principal) {
        Role role = loadRole(roleId);
        if (role.isSystem()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.system_role_immutable",
                    "Cannot delete system roles");
        }
        ensureMakerspaceAccess(role, principal);

        long holders = roleRepository.countHolders(roleId);
        if (holders > 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_in_use",
                    "Cannot delete role that is assigned to " + holders + " users");
        }
        if (roleRepository.existsByParentRole_Id(roleId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_has_children",
                    "Cannot delete role that other roles inherit from");
        }

        roleRepository.delete(role);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.ROLE_DELETE,
                AccessAuditActions.RESOURCE_ROLE,
                roleId.toString(),
                principal.userId(),
                role.getMakerspaceId(),
                Map.of("name", role.getName())
        ));
    }

    @Transactional(readOnly = true)
    public RoleExportResponse exportRoles(@NonNull RoleExportRequest request, UUID makerspaceScope) {
        String format = StringUtils.hasText(request.format())
                ? request.format().trim().toLowerCase(Locale.ROOT)
                : EXPORT_FORMAT_JSON;
        if (!EXPORT_FORMAT_JSON.equals(format)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.unsupported_export_format",
                    "Only json export is supported");
        }
        boolean includePermissions = request.includePermissions() == null || request.includePermissions();
        boolean includeUsers = Boolean.TRUE.equals(request.includeUsers());

        List<Role> roles = roleRepository.searchRoles(new RoleSearchCondition(null, null, null, makerspaceScope, false));
        List<RoleExportEntry> entries = roles.stream()
                .map(role -> new RoleExportEntry(
                        toResponse(role),
                        includePermissions ? permissionDetails(role) : null,
                        includeUsers ? holders(role) : null))
                .toList();
        return new RoleExportResponse(format, OffsetDateTime.now(clock), entries.size(), entries);
    }

    /**
     * Imports roles one by one. With {@code skipInvalid} a failing entry is reported and skipped;
     * without it the first failure aborts the whole import.
     */
    public RoleImportResponse importRoles(@NonNull RoleImportRequest request, @NonNull JwtAuthenticationPrincipal principal) {
        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (CreateRoleRequest entry : request.roles()) {
            try {
                Optional<Role> existing = request.updateExisting()
                        ? findExisting(entry.name(), targetMakerspace(entry.makerspaceId(), principal))
                        : Optional.empty();
                if (existing.isPresent()) {
                    Role role = existing.get();
                    ensureMutable(role, principal);
                    applyUpdate(role, toUpdate(entry), resolvePermissions(entry.permissionIds(), entry.permissionCodenames()));
                    roleRepository.save(role);
                    updated.add(role.getName());
                } else {
                    Role role = roleRepository.save(buildRole(entry, principal));
                    created.add(role.getName());
                }
            } catch (ProblemException | RoleHierarchyDepthExceededException ex) {
                String detail = ex instanceof ProblemException problem ? problem.getDetailMessage() : ex.getMessage();
                String message = "Failed to import role '" + entry.name() + "': " + detail;
                if (!request.skipInvalidOrDefault()) {
                    throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_import_failed", message);
                }
                log.warn(message);
                errors.add(message);
            }
        }

        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.ROLE_IMPORT,
                AccessAuditActions.RESOURCE_ROLE,
                "IMPORT",
                principal.userId(),
                principal.makerspaceId(),
                Map.of("created", created.size(), "updated", updated.size(), "errors", errors.size())
        ));
        return new RoleImportResponse(created, updated, errors);
    }

    private Role buildRole(CreateRoleRequest request, JwtAuthenticationPrincipal principal) {
        UUID makerspaceId = targetMakerspace(request.makerspaceId(), principal);
        RoleType roleType = request.roleType() != null ? request.roleType() : RoleType.CUSTOM;
        if (!principal.isSuperAdmin() && (makerspaceId == null || roleType == RoleType.SUPER_ADMIN)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Only super admins may create global or super admin roles");
        }

        String name = request.name().trim();
        ensureNameAvailable(name, makerspaceId, null);

        Role role = new Role(name, roleType, false);
        role.setMakerspaceId(makerspaceId);
        role.setDescription(request.description());
        if (request.active() != null) {
            role.setActive(request.active());
        }
        if (request.assignable() != null) {
            role.setAssignable(request.assignable());
        }
        role.setMaxAssignments(request.maxAssignments());
        if (request.defaultRole() != null) {
            role.setDefaultRole(request.defaultRole());
        }
        if (request.priorityLevel() != null) {
            role.setPriorityLevel(request.priorityLevel());
        }
        if (request.sessionTimeoutMinutes() != null) {
            role.setSessionTimeoutMinutes(request.sessionTimeoutMinutes());
        }
        if (request.allowedIpRanges() != null) {
            role.setAllowedIpRanges(new ArrayList<>(request.allowedIpRanges()));
        }
        if (request.requiresTwoFactor() != null) {
            role.setRequiresTwoFactor(request.requiresTwoFactor());
        }
        if (request.maxConcurrentSessions() != null) {
            role.setMaxConcurrentSessions(request.maxConcurrentSessions());
        }
        if (request.featureFlags() != null) {
            role.setFeatureFlags(new HashMap<>(request.featureFlags()));
        }
        if (request.dashboardConfig() != null) {
            role.setDashboardConfig(new HashMap<>(request.dashboardConfig()));
        }
        if (request.menuRestrictions() != null) {
            role.setMenuRestrictions(new HashMap<>(request.menuRestrictions()));
        }
        if (request.requiredMembershipPlans() != null) {
            role.setRequiredMembershipPlans(new ArrayList<>(request.requiredMembershipPlans()));
        }
        if (request.excludedMembershipPlans() != null) {
            role.setExcludedMembershipPlans(new ArrayList<>(request.excludedMembershipPlans()));
        }
        if (request.parentRoleId() != null) {
            Role parent = loadRole(request.parentRoleId());
            ensureParentVisible(parent, makerspaceId);
            role.setParentRole(parent);
        }
        role.replacePermissions(resolvePermissions(request.permissionIds(), request.permissionCodenames()));

        // rejects parent chains deeper than the configured bound
        hierarchyResolver.effectivePermissions(role);
        return role;
    }

    /**
     * Every check runs before the first setter, so a rejected update leaves {@code role} untouched.
     */
    private List<String> applyUpdate(Role role, UpdateRoleRequest request, Set<Permission> permissions) {
        String name = null;
        if (StringUtils.hasText(request.name()) && !request.name().trim().equals(role.getName())) {
            name = request.name().trim();
            ensureNameAvailable(name, role.getMakerspaceId(), role.getId());
        }
        boolean parentChanged = false;
        Role parent = role.getParentRole();
        if (Boolean.TRUE.equals(request.clearParentRole())) {
            parentChanged = true;
            parent = null;
        } else if (request.parentRoleId() != null) {
            parentChanged = true;
            parent = loadRole(request.parentRoleId());
            if (hierarchyResolver.wouldCreateCycle(role, parent)) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_hierarchy_cycle",
                        "Role '" + parent.getName() + "' cannot be the parent of '" + role.getName()
                                + "': it would inherit from itself");
            }
            ensureParentVisible(parent, role.getMakerspaceId());
        }
        hierarchyResolver.verifyDepth(role, parent);

        List<String> changed = new ArrayList<>();
        if (name != null) {
            role.setName(name);
            changed.add("name");
        }
        if (request.description() != null) {
            role.setDescription(request.description());
            changed.add("description");
        }
        if (request.active() != null) {
            role.setActive(request.active());
            changed.add("active");
        }
        if (request.assignable() != null) {
            role.setAssignable(request.assignable());
            changed.add("assignable");
        }
        if (request.maxAssignments() != null) {
            role.setMaxAssignments(request.maxAssignments());
            changed.add("maxAssignments");
        }
        if (request.defaultRole() != null) {
            role.setDefaultRole(request.defaultRole());
            changed.add("defaultRole");
        }
        if (request.priorityLevel() != null) {
            role.setPriorityLevel(request.priorityLevel());
            changed.add("priorityLevel");
        }
        if (parentChanged) {
            role.setParentRole(parent);
            changed.add("parentRole");
        }
        if (request.sessionTimeoutMinutes() != null) {
            role.setSessionTimeoutMinutes(request.sessionTimeoutMinutes());
            changed.add("sessionTimeoutMinutes");
        }
        if (request.allowedIpRanges() != null) {
            role.setAllowedIpRanges(new ArrayList<>(request.allowedIpRanges()));
            changed.add("allowedIpRanges");
        }
        if (request.requiresTwoFactor() != null) {
            role.setRequiresTwoFactor(request.requiresTwoFactor());
            changed.add("requiresTwoFactor");
        }
        if (request.maxConcurrentSessions() != null) {
            role.setMaxConcurrentSessions(request.maxConcurrentSessions());
            changed.add("maxConcurrentSessions");
        }
        if (request.featureFlags() != null) {
            role.setFeatureFlags(new HashMap<>(request.featureFlags()));
            changed.add("featureFlags");
        }
        if (request.dashboardConfig() != null) {
            role.setDashboardConfig(new HashMap<>(request.dashboardConfig()));
            changed.add("dashboardConfig");
        }
        if (request.menuRestrictions() != null) {
            role.setMenuRestrictions(new HashMap<>(request.menuRestrictions()));
            changed.add("menuRestrictions");
        }
        if (request.requiredMembershipPlans() != null) {
            role.setRequiredMembershipPlans(new ArrayList<>(request.requiredMembershipPlans()));
            changed.add("requiredMembershipPlans");
        }
        if (request.excludedMembershipPlans() != null) {
            role.setExcludedMembershipPlans(new ArrayList<>(request.excludedMembershipPlans()));
            changed.add("excludedMembershipPlans");
        }
        if (permissions != null) {
            role.replacePermissions(permissions);
            changed.add("permissions");
        }
        return changed;
    }

    private static UpdateRoleRequest toUpdate(CreateRoleRequest entry) {
        return new UpdateRoleRequest(
                entry.name(),
                entry.description(),
                entry.active(),
                entry.assignable(),
                entry.maxAssignments(),
                entry.defaultRole(),
                entry.priorityLevel(),
                entry.parentRoleId(),
                null,
                entry.sessionTimeoutMinutes(),
                entry.allowedIpRanges(),
                entry.requiresTwoFactor(),
                entry.maxConcurrentSessions(),
                entry.featureFlags(),
                entry.dashboardConfig(),
                entry.menuRestrictions(),
                entry.requiredMembershipPlans(),
                entry.excludedMembershipPlans(),
                null
        );
    }

    Set<Permission> resolvePermissions(Collection<UUID> permissionIds, Collection<String> codenames) {
        Set<Permission> resolved = new LinkedHashSet<>();
        if (!CollectionUtils.isEmpty(permissionIds)) {
            Set<UUID> requested = new HashSet<>(permissionIds);
            List<Permission> found = permissionRepository.findAllById(requested);
            if (found.size() != requested.size()) {
                found.forEach(permission -> requested.remove(permission.getId()));
                throw new ProblemException(HttpStatus.BAD_REQUEST, "access.permission_not_found",
                        "Unknown permission ids: " + requested);
            }
            resolved.addAll(found);
        }
        if (!CollectionUtils.isEmpty(codenames)) {
            Set<String> requested = new HashSet<>(codenames);
            List<Permission> found = permissionRepository.findByCodenameIn(requested);
            if (found.size() != requested.size()) {
                found.forEach(permission -> requested.remove(permission.getCodename()));
                throw new ProblemException(HttpStatus.BAD_REQUEST, "access.permission_not_found",
                        "Unknown permission codenames: " + requested);
            }
            resolved.addAll(found);
        }
        return resolved;
    }

    private RoleResponse toResponse(Role role) {
        long userCount = role.getId() != null ? roleRepository.countHolders(role.getId()) : 0L;
        return AccessControlDtoMapper.toRoleResponse(role, hierarchyResolver.effectivePermissionCodes(role), userCount);
    }

    private List<RoleExportEntry.PermissionDetail> permissionDetails(Role role) {
        return role.getPermissions().stream()
                .sorted((left, right) -> left.getCodename().compareTo(right.getCodename()))
                .map(permission -> new RoleExportEntry.PermissionDetail(
                        permission.getCodename(), permission.getName(), permission.getDescription()))
                .toList();
    }

    private List<RoleExportEntry.RoleHolder> holders(Role role) {
        return roleRepository.findHolders(role.getId()).stream()
                .map(member -> new RoleExportEntry.RoleHolder(member.getId(), member.getEmail(), member.getFullName()))
                .toList();
    }

    private Optional<Role> findExisting(String name, UUID makerspaceId) {
        String trimmed = name.trim();
        return makerspaceId == null
                ? roleRepository.findByNameIgnoreCaseAndMakerspaceIdIsNull(trimmed)
                : roleRepository.findByNameIgnoreCaseAndMakerspaceId(trimmed, makerspaceId);
    }

    private void ensureNameAvailable(String name, UUID makerspaceId, UUID currentRoleId) {
        Optional<Role> clash = findExisting(name, makerspaceId);
        if (clash.isPresent() && !Objects.equals(clash.get().getId(), currentRoleId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.role_already_exists",
                    "Role '" + name + "' already exists");
        }
    }

    private static UUID targetMakerspace(UUID requested, JwtAuthenticationPrincipal principal) {
        return principal.isSuperAdmin() ? requested : principal.makerspaceId();
    }

    private static void ensureParentVisible(Role parent, UUID makerspaceId) {
        if (!parent.isGlobal() && !Objects.equals(parent.getMakerspaceId(), makerspaceId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_parent_role",
                    "Parent role '" + parent.getName() + "' belongs to a different makerspace");
        }
    }

    private static void ensureVisible(Role role, JwtAuthenticationPrincipal principal) {
        if (!role.isGlobal()) {
            ensureMakerspaceAccess(role, principal);
        }
    }

    private static void ensureMutable(Role role, JwtAuthenticationPrincipal principal) {
        if (role.isSystem()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.system_role_immutable",
                    "Cannot modify system roles");
        }
        ensureMakerspaceAccess(role, principal);
    }

    private static void ensureMakerspaceAccess(Role role, JwtAuthenticationPrincipal principal) {
        if (principal.isSuperAdmin()) {
            return;
        }
        if (role.isGlobal() || !Objects.equals(role.getMakerspaceId(), principal.makerspaceId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Role '" + role.getName() + "' belongs to another makerspace");
        }
    }

    private Role loadRole(UUID roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_found",
                        "Role " + roleId + " not found"));
    }
}
