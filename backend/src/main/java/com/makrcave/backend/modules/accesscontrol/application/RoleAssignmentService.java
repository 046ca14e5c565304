package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentAction;
import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentLog;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyResolver;
import com.makrcave.backend.modules.accesscontrol.domain.RoleType;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleAssignmentLogRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.RoleAssignmentLogResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

/**
 * Grants and revokes roles. Every successful change writes exactly one ledger entry holding the
 * member's effective permissions before and after, in the same transaction as the change.
 * <p>
 * The member row is locked before the role row, so concurrent grants of a capped role are
 * serialised on the role and the holder count cannot be overrun.
 */
@Service
@Transactional
public class RoleAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(RoleAssignmentService.class);

    private final MemberRepository memberRepository;
    private final RoleRepository roleRepository;
    private final RoleAssignmentLogRepository roleAssignmentLogRepository;
    private final RoleHierarchyResolver hierarchyResolver;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RoleAssignmentService(
            MemberRepository memberRepository,
            RoleRepository roleRepository,
            RoleAssignmentLogRepository roleAssignmentLogRepository,
            RoleHierarchyResolver hierarchyResolver,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.memberRepository = memberRepository;
        this.roleRepository = roleRepository;
        this.roleAssignmentLogRepository = roleAssignmentLogRepository;
        this.hierarchyResolver = hierarchyResolver;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public RoleAssignmentLogResponse assign(@NonNull AssignRoleCommand command) {
        Member member = lockMember(command.userId());
        Role role = lockRole(command.roleId());
        if (role.getRoleType() == RoleType.SUPER_ADMIN && !command.actorIsSuperAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Only super admins may assign role '" + role.getName() + "'");
        }

        long holders = roleRepository.countHolders(role.getId());
        role.assignmentBlocker(member, holders).ifPresent(reason -> {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_not_assignable", reason);
        });
        if (member.holdsRole(role)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.role_already_assigned",
                    "User already has role '" + role.getName() + "'");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        SortedSet<String> before = hierarchyResolver.effectivePermissionCodes(member.getRoles());
        member.addRole(role);
        memberRepository.saveAndFlush(member);
        SortedSet<String> after = hierarchyResolver.effectivePermissionCodes(member.getRoles());

        RoleAssignmentLog entry = roleAssignmentLogRepository.save(
                RoleAssignmentLog.builder(RoleAssignmentAction.ASSIGNED, role, member)
                        .modifiedBy(command.actorId())
                        .previousPermissions(before)
                        .newPermissions(after)
                        .reason(command.reason())
                        .effectiveDate(command.effectiveDate() != null ? command.effectiveDate() : now)
                        .expiryDate(command.expiryDate())
                        .createdAt(now)
                        .build());

        recordAudit(AccessAuditActions.ROLE_ASSIGN, member, role, command.actorId(), command.reason());
        log.info("Role {} assigned to member {} by {}", role.getId(), member.getId(), command.actorId());
        return AccessControlDtoMapper.toAssignmentLogResponse(entry);
    }

    public RoleAssignmentLogResponse revoke(@NonNull UUID userId, @NonNull UUID roleId, UUID actorId, String reason) {
        Member member = lockMember(userId);
        Role role = lockRole(roleId);
        if (!member.holdsRole(role)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_assigned",
                    "User does not have role '" + role.getName() + "'");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        SortedSet<String> before = hierarchyResolver.effectivePermissionCodes(member.getRoles());
        member.removeRole(role);
        memberRepository.saveAndFlush(member);
        SortedSet<String> after = hierarchyResolver.effectivePermissionCodes(member.getRoles());

        RoleAssignmentLog entry = roleAssignmentLogRepository.save(
                RoleAssignmentLog.builder(RoleAssignmentAction.REVOKED, role, member)
                        .modifiedBy(actorId)
                        .previousPermissions(before)
                        .newPermissions(after)
                        .reason(reason)
                        .effectiveDate(now)
                        .createdAt(now)
                        .build());

        recordAudit(AccessAuditActions.ROLE_REVOKE, member, role, actorId, reason);
        log.info("Role {} revoked from member {} by {}", role.getId(), member.getId(), actorId);
        return AccessControlDtoMapper.toAssignmentLogResponse(entry);
    }

    @Transactional(readOnly = true)
    public PagedResponse<RoleAssignmentLogResponse> history(UUID userId, UUID roleId, Pageable pageable) {
        Page<RoleAssignmentLog> page;
        if (userId != null && roleId != null) {
            page = roleAssignmentLogRepository.findByMember_IdAndRoleIdOrderByCreatedAtDesc(userId, roleId, pageable);
        } else if (userId != null) {
            page = roleAssignmentLogRepository.findByMember_IdOrderByCreatedAtDesc(userId, pageable);
        } else if (roleId != null) {
            page = roleAssignmentLogRepository.findByRoleIdOrderByCreatedAtDesc(roleId, pageable);
        } else {
            page = roleAssignmentLogRepository.findAllByOrderByCreatedAtDesc(pageable);
        }
        return PagedResponse.from(page, AccessControlDtoMapper::toAssignmentLogResponse);
    }

    private void recordAudit(String action, Member member, Role role, UUID actorId, String reason) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("userId", member.getId().toString());
        detail.put("roleName", role.getName());
        if (reason != null) {
            detail.put("reason", reason);
        }
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                action,
                AccessAuditActions.RESOURCE_ROLE,
                role.getId().toString(),
                actorId,
                member.getMakerspaceId(),
                detail
        ));
    }

    private Member lockMember(UUID userId) {
        return memberRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + userId + " not found"));
    }

    private Role lockRole(UUID roleId) {
        return roleRepository.findByIdForUpdate(roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.role_not_found",
                        "Role " + roleId + " not found"));
    }

    /**
     * @param actorIsSuperAdmin whether the actor may hand out roles of type {@link RoleType#SUPER_ADMIN}
     */
    public record AssignRoleCommand(
            UUID userId,
            UUID roleId,
            UUID actorId,
            boolean actorIsSuperAdmin,
            String reason,
            OffsetDateTime effectiveDate,
            OffsetDateTime expiryDate
    ) {
    }
}
