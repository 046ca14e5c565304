package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.accesscontrol.domain.Permission;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentLog;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;
import com.makrcave.backend.modules.audit.domain.AuditLog;
import com.makrcave.backend.modules.member.domain.Member;

public final class AccessControlDtoMapper {

    private AccessControlDtoMapper() {
    }

    public static PermissionResponse toPermissionResponse(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getCodename(),
                permission.getDescription(),
                permission.getPermissionType().getCode(),
                permission.getAccessScope().name(),
                permission.isSystem(),
                permission.isActive(),
                permission.isRequiresTwoFactor(),
                copyOrEmpty(permission.getResourceTypes()),
                copyOrEmpty(permission.getFieldRestrictions()),
                permission.getCreatedAt(),
                permission.getUpdatedAt(),
                permission.getCreatedBy()
        );
    }

    public static RoleResponse toRoleResponse(Role role, Collection<String> effectivePermissions, long userCount) {
        Role parent = role.getParentRole();
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.getRoleType().name(),
                role.isSystem(),
                role.isActive(),
                role.isAssignable(),
                role.getMaxAssignments(),
                role.getMakerspaceId(),
                role.isDefaultRole(),
                role.getPriorityLevel(),
                parent != null ? parent.getId() : null,
                role.getSessionTimeoutMinutes(),
                copyOrEmpty(role.getAllowedIpRanges()),
                role.isRequiresTwoFactor(),
                role.getMaxConcurrentSessions(),
                copyOrEmpty(role.getFeatureFlags()),
                copyOrEmpty(role.getDashboardConfig()),
                copyOrEmpty(role.getMenuRestrictions()),
                copyOrEmpty(role.getRequiredMembershipPlans()),
                copyOrEmpty(role.getExcludedMembershipPlans()),
                ownPermissionCodes(role),
                List.copyOf(effectivePermissions),
                userCount,
                role.getCreatedAt(),
                role.getUpdatedAt(),
                role.getCreatedBy(),
                role.getLastModifiedBy()
        );
    }

    public static RoleSummaryResponse toRoleSummary(Role role) {
        return new RoleSummaryResponse(
                role.getId(),
                role.getName(),
                role.getRoleType().name(),
                role.getPriorityLevel(),
                role.getMakerspaceId(),
                role.isActive()
        );
    }

    public static List<RoleSummaryResponse> toRoleSummaries(Collection<Role> roles) {
        return roles.stream()
                .sorted(Comparator.comparingInt(Role::getPriorityLevel).reversed().thenComparing(Role::getName))
                .map(AccessControlDtoMapper::toRoleSummary)
                .toList();
    }

    public static RoleAssignmentLogResponse toAssignmentLogResponse(RoleAssignmentLog log) {
        return new RoleAssignmentLogResponse(
                log.getId(),
                log.getRoleId(),
                log.getRoleName(),
                log.getMember().getId(),
                log.getModifiedBy(),
                log.getAction().name().toLowerCase(Locale.ROOT),
                List.copyOf(log.getPreviousPermissions()),
                List.copyOf(log.getNewPermissions()),
                log.getReason(),
                log.getEffectiveDate(),
                log.getExpiryDate(),
                log.getCreatedAt()
        );
    }

    public static MemberAccessResponse toMemberAccessResponse(Member member) {
        return new MemberAccessResponse(
                member.getId(),
                member.getEmail(),
                member.getFullName(),
                member.getMakerspaceId(),
                member.getPrimaryRole().name(),
                member.isActive(),
                member.isAccountLockedFlag(),
                member.getFailedLoginAttempts(),
                member.getLastLogin(),
                member.isTwoFactorEnabled(),
                member.isRequiresPasswordChange(),
                toRoleSummaries(member.getRoles())
        );
    }

    public static UserSessionResponse toSessionResponse(UserSession session, OffsetDateTime now) {
        return new UserSessionResponse(
                session.getId(),
                session.getMember().getId(),
                session.getIpAddress(),
                session.getUserAgent(),
                session.getLocation(),
                session.isActive(),
                session.isExpired(now),
                session.getLastActivity(),
                session.getExpiresAt(),
                session.isTwoFactorVerified(),
                session.getLoginMethod(),
                session.getDeviceFingerprint(),
                session.getCreatedAt(),
                session.getEndedAt(),
                session.getEndReason()
        );
    }

    public static PasswordPolicyResponse toPolicyResponse(PasswordPolicy policy) {
        return new PasswordPolicyResponse(
                policy.getId(),
                policy.getMakerspaceId(),
                policy.getMinLength(),
                policy.getMaxLength(),
                policy.isRequireUppercase(),
                policy.isRequireLowercase(),
                policy.isRequireNumbers(),
                policy.isRequireSpecialChars(),
                policy.getAllowedSpecialChars(),
                policy.getPreventReuseCount(),
                policy.getMaxAgeDays(),
                policy.getWarnBeforeExpiryDays(),
                policy.getMaxFailedAttempts(),
                policy.getLockoutDurationMinutes(),
                policy.isProgressiveLockout(),
                policy.isRequireTwoFactor(),
                copyOrEmpty(policy.getRequireTwoFactorForRoles()),
                copyOrEmpty(policy.getAllowedTwoFactorMethods()),
                policy.getSessionTimeoutMinutes(),
                policy.getIdleTimeoutMinutes(),
                policy.getMaxConcurrentSessions(),
                policy.isForceLogoutOnPasswordChange(),
                policy.isActive(),
                policy.getCreatedAt(),
                policy.getUpdatedAt(),
                policy.getCreatedBy()
        );
    }

    public static AuditLogResponse toAuditLogResponse(AuditLog auditLog) {
        UUID actorId = auditLog.getActor() != null ? auditLog.getActor().getId() : null;
        return new AuditLogResponse(
                auditLog.getId(),
                auditLog.getActionType(),
                auditLog.getResourceType(),
                auditLog.getResourceKey(),
                actorId,
                auditLog.getMakerspaceId(),
                auditLog.getSessionId(),
                auditLog.getIpAddress(),
                auditLog.getUserAgent(),
                auditLog.isSuccess(),
                auditLog.getFailureReason(),
                auditLog.getCorrelationId(),
                auditLog.getDetail(),
                auditLog.getCreatedAt()
        );
    }

    public static List<String> ownPermissionCodes(Role role) {
        return role.getPermissions().stream()
                .map(Permission::getCodename)
                .sorted()
                .toList();
    }

    private static List<String> copyOrEmpty(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    private static Map<String, Object> copyOrEmpty(Map<String, Object> values) {
        return values == null ? Map.of() : values;
    }
}
