package com.makrcave.backend.modules.accesscontrol.application;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyResolver;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PermissionRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.UserSessionRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlStatsResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AuditLogResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.MemberAccessResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.SecurityAlertResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UserAccessSummaryResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogRepository;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogRepository.FailedAttemptCluster;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogSearchCondition;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberAccessStats;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberSearchCondition;

@Service
@Transactional(readOnly = true)
public class AccessControlReadService {

    static final String ALERT_MULTIPLE_FAILED_LOGINS = "multiple_failed_logins";
    static final String HIDDEN_ITEMS = "hidden_items";
    static final String DISABLED_ITEMS = "disabled_items";

    private final MemberRepository memberRepository;
    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserSessionRepository userSessionRepository;
    private final AuditLogRepository auditLogRepository;
    private final RoleHierarchyResolver hierarchyResolver;
    private final AccessGuard accessGuard;
    private final Clock clock;
    private final long alertThreshold;
    private final long alertWindowHours;

    public AccessControlReadService(
            MemberRepository memberRepository,
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            UserSessionRepository userSessionRepository,
            AuditLogRepository auditLogRepository,
            RoleHierarchyResolver hierarchyResolver,
            AccessGuard accessGuard,
            Clock clock,
            @Value("${makrcave.access-control.security-alert-threshold:5}") long alertThreshold,
            @Value("${makrcave.access-control.security-alert-window-hours:24}") long alertWindowHours
    ) {
        this.memberRepository = memberRepository;
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.userSessionRepository = userSessionRepository;
        this.auditLogRepository = auditLogRepository;
        this.hierarchyResolver = hierarchyResolver;
        this.accessGuard = accessGuard;
        this.clock = clock;
        this.alertThreshold = alertThreshold;
        this.alertWindowHours = alertWindowHours;
    }

    public PagedResponse<MemberAccessResponse> listMembers(
            UUID makerspaceId,
            Boolean active,
            Boolean hasActiveSession,
            UUID roleId,
            String search,
            Pageable pageable
    ) {
        MemberSearchCondition condition = new MemberSearchCondition(
                null, makerspaceId, active, hasActiveSession, roleId, search, OffsetDateTime.now(clock));
        return PagedResponse.from(memberRepository.searchMembers(condition, pageable),
                AccessControlDtoMapper::toMemberAccessResponse);
    }

    public UserAccessSummaryResponse userAccessSummary(@NonNull UUID userId, @NonNull JwtAuthenticationPrincipal principal) {
        accessGuard.requireSelfOr(principal, userId, AccessGuard.VIEW_MEMBERS);
        Member member = memberRepository.findWithRolesById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + userId + " not found"));
        if (!userId.equals(principal.userId())) {
            accessGuard.requireMakerspaceAccess(principal, member.getMakerspaceId());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Set<Role> roles = member.getRoles();
        MergedRoleConfiguration merged = mergeRoleConfiguration(roles);
        return new UserAccessSummaryResponse(
                member.getId(),
                member.getEmail(),
                member.getFullName(),
                AccessControlDtoMapper.toRoleSummaries(roles),
                List.copyOf(hierarchyResolver.effectivePermissionCodes(roles)),
                member.countLiveSessions(now),
                member.getLastLogin(),
                member.isAccountLocked(now),
                member.getAccountLockedUntil(),
                member.getPasswordExpiresAt(),
                member.isRequiresPasswordChange(),
                member.isTwoFactorEnabled(),
                merged.featureFlags(),
                merged.dashboardConfig(),
                merged.menuRestrictions()
        );
    }

    /**
     * Fails with 403 unless the caller is the member or shares the member's makerspace.
     */
    public void requireMemberInScope(@NonNull JwtAuthenticationPrincipal principal, @NonNull UUID userId) {
        if (userId.equals(principal.userId()) || principal.isSuperAdmin()) {
            return;
        }
        Member member = memberRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + userId + " not found"));
        accessGuard.requireMakerspaceAccess(principal, member.getMakerspaceId());
    }

    public AccessControlStatsResponse stats(UUID makerspaceId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime since = now.minusDays(1);

        MemberAccessStats members = memberRepository.summarize(makerspaceId);
        long totalRoles = roleRepository.countRoles(makerspaceId, null);
        long systemRoles = roleRepository.countRoles(makerspaceId, Boolean.TRUE);
        long activeSessions = makerspaceId == null
                ? userSessionRepository.countLive(now)
                : userSessionRepository.countLiveInMakerspace(makerspaceId, now);

        return new AccessControlStatsResponse(
                members.totalUsers(),
                members.activeUsers(),
                members.lockedUsers(),
                members.usersRequiringPasswordChange(),
                members.usersWithTwoFactor(),
                totalRoles,
                systemRoles,
                totalRoles - systemRoles,
                permissionRepository.countByActiveTrue(),
                activeSessions,
                auditLogRepository.countByActionTypeAndCreatedAtGreaterThanEqual(AuditLogService.ACTION_LOGIN, since),
                auditLogRepository.countByActionTypeAndSuccessFalseAndCreatedAtGreaterThanEqual(
                        AuditLogService.ACTION_LOGIN, since)
        );
    }

    /**
     * Alerts derived from failed logins: one per IP address with at least the configured number of
     * failures inside the alert window. Nothing is stored, so every alert is unresolved.
     */
    public List<SecurityAlertResponse> securityAlerts(Boolean resolved, String severity, int skip, int limit) {
        if (Boolean.TRUE.equals(resolved)) {
            return List.of();
        }
        OffsetDateTime since = OffsetDateTime.now(clock).minusHours(alertWindowHours);
        List<FailedAttemptCluster> clusters = auditLogRepository.findFailedAttemptClusters(
                AuditLogService.ACTION_LOGIN, since, alertThreshold);

        return clusters.stream()
                .map(this::toAlert)
                .filter(alert -> severity == null || severity.equalsIgnoreCase(alert.severity()))
                .skip(Math.max(skip, 0))
                .limit(Math.max(limit, 0))
                .toList();
    }

    public PagedResponse<AuditLogResponse> auditLogs(AuditLogSearchCondition condition, Pageable pageable) {
        return PagedResponse.from(auditLogRepository.searchLogs(condition, pageable),
                AccessControlDtoMapper::toAuditLogResponse);
    }

    private SecurityAlertResponse toAlert(FailedAttemptCluster cluster) {
        String key = ALERT_MULTIPLE_FAILED_LOGINS + ":" + cluster.getIpAddress() + ":" + cluster.getFirstAttemptAt();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt_count", cluster.getAttempts());
        details.put("window_hours", alertWindowHours);
        return new SecurityAlertResponse(
                UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)),
                ALERT_MULTIPLE_FAILED_LOGINS,
                cluster.getAttempts() >= alertThreshold * 2 ? "high" : "medium",
                "Multiple Failed Login Attempts",
                "Multiple failed login attempts from IP " + cluster.getIpAddress(),
                cluster.getIpAddress(),
                details,
                false,
                cluster.getFirstAttemptAt(),
                cluster.getLastAttemptAt()
        );
    }

    /**
     * Feature flags and dashboard configuration of all held roles, applied in ascending priority
     * so the highest priority role wins. Hidden and disabled menu items are unioned.
     */
    static MergedRoleConfiguration mergeRoleConfiguration(Collection<Role> roles) {
        List<Role> ordered = new ArrayList<>(roles);
        ordered.sort(Comparator.comparingInt(Role::getPriorityLevel).thenComparing(Role::getName));

        Map<String, Object> featureFlags = new HashMap<>();
        Map<String, Object> dashboardConfig = new HashMap<>();
        Map<String, Object> menuRestrictions = new HashMap<>();
        Set<Object> hidden = new LinkedHashSet<>();
        Set<Object> disabled = new LinkedHashSet<>();

        for (Role role : ordered) {
            if (role.getFeatureFlags() != null) {
                featureFlags.putAll(role.getFeatureFlags());
            }
            if (role.getDashboardConfig() != null) {
                dashboardConfig.putAll(role.getDashboardConfig());
            }
            Map<String, Object> restrictions = role.getMenuRestrictions();
            if (restrictions == null) {
                continue;
            }
            restrictions.forEach((key, value) -> {
                if (HIDDEN_ITEMS.equals(key)) {
                    addItems(hidden, value);
                } else if (DISABLED_ITEMS.equals(key)) {
                    addItems(disabled, value);
                } else {
                    menuRestrictions.put(key, value);
                }
            });
        }
        if (!hidden.isEmpty()) {
            menuRestrictions.put(HIDDEN_ITEMS, List.copyOf(hidden));
        }
        if (!disabled.isEmpty()) {
            menuRestrictions.put(DISABLED_ITEMS, List.copyOf(disabled));
        }
        return new MergedRoleConfiguration(featureFlags, dashboardConfig, menuRestrictions);
    }

    private static void addItems(Set<Object> target, Object value) {
        if (value instanceof Collection<?> items) {
            items.stream().filter(item -> item != null).forEach(target::add);
        } else if (value != null) {
            target.add(value);
        }
    }

    record MergedRoleConfiguration(
            Map<String, Object> featureFlags,
            Map<String, Object> dashboardConfig,
            Map<String, Object> menuRestrictions
    ) {
    }
}
