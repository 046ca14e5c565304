package com.makrcave.backend.modules.accesscontrol.application;

import static com.makrcave.backend.support.AccessControlFixtures.OTHER_MAKERSPACE_ID;
import static com.makrcave.backend.support.AccessControlFixtures.member;
import static com.makrcave.backend.support.AccessControlFixtures.permission;
import static com.makrcave.backend.support.AccessControlFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.application.AccessControlReadService.MergedRoleConfiguration;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.RoleHierarchyResolver;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PermissionRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.UserSessionRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.SecurityAlertResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UserAccessSummaryResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogRepository;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogRepository.FailedAttemptCluster;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccessControlReadServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private AuditLogRepository auditLogRepository;

    private AccessControlReadService readService;

    @BeforeEach
    void setUp() {
        readService = new AccessControlReadService(
                memberRepository,
                roleRepository,
                permissionRepository,
                userSessionRepository,
                auditLogRepository,
                new RoleHierarchyResolver(RoleHierarchyResolver.DEFAULT_MAX_DEPTH),
                new AccessGuard(),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC),
                5,
                24
        );
    }

    @Test
    void higherPriorityRoleWinsOnConflictingFlags() {
        Role member = role("Member");
        member.setPriorityLevel(10);
        member.setFeatureFlags(Map.of("laser_cutter", false, "printing", true));
        member.setMenuRestrictions(Map.of("hidden_items", List.of("billing"), "layout", "compact"));
        Role lead = role("Lead");
        lead.setPriorityLevel(50);
        lead.setFeatureFlags(Map.of("laser_cutter", true));
        lead.setMenuRestrictions(Map.of("hidden_items", List.of("inventory", "billing"), "layout", "full"));

        MergedRoleConfiguration merged = AccessControlReadService.mergeRoleConfiguration(List.of(lead, member));

        assertThat(merged.featureFlags()).containsEntry("laser_cutter", true).containsEntry("printing", true);
        assertThat(merged.menuRestrictions()).containsEntry("layout", "full");
        assertThat(merged.menuRestrictions().get("hidden_items")).asList().containsExactly("billing", "inventory");
        assertThat(merged.menuRestrictions()).doesNotContainKey("disabled_items");
    }

    @Test
    void summaryListsInheritedPermissions() {
        Role parent = role("Base", permission("view_equipment"));
        Role child = role("Operator", permission("reserve_equipment"));
        child.setParentRole(parent);
        Member target = member("operator@example.com");
        target.addRole(child);
        when(memberRepository.findWithRolesById(target.getId())).thenReturn(Optional.of(target));
        JwtAuthenticationPrincipal self = new JwtAuthenticationPrincipal(target.getId(), "maker", target.getMakerspaceId(), Set.of());

        UserAccessSummaryResponse summary = readService.userAccessSummary(target.getId(), self);

        assertThat(summary.permissions()).containsExactly("reserve_equipment", "view_equipment");
        assertThat(summary.activeSessions()).isZero();
        assertThat(summary.accountLocked()).isFalse();
    }

    @Test
    void summaryOfForeignMemberIsForbidden() {
        Member target = member("other@example.com");
        when(memberRepository.findWithRolesById(target.getId())).thenReturn(Optional.of(target));
        JwtAuthenticationPrincipal foreignAdmin = new JwtAuthenticationPrincipal(
                UUID.randomUUID(), "makerspace_admin", OTHER_MAKERSPACE_ID, Set.of());

        assertThatThrownBy(() -> readService.userAccessSummary(target.getId(), foreignAdmin))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void failedLoginClustersBecomeAlerts() {
        FailedAttemptCluster burst = cluster("203.0.113.7", 12);
        FailedAttemptCluster trickle = cluster("198.51.100.2", 6);
        when(auditLogRepository.findFailedAttemptClusters(eq(AuditLogService.ACTION_LOGIN), any(), anyLong()))
                .thenReturn(List.of(burst, trickle));

        List<SecurityAlertResponse> alerts = readService.securityAlerts(null, null, 0, 100);

        assertThat(alerts).extracting(SecurityAlertResponse::severity).containsExactly("high", "medium");
        assertThat(alerts).allMatch(alert -> !alert.resolved());
        assertThat(alerts.get(0).details()).containsEntry("attempt_count", 12L).containsEntry("window_hours", 24L);
        assertThat(alerts.get(0).id()).isEqualTo(readService.securityAlerts(null, null, 0, 100).get(0).id());

        assertThat(readService.securityAlerts(null, "medium", 0, 100))
                .extracting(SecurityAlertResponse::ipAddress).containsExactly("198.51.100.2");
    }

    @Test
    void resolvedAlertsAreNeverStored() {
        assertThat(readService.securityAlerts(Boolean.TRUE, null, 0, 100)).isEmpty();
        verifyNoInteractions(auditLogRepository);
    }

    private static FailedAttemptCluster cluster(String ipAddress, long attempts) {
        return new FailedAttemptCluster() {
            @Override
            public String getIpAddress() {
                return ipAddress;
            }

            @Override
            public long getAttempts() {
                return attempts;
            }

            @Override
            public OffsetDateTime getFirstAttemptAt() {
                return NOW.minusHours(2);
            }

            @Override
            public OffsetDateTime getLastAttemptAt() {
                return NOW.minusMinutes(5);
            }
        };
    }
}
