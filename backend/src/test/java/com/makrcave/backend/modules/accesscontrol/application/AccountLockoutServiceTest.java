package com.makrcave.backend.modules.accesscontrol.application;

import static com.makrcave.backend.support.AccessControlFixtures.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountLockoutServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private PasswordPolicyService passwordPolicyService;

    @Mock
    private AuditLogService auditLogService;

    private AccountLockoutService lockoutService;
    private Member member;

    @BeforeEach
    void setUp() {
        lockoutService = new AccountLockoutService(
                memberRepository,
                passwordPolicyService,
                new FixedLockoutDurationStrategy(),
                auditLogService,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
        member = member("locked@example.com");
    }

    @Test
    void locksAtBuiltInThresholdAndEndsSessions() {
        UserSession session = new UserSession(member, "token", NOW.minusMinutes(10), NOW.plusHours(1));
        member.addSession(session);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(passwordPolicyService.effectivePolicyFor(member.getMakerspaceId())).thenReturn(Optional.empty());

        for (int attempt = 1; attempt < AccountLockoutService.DEFAULT_MAX_FAILED_ATTEMPTS; attempt++) {
            assertThat(lockoutService.recordFailedLogin(member.getId(), "10.0.0.9", "curl", null)).isFalse();
        }
        assertThat(lockoutService.recordFailedLogin(member.getId(), "10.0.0.9", "curl", null)).isTrue();

        assertThat(member.isAccountLocked(NOW)).isTrue();
        assertThat(member.getAccountLockedUntil()).isEqualTo(NOW.plusMinutes(30));
        assertThat(session.isActive()).isFalse();
        assertThat(session.getEndReason()).isEqualTo(UserSession.REASON_ACCOUNT_LOCKED);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, times(6)).record(captor.capture());
        List<String> actions = captor.getAllValues().stream().map(AuditLogCommand::actionType).toList();
        assertThat(actions).filteredOn(AccessAuditActions.ACCOUNT_LOCK::equals).hasSize(1);
        assertThat(actions).filteredOn(AuditLogService.ACTION_LOGIN::equals).hasSize(5);
    }

    @Test
    void policyThresholdAndDurationApply() {
        PasswordPolicy policy = new PasswordPolicy(null);
        policy.setMaxFailedAttempts(2);
        policy.setLockoutDurationMinutes(90);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));
        when(passwordPolicyService.effectivePolicyFor(member.getMakerspaceId())).thenReturn(Optional.of(policy));

        lockoutService.recordFailedLogin(member.getId(), null, null, "bad_password");
        boolean locked = lockoutService.recordFailedLogin(member.getId(), null, null, "bad_password");

        assertThat(locked).isTrue();
        assertThat(member.getAccountLockedUntil()).isEqualTo(NOW.plusMinutes(90));
    }

    @Test
    void successfulLoginOnLockedAccountIsRejected() {
        member.lockUntil(NOW.plusMinutes(5));
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));

        assertThatThrownBy(() -> lockoutService.recordSuccessfulLogin(member.getId(), null, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.account_locked"));
        assertThat(member.getLoginCount()).isZero();
    }

    @Test
    void elapsedLockHealsOnSuccessfulLogin() {
        member.lockUntil(NOW.minusMinutes(1));
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));

        lockoutService.recordSuccessfulLogin(member.getId(), "10.0.0.1", "browser");

        assertThat(member.isAccountLockedFlag()).isFalse();
        assertThat(member.getLoginCount()).isEqualTo(1);
        assertThat(member.getLastLogin()).isEqualTo(NOW);
    }

    @Test
    void unlockClearsCounters() {
        member.incrementFailedLogin(1, Duration.ofHours(1), NOW);
        when(memberRepository.findByIdForUpdate(member.getId())).thenReturn(Optional.of(member));

        lockoutService.unlock(member.getId(), null);

        assertThat(member.isAccountLocked(NOW)).isFalse();
        assertThat(member.getFailedLoginAttempts()).isZero();
        verify(auditLogService).record(any(AuditLogCommand.class));
    }
}
