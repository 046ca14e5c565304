package com.makrcave.backend.modules.member.domain;

import static com.makrcave.backend.support.AccessControlFixtures.member;
import static com.makrcave.backend.support.AccessControlFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemberTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T12:00:00Z");
    private static final Duration LOCKOUT = Duration.ofMinutes(30);

    @Test
    void locksOnceThresholdIsReached() {
        Member member = member("maker@example.com");

        assertThat(member.incrementFailedLogin(3, LOCKOUT, NOW)).isFalse();
        assertThat(member.incrementFailedLogin(3, LOCKOUT, NOW)).isFalse();
        assertThat(member.incrementFailedLogin(3, LOCKOUT, NOW)).isTrue();

        assertThat(member.isAccountLocked(NOW)).isTrue();
        assertThat(member.getAccountLockedUntil()).isEqualTo(NOW.plusMinutes(30));
        assertThat(member.getFailedLoginAttempts()).isEqualTo(3);
    }

    @Test
    void furtherFailuresDoNotReportANewLock() {
        Member member = member("maker@example.com");
        member.incrementFailedLogin(1, LOCKOUT, NOW);

        assertThat(member.incrementFailedLogin(1, LOCKOUT, NOW.plusMinutes(1))).isFalse();
        assertThat(member.getAccountLockedUntil()).isEqualTo(NOW.plusMinutes(30));
    }

    @Test
    @DisplayName("an elapsed lock clears itself when the lock state is read")
    void elapsedLockSelfHeals() {
        Member member = member("maker@example.com");
        member.lockUntil(NOW.minusSeconds(1));
        member.incrementFailedLogin(10, LOCKOUT, NOW.minusMinutes(5));

        assertThat(member.isAccountLocked(NOW)).isFalse();
        assertThat(member.isAccountLockedFlag()).isFalse();
        assertThat(member.getFailedLoginAttempts()).isZero();
        assertThat(member.getAccountLockedUntil()).isNull();
    }

    @Test
    void lockWithoutEndStaysLocked() {
        Member member = member("maker@example.com");
        member.lockUntil(null);

        assertThat(member.isAccountLocked(NOW.plusYears(1))).isTrue();
    }

    @Test
    void successfulLoginResetsCounters() {
        Member member = member("maker@example.com");
        member.incrementFailedLogin(5, LOCKOUT, NOW);
        member.incrementFailedLogin(5, LOCKOUT, NOW);

        member.recordSuccessfulLogin(NOW);

        assertThat(member.getFailedLoginAttempts()).isZero();
        assertThat(member.getLastLogin()).isEqualTo(NOW);
        assertThat(member.getLoginCount()).isEqualTo(1);
    }

    @Test
    void onlyLiveSessionsCountTowardsTheCap() {
        Member member = member("maker@example.com");
        member.addSession(new UserSession(member, "live", NOW.minusHours(1), NOW.plusHours(1)));
        member.addSession(new UserSession(member, "expired", NOW.minusHours(2), NOW.minusSeconds(1)));
        UserSession ended = new UserSession(member, "ended", NOW.minusHours(1), NOW.plusHours(1));
        ended.terminate(UserSession.REASON_USER_LOGOUT, NOW.minusMinutes(10));
        member.addSession(ended);

        assertThat(member.countLiveSessions(NOW)).isEqualTo(1);
        assertThat(member.canCreateNewSession(NOW, 2)).isTrue();
        assertThat(member.canCreateNewSession(NOW, 1)).isFalse();
    }

    @Test
    void inactiveOrLockedMemberCannotOpenSessions() {
        Member inactive = member("inactive@example.com");
        inactive.setActive(false);
        Member locked = member("locked@example.com");
        locked.lockUntil(NOW.plusMinutes(5));

        assertThat(inactive.canCreateNewSession(NOW, 5)).isFalse();
        assertThat(locked.canCreateNewSession(NOW, 5)).isFalse();
    }

    @Test
    void terminateAllEndsOnlyLiveSessions() {
        Member member = member("maker@example.com");
        UserSession first = new UserSession(member, "a", NOW.minusHours(1), NOW.plusHours(1));
        UserSession second = new UserSession(member, "b", NOW.minusHours(1), NOW.plusHours(1));
        UserSession expired = new UserSession(member, "c", NOW.minusHours(3), NOW.minusHours(1));
        member.addSession(first);
        member.addSession(second);
        member.addSession(expired);

        assertThat(member.terminateAllSessions(UserSession.REASON_PASSWORD_CHANGED, NOW)).isEqualTo(2);
        assertThat(first.getEndReason()).isEqualTo(UserSession.REASON_PASSWORD_CHANGED);
        assertThat(expired.isActive()).isTrue();
    }

    @Test
    void highestPriorityRoleWins() {
        Member member = member("maker@example.com");
        Role staff = role("Staff");
        staff.setPriorityLevel(500);
        Role maker = role("Maker");
        maker.setPriorityLevel(100);
        member.addRole(maker);
        member.addRole(staff);

        assertThat(member.highestPriorityRole()).contains(staff);
        assertThat(member.holdsRole(staff)).isTrue();
        assertThat(member.removeRole(staff)).isTrue();
        assertThat(member.holdsRole(staff)).isFalse();
    }
}
