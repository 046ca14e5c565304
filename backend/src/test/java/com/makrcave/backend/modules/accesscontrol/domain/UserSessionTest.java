package com.makrcave.backend.modules.accesscontrol.domain;

import static com.makrcave.backend.support.AccessControlFixtures.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import org.junit.jupiter.api.Test;

class UserSessionTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T12:00:00Z");

    @Test
    void activeButPastExpiryIsNotLive() {
        UserSession session = new UserSession(member("maker@example.com"), "token", NOW.minusHours(1), NOW.minusSeconds(1));

        assertThat(session.isActive()).isTrue();
        assertThat(session.isExpired(NOW)).isTrue();
        assertThat(session.isLive(NOW)).isFalse();
    }

    @Test
    void sessionIsLiveUpToItsExpiry() {
        UserSession session = new UserSession(member("maker@example.com"), "token", NOW.minusHours(1), NOW);

        assertThat(session.isExpired(NOW)).isFalse();
        assertThat(session.isLive(NOW)).isTrue();
    }

    @Test
    void terminateOnlyOnce() {
        UserSession session = new UserSession(member("maker@example.com"), "token", NOW.minusHours(1), NOW.plusHours(1));

        assertThat(session.terminate(UserSession.REASON_USER_LOGOUT, NOW)).isTrue();
        assertThat(session.terminate(UserSession.REASON_ADMIN_TERMINATED, NOW.plusMinutes(1))).isFalse();
        assertThat(session.getEndReason()).isEqualTo(UserSession.REASON_USER_LOGOUT);
        assertThat(session.getEndedAt()).isEqualTo(NOW);
        assertThat(session.isLive(NOW)).isFalse();
    }

    @Test
    void extendMovesExpiryFromNow() {
        UserSession session = new UserSession(member("maker@example.com"), "token", NOW.minusHours(1), NOW.plusMinutes(5));

        session.extend(90, NOW);

        assertThat(session.getExpiresAt()).isEqualTo(NOW.plusMinutes(90));
        assertThat(session.getLastActivity()).isEqualTo(NOW);
        assertThatThrownBy(() -> session.extend(0, NOW)).isInstanceOf(IllegalArgumentException.class);
    }
}
