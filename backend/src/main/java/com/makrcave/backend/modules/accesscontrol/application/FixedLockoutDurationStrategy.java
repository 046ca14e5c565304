package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.member.domain.Member;

/**
 * Always the policy's configured duration, whatever {@code progressive_lockout} says.
 */
@Component
public class FixedLockoutDurationStrategy implements LockoutDurationStrategy {

    static final int DEFAULT_LOCKOUT_MINUTES = 30;

    @Override
    public Duration lockoutDuration(Member member, PasswordPolicy policy) {
        int minutes = policy != null ? policy.getLockoutDurationMinutes() : DEFAULT_LOCKOUT_MINUTES;
        return Duration.ofMinutes(minutes);
    }
}
