package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Duration;

import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.member.domain.Member;

/**
 * Decides how long an account stays locked once it reaches its failed login limit.
 * Replace the bean to implement escalating (progressive) lockouts.
 */
public interface LockoutDurationStrategy {

    /**
     * @param policy effective policy for the member's makerspace, {@code null} when none applies
     */
    Duration lockoutDuration(Member member, PasswordPolicy policy);
}
