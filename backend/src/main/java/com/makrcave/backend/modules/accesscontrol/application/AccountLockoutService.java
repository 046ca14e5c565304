package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

/**
 * Failed login bookkeeping. Credentials are checked elsewhere; this service is told the outcome.
 */
@Service
@Transactional
public class AccountLockoutService {

    private static final Logger log = LoggerFactory.getLogger(AccountLockoutService.class);

    static final int DEFAULT_MAX_FAILED_ATTEMPTS = 5;

    private final MemberRepository memberRepository;
    private final PasswordPolicyService passwordPolicyService;
    private final LockoutDurationStrategy lockoutDurationStrategy;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AccountLockoutService(
            MemberRepository memberRepository,
            PasswordPolicyService passwordPolicyService,
            LockoutDurationStrategy lockoutDurationStrategy,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.memberRepository = memberRepository;
        this.passwordPolicyService = passwordPolicyService;
        this.lockoutDurationStrategy = lockoutDurationStrategy;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * @return {@code true} if this failure locked the account
     */
    public boolean recordFailedLogin(@NonNull UUID userId, String ipAddress, String userAgent, String failureReason) {
        Member member = lockMember(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        // clears an elapsed lock before counting
        member.isAccountLocked(now);

        PasswordPolicy policy = passwordPolicyService.effectivePolicyFor(member.getMakerspaceId()).orElse(null);
        int maxAttempts = policy != null ? policy.getMaxFailedAttempts() : DEFAULT_MAX_FAILED_ATTEMPTS;
        Duration lockout = lockoutDurationStrategy.lockoutDuration(member, policy);

        boolean lockedNow = member.incrementFailedLogin(maxAttempts, lockout, now);
        if (lockedNow) {
            int terminated = member.terminateAllSessions(UserSession.REASON_ACCOUNT_LOCKED, now);
            log.info("Account {} locked until {} after {} failed logins; {} sessions ended",
                    userId, member.getAccountLockedUntil(), member.getFailedLoginAttempts(), terminated);
            auditLogService.record(AuditLogService.AuditLogCommand.success(
                    AccessAuditActions.ACCOUNT_LOCK,
                    AccessAuditActions.RESOURCE_MEMBER,
                    userId.toString(),
                    userId,
                    member.getMakerspaceId(),
                    Map.of("lockedUntil", member.getAccountLockedUntil().toString())
            ));
        }
        memberRepository.save(member);

        recordLogin(member, ipAddress, userAgent, false,
                failureReason != null ? failureReason : "invalid_credentials");
        return lockedNow;
    }

    public void recordSuccessfulLogin(@NonNull UUID userId, String ipAddress, String userAgent) {
        Member member = lockMember(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (member.isAccountLocked(now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.account_locked",
                    "Account is locked until " + member.getAccountLockedUntil());
        }
        member.recordSuccessfulLogin(now);
        memberRepository.save(member);
        recordLogin(member, ipAddress, userAgent, true, null);
    }

    public void unlock(@NonNull UUID userId, UUID actorId) {
        Member member = lockMember(userId);
        member.resetFailedLogins();
        memberRepository.save(member);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.ACCOUNT_UNLOCK,
                AccessAuditActions.RESOURCE_MEMBER,
                userId.toString(),
                actorId,
                member.getMakerspaceId(),
                null
        ));
        log.info("Account {} unlocked by {}", userId, actorId);
    }

    private void recordLogin(Member member, String ipAddress, String userAgent, boolean success, String failureReason) {
        auditLogService.record(new AuditLogService.AuditLogCommand(
                AuditLogService.ACTION_LOGIN,
                AccessAuditActions.RESOURCE_MEMBER,
                member.getId().toString(),
                member.getId(),
                member.getMakerspaceId(),
                null,
                ipAddress,
                userAgent,
                success,
                failureReason,
                null,
                null
        ));
    }

    private Member lockMember(UUID userId) {
        return memberRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + userId + " not found"));
    }
}
