package com.makrcave.backend.modules.accesscontrol.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.UserSessionRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreateSessionRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UserSessionResponse;
import com.makrcave.backend.modules.audit.application.AuditLogService;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;

@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final MemberRepository memberRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordPolicyService passwordPolicyService;
    private final AccessGuard accessGuard;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final int defaultSessionTimeoutMinutes;

    public SessionService(
            MemberRepository memberRepository,
            UserSessionRepository userSessionRepository,
            PasswordPolicyService passwordPolicyService,
            AccessGuard accessGuard,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${makrcave.access-control.default-session-timeout-minutes:480}") int defaultSessionTimeoutMinutes
    ) {
        this.memberRepository = memberRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordPolicyService = passwordPolicyService;
        this.accessGuard = accessGuard;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.defaultSessionTimeoutMinutes = defaultSessionTimeoutMinutes;
    }

    public UserSessionResponse openSession(@NonNull CreateSessionRequest request, UUID actorId) {
        Member member = memberRepository.findByIdForUpdate(request.userId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + request.userId() + " not found"));
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (member.isAccountLocked(now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.account_locked",
                    "Account is locked until " + member.getAccountLockedUntil());
        }
        if (!member.isActive()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.member_inactive", "Account is not active");
        }

        Optional<PasswordPolicy> policy = passwordPolicyService.effectivePolicyFor(member.getMakerspaceId());
        int cap = resolveSessionCap(member, policy.orElse(null));
        if (!member.canCreateNewSession(now, cap)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.session_limit_reached",
                    "Maximum concurrent sessions (" + cap + ") reached");
        }
        if (userSessionRepository.findBySessionToken(request.sessionToken()).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.session_token_in_use",
                    "Session token is already registered");
        }

        OffsetDateTime expiresAt = request.expiresAt() != null
                ? request.expiresAt()
                : now.plusMinutes(policy.map(PasswordPolicy::getSessionTimeoutMinutes).orElse(defaultSessionTimeoutMinutes));
        if (!expiresAt.isAfter(now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_session_expiry",
                    "Session expiry must be in the future");
        }

        UserSession session = new UserSession(member, request.sessionToken(), now, expiresAt);
        session.setIpAddress(request.ipAddress());
        session.setUserAgent(request.userAgent());
        session.setLocation(request.location());
        session.setTwoFactorVerified(request.twoFactorVerified());
        session.setLoginMethod(request.loginMethod());
        session.setDeviceFingerprint(request.deviceFingerprint());
        member.addSession(session);
        UserSession saved = userSessionRepository.save(session);

        auditLogService.record(new AuditLogService.AuditLogCommand(
                AccessAuditActions.SESSION_CREATE,
                AccessAuditActions.RESOURCE_SESSION,
                saved.getId().toString(),
                actorId,
                member.getMakerspaceId(),
                saved.getId(),
                request.ipAddress(),
                request.userAgent(),
                true,
                null,
                null,
                Map.of("userId", member.getId().toString(), "expiresAt", expiresAt.toString())
        ));
        return AccessControlDtoMapper.toSessionResponse(saved, now);
    }

    @Transactional(readOnly = true)
    public List<UserSessionResponse> listSessions(@NonNull UUID userId, boolean activeOnly) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UserSession> sessions = activeOnly
                ? userSessionRepository.findLiveByMemberId(userId, now)
                : userSessionRepository.findByMember_IdOrderByLastActivityDesc(userId);
        return sessions.stream()
                .map(session -> AccessControlDtoMapper.toSessionResponse(session, now))
                .toList();
    }

    /**
     * Owners may end their own sessions; anyone else needs {@code manage_sessions}.
     */
    public void terminateSession(@NonNull UUID sessionId, String reason, @NonNull JwtAuthenticationPrincipal principal) {
        UserSession session = loadSession(sessionId);
        UUID ownerId = session.getMember().getId();
        requireOwnerOrManager(principal, session);

        String endReason = StringUtils.hasText(reason)
                ? reason.trim()
                : ownerId.equals(principal.userId()) ? UserSession.REASON_USER_LOGOUT : UserSession.REASON_ADMIN_TERMINATED;
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!session.terminate(endReason, now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.session_not_active",
                    "Session is already terminated");
        }
        userSessionRepository.save(session);

        auditLogService.record(new AuditLogService.AuditLogCommand(
                AccessAuditActions.SESSION_TERMINATE,
                AccessAuditActions.RESOURCE_SESSION,
                sessionId.toString(),
                principal.userId(),
                session.getMember().getMakerspaceId(),
                sessionId,
                null,
                null,
                true,
                null,
                null,
                Map.of("reason", endReason, "userId", ownerId.toString())
        ));
    }

    public UserSessionResponse extendSession(
            @NonNull UUID sessionId,
            int minutes,
            @NonNull JwtAuthenticationPrincipal principal
    ) {
        UserSession session = loadSession(sessionId);
        requireOwnerOrManager(principal, session);
        if (!session.isActive()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.session_not_active",
                    "Cannot extend a terminated session");
        }
        if (minutes <= 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bad_request", "minutes must be positive");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        session.extend(minutes, now);
        UserSession saved = userSessionRepository.save(session);

        auditLogService.record(new AuditLogService.AuditLogCommand(
                AccessAuditActions.SESSION_EXTEND,
                AccessAuditActions.RESOURCE_SESSION,
                sessionId.toString(),
                principal.userId(),
                session.getMember().getMakerspaceId(),
                sessionId,
                null,
                null,
                true,
                null,
                null,
                Map.of("minutes", minutes, "expiresAt", saved.getExpiresAt().toString())
        ));
        return AccessControlDtoMapper.toSessionResponse(saved, now);
    }

    /**
     * Ends every live session of a member, e.g. after a password change.
     *
     * @return number of sessions ended
     */
    public int terminateAllSessions(@NonNull UUID userId, String reason, UUID actorId) {
        Member member = memberRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.member_not_found",
                        "User " + userId + " not found"));
        String endReason = StringUtils.hasText(reason) ? reason.trim() : UserSession.REASON_ADMIN_TERMINATED;
        int terminated = member.terminateAllSessions(endReason, OffsetDateTime.now(clock));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reason", endReason);
        detail.put("terminated", terminated);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.SESSION_TERMINATE_ALL,
                AccessAuditActions.RESOURCE_MEMBER,
                userId.toString(),
                actorId,
                member.getMakerspaceId(),
                detail
        ));
        log.info("Terminated {} sessions of member {} ({})", terminated, userId, endReason);
        return terminated;
    }

    /**
     * Smallest of the member's own limit, the limit of its highest priority role and the policy limit.
     */
    static int resolveSessionCap(Member member, PasswordPolicy policy) {
        int cap = member.getMaxConcurrentSessions();
        Optional<Role> topRole = member.highestPriorityRole();
        if (topRole.isPresent()) {
            cap = Math.min(cap, topRole.get().getMaxConcurrentSessions());
        }
        if (policy != null) {
            cap = Math.min(cap, policy.getMaxConcurrentSessions());
        }
        return cap;
    }

    /**
     * Owners pass; anyone else needs {@code manage_sessions} within the owner's makerspace.
     */
    private void requireOwnerOrManager(JwtAuthenticationPrincipal principal, UserSession session) {
        Member owner = session.getMember();
        if (owner.getId().equals(principal.userId())) {
            return;
        }
        accessGuard.require(principal, AccessGuard.MANAGE_SESSIONS);
        accessGuard.requireMakerspaceAccess(principal, owner.getMakerspaceId());
    }

    private UserSession loadSession(UUID sessionId) {
        return userSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.session_not_found",
                        "Session " + sessionId + " not found"));
    }
}
