package com.makrcave.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicyValidator;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordValidationResult;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.PasswordPolicyRepository;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlDtoMapper;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreatePasswordPolicyRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.EffectivePasswordPolicyResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PasswordPolicyResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdatePasswordPolicyRequest;
import com.makrcave.backend.modules.audit.application.AuditLogService;

@Service
@Transactional
public class PasswordPolicyService {

    static final String SOURCE_MAKERSPACE = "makerspace";
    static final String SOURCE_GLOBAL = "global";
    static final String SOURCE_BUILT_IN = "built_in";

    private final PasswordPolicyRepository passwordPolicyRepository;
    private final AuditLogService auditLogService;

    public PasswordPolicyService(PasswordPolicyRepository passwordPolicyRepository, AuditLogService auditLogService) {
        this.passwordPolicyRepository = passwordPolicyRepository;
        this.auditLogService = auditLogService;
    }

    public PasswordPolicyResponse createPolicy(
            @NonNull CreatePasswordPolicyRequest request,
            @NonNull JwtAuthenticationPrincipal principal
    ) {
        UUID makerspaceId = principal.isSuperAdmin() ? request.makerspaceId() : principal.makerspaceId();
        if (makerspaceId == null && !principal.isSuperAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Only super admins may create a global password policy");
        }
        ensureNoOtherActivePolicy(makerspaceId, null);

        PasswordPolicy policy = new PasswordPolicy(makerspaceId);
        merge(policy, toUpdate(request));
        ensureLengthBounds(policy);

        PasswordPolicy saved = passwordPolicyRepository.save(policy);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.PASSWORD_POLICY_CREATE,
                AccessAuditActions.RESOURCE_PASSWORD_POLICY,
                saved.getId().toString(),
                principal.userId(),
                makerspaceId,
                Map.of("scope", makerspaceId == null ? SOURCE_GLOBAL : SOURCE_MAKERSPACE)
        ));
        return AccessControlDtoMapper.toPolicyResponse(saved);
    }

    public PasswordPolicyResponse updatePolicy(
            @NonNull UUID policyId,
            @NonNull UpdatePasswordPolicyRequest request,
            @NonNull JwtAuthenticationPrincipal principal
    ) {
        PasswordPolicy policy = passwordPolicyRepository.findById(policyId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.password_policy_not_found",
                        "Password policy " + policyId + " not found"));
        if (!principal.isSuperAdmin() && (policy.isGlobal()
                || !Objects.equals(policy.getMakerspaceId(), principal.makerspaceId()))) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.forbidden",
                    "Password policy belongs to another makerspace");
        }
        if (Boolean.TRUE.equals(request.active()) && !policy.isActive()) {
            ensureNoOtherActivePolicy(policy.getMakerspaceId(), policy.getId());
        }

        merge(policy, request);
        if (request.active() != null) {
            policy.setActive(request.active());
        }
        ensureLengthBounds(policy);

        PasswordPolicy saved = passwordPolicyRepository.save(policy);
        auditLogService.record(AuditLogService.AuditLogCommand.success(
                AccessAuditActions.PASSWORD_POLICY_UPDATE,
                AccessAuditActions.RESOURCE_PASSWORD_POLICY,
                saved.getId().toString(),
                principal.userId(),
                saved.getMakerspaceId(),
                null
        ));
        return AccessControlDtoMapper.toPolicyResponse(saved);
    }

    /**
     * Policies visible to a makerspace, its own first and global ones last. With a {@code null}
     * makerspace every policy is listed.
     */
    @Transactional(readOnly = true)
    public List<PasswordPolicyResponse> listPolicies(UUID makerspaceId) {
        List<PasswordPolicy> policies = makerspaceId == null
                ? passwordPolicyRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"))
                : passwordPolicyRepository.findVisibleTo(makerspaceId);
        return policies.stream().map(AccessControlDtoMapper::toPolicyResponse).toList();
    }

    /**
     * The makerspace's active policy, else the active global policy, else empty (built-in minimum).
     */
    @Transactional(readOnly = true)
    public Optional<PasswordPolicy> effectivePolicyFor(UUID makerspaceId) {
        if (makerspaceId != null) {
            Optional<PasswordPolicy> own = passwordPolicyRepository
                    .findFirstByMakerspaceIdAndActiveTrueOrderByCreatedAtDesc(makerspaceId);
            if (own.isPresent()) {
                return own;
            }
        }
        return passwordPolicyRepository.findFirstByMakerspaceIdIsNullAndActiveTrueOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public EffectivePasswordPolicyResponse describeEffectivePolicy(UUID makerspaceId) {
        return effectivePolicyFor(makerspaceId)
                .map(policy -> new EffectivePasswordPolicyResponse(
                        policy.isGlobal() ? SOURCE_GLOBAL : SOURCE_MAKERSPACE,
                        policy.getMinLength(),
                        AccessControlDtoMapper.toPolicyResponse(policy)))
                .orElseGet(() -> new EffectivePasswordPolicyResponse(
                        SOURCE_BUILT_IN, PasswordPolicyValidator.BUILT_IN_MIN_LENGTH, null));
    }

    @Transactional(readOnly = true)
    public PasswordValidationResult validatePassword(String password, UUID makerspaceId) {
        return PasswordPolicyValidator.validate(password, effectivePolicyFor(makerspaceId).orElse(null));
    }

    private void ensureNoOtherActivePolicy(UUID makerspaceId, UUID currentPolicyId) {
        Optional<PasswordPolicy> active = makerspaceId == null
                ? passwordPolicyRepository.findFirstByMakerspaceIdIsNullAndActiveTrueOrderByCreatedAtDesc()
                : passwordPolicyRepository.findFirstByMakerspaceIdAndActiveTrueOrderByCreatedAtDesc(makerspaceId);
        if (active.isPresent() && !Objects.equals(active.get().getId(), currentPolicyId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.password_policy_exists",
                    makerspaceId == null
                            ? "An active global password policy already exists"
                            : "An active password policy already exists for this makerspace");
        }
    }

    private static void ensureLengthBounds(PasswordPolicy policy) {
        if (policy.getMaxLength() < policy.getMinLength()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_password_policy",
                    "max_length must be greater than min_length");
        }
    }

    private static void merge(PasswordPolicy policy, UpdatePasswordPolicyRequest request) {
        if (request.minLength() != null) {
            policy.setMinLength(request.minLength());
        }
        if (request.maxLength() != null) {
            policy.setMaxLength(request.maxLength());
        }
        if (request.requireUppercase() != null) {
            policy.setRequireUppercase(request.requireUppercase());
        }
        if (request.requireLowercase() != null) {
            policy.setRequireLowercase(request.requireLowercase());
        }
        if (request.requireNumbers() != null) {
            policy.setRequireNumbers(request.requireNumbers());
        }
        if (request.requireSpecialChars() != null) {
            policy.setRequireSpecialChars(request.requireSpecialChars());
        }
        if (request.allowedSpecialChars() != null) {
            policy.setAllowedSpecialChars(request.allowedSpecialChars());
        }
        if (request.preventReuseCount() != null) {
            policy.setPreventReuseCount(request.preventReuseCount());
        }
        if (request.maxAgeDays() != null) {
            policy.setMaxAgeDays(request.maxAgeDays());
        }
        if (request.warnBeforeExpiryDays() != null) {
            policy.setWarnBeforeExpiryDays(request.warnBeforeExpiryDays());
        }
        if (request.maxFailedAttempts() != null) {
            policy.setMaxFailedAttempts(request.maxFailedAttempts());
        }
        if (request.lockoutDurationMinutes() != null) {
            policy.setLockoutDurationMinutes(request.lockoutDurationMinutes());
        }
        if (request.progressiveLockout() != null) {
            policy.setProgressiveLockout(request.progressiveLockout());
        }
        if (request.requireTwoFactor() != null) {
            policy.setRequireTwoFactor(request.requireTwoFactor());
        }
        if (request.requireTwoFactorForRoles() != null) {
            policy.setRequireTwoFactorForRoles(new ArrayList<>(request.requireTwoFactorForRoles()));
        }
        if (request.allowedTwoFactorMethods() != null) {
            policy.setAllowedTwoFactorMethods(new ArrayList<>(request.allowedTwoFactorMethods()));
        }
        if (request.sessionTimeoutMinutes() != null) {
            policy.setSessionTimeoutMinutes(request.sessionTimeoutMinutes());
        }
        if (request.idleTimeoutMinutes() != null) {
            policy.setIdleTimeoutMinutes(request.idleTimeoutMinutes());
        }
        if (request.maxConcurrentSessions() != null) {
            policy.setMaxConcurrentSessions(request.maxConcurrentSessions());
        }
        if (request.forceLogoutOnPasswordChange() != null) {
            policy.setForceLogoutOnPasswordChange(request.forceLogoutOnPasswordChange());
        }
    }

    private static UpdatePasswordPolicyRequest toUpdate(CreatePasswordPolicyRequest request) {
        return new UpdatePasswordPolicyRequest(
                request.minLength(),
                request.maxLength(),
                request.requireUppercase(),
                request.requireLowercase(),
                request.requireNumbers(),
                request.requireSpecialChars(),
                request.allowedSpecialChars(),
                request.preventReuseCount(),
                request.maxAgeDays(),
                request.warnBeforeExpiryDays(),
                request.maxFailedAttempts(),
                request.lockoutDurationMinutes(),
                request.progressiveLockout(),
                request.requireTwoFactor(),
                request.requireTwoFactorForRoles(),
                request.allowedTwoFactorMethods(),
                request.sessionTimeoutMinutes(),
                request.idleTimeoutMinutes(),
                request.maxConcurrentSessions(),
                request.forceLogoutOnPasswordChange(),
                null
        );
    }
}
