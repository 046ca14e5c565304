package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.springframework.data.annotation.CreatedBy;

@Entity
@Table(name = "password_policy")
public class PasswordPolicy extends AbstractTimestampedEntity {

    public static final String DEFAULT_SPECIAL_CHARS = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    public static final List<String> DEFAULT_TWO_FACTOR_METHODS = List.of("totp", "sms", "email");

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    /** {@code null} marks the global fallback policy. */
    @Column(name = "makerspace_id", updatable = false, columnDefinition = "uuid")
    private UUID makerspaceId;

    @Column(name = "min_length", nullable = false)
    private int minLength = 8;

    @Column(name = "max_length", nullable = false)
    private int maxLength = 128;

    @Column(name = "require_uppercase", nullable = false)
    private boolean requireUppercase = true;

    @Column(name = "require_lowercase", nullable = false)
    private boolean requireLowercase = true;

    @Column(name = "require_numbers", nullable = false)
    private boolean requireNumbers = true;

    @Column(name = "require_special_chars", nullable = false)
    private boolean requireSpecialChars = true;

    @Column(name = "allowed_special_chars", nullable = false, length = 100)
    private String allowedSpecialChars = DEFAULT_SPECIAL_CHARS;

    @Column(name = "prevent_reuse_count", nullable = false)
    private int preventReuseCount = 5;

    @Column(name = "max_age_days", nullable = false)
    private int maxAgeDays = 90;

    @Column(name = "warn_before_expiry_days", nullable = false)
    private int warnBeforeExpiryDays = 7;

    @Column(name = "max_failed_attempts", nullable = false)
    private int maxFailedAttempts = 5;

    @Column(name = "lockout_duration_minutes", nullable = false)
    private int lockoutDurationMinutes = 30;

    @Column(name = "progressive_lockout", nullable = false)
    private boolean progressiveLockout = true;

    @Column(name = "require_2fa", nullable = false)
    private boolean requireTwoFactor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "require_2fa_for_roles", columnDefinition = "jsonb")
    private List<String> requireTwoFactorForRoles = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "allowed_2fa_methods", columnDefinition = "jsonb")
    private List<String> allowedTwoFactorMethods = new ArrayList<>(DEFAULT_TWO_FACTOR_METHODS);

    @Column(name = "session_timeout_minutes", nullable = false)
    private int sessionTimeoutMinutes = 480;

    @Column(name = "idle_timeout_minutes", nullable = false)
    private int idleTimeoutMinutes = 60;

    @Column(name = "max_concurrent_sessions", nullable = false)
    private int maxConcurrentSessions = 3;

    @Column(name = "force_logout_on_password_change", nullable = false)
    private boolean forceLogoutOnPasswordChange = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    protected PasswordPolicy() {
    }

    public PasswordPolicy(UUID makerspaceId) {
        this.makerspaceId = makerspaceId;
    }

    public boolean isGlobal() {
        return makerspaceId == null;
    }

    public UUID getId() {
        return id;
    }

    public UUID getMakerspaceId() {
        return makerspaceId;
    }

    public int getMinLength() {
        return minLength;
    }

    public void setMinLength(int minLength) {
        this.minLength = minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public boolean isRequireUppercase() {
        return requireUppercase;
    }

    public void setRequireUppercase(boolean requireUppercase) {
        this.requireUppercase = requireUppercase;
    }

    public boolean isRequireLowercase() {
        return requireLowercase;
    }

    public void setRequireLowercase(boolean requireLowercase) {
        this.requireLowercase = requireLowercase;
    }

    public boolean isRequireNumbers() {
        return requireNumbers;
    }

    public void setRequireNumbers(boolean requireNumbers) {
        this.requireNumbers = requireNumbers;
    }

    public boolean isRequireSpecialChars() {
        return requireSpecialChars;
    }

    public void setRequireSpecialChars(boolean requireSpecialChars) {
        this.requireSpecialChars = requireSpecialChars;
    }

    public String getAllowedSpecialChars() {
        return allowedSpecialChars;
    }

    public void setAllowedSpecialChars(String allowedSpecialChars) {
        this.allowedSpecialChars = allowedSpecialChars;
    }

    public int getPreventReuseCount() {
        return preventReuseCount;
    }

    public void setPreventReuseCount(int preventReuseCount) {
        this.preventReuseCount = preventReuseCount;
    }

    public int getMaxAgeDays() {
        return maxAgeDays;
    }

    public void setMaxAgeDays(int maxAgeDays) {
        this.maxAgeDays = maxAgeDays;
    }

    public int getWarnBeforeExpiryDays() {
        return warnBeforeExpiryDays;
    }

    public void setWarnBeforeExpiryDays(int warnBeforeExpiryDays) {
        this.warnBeforeExpiryDays = warnBeforeExpiryDays;
    }

    public int getMaxFailedAttempts() {
        return maxFailedAttempts;
    }

    public void setMaxFailedAttempts(int maxFailedAttempts) {
        this.maxFailedAttempts = maxFailedAttempts;
    }

    public int getLockoutDurationMinutes() {
        return lockoutDurationMinutes;
    }

    public void setLockoutDurationMinutes(int lockoutDurationMinutes) {
        this.lockoutDurationMinutes = lockoutDurationMinutes;
    }

    public boolean isProgressiveLockout() {
        return progressiveLockout;
    }

    public void setProgressiveLockout(boolean progressiveLockout) {
        this.progressiveLockout = progressiveLockout;
    }

    public boolean isRequireTwoFactor() {
        return requireTwoFactor;
    }

    public void setRequireTwoFactor(boolean requireTwoFactor) {
        this.requireTwoFactor = requireTwoFactor;
    }

    public List<String> getRequireTwoFactorForRoles() {
        return requireTwoFactorForRoles;
    }

    public void setRequireTwoFactorForRoles(List<String> requireTwoFactorForRoles) {
        this.requireTwoFactorForRoles = requireTwoFactorForRoles == null ? new ArrayList<>() : new ArrayList<>(requireTwoFactorForRoles);
    }

    public List<String> getAllowedTwoFactorMethods() {
        return allowedTwoFactorMethods;
    }

    public void setAllowedTwoFactorMethods(List<String> allowedTwoFactorMethods) {
        this.allowedTwoFactorMethods = allowedTwoFactorMethods == null ? new ArrayList<>() : new ArrayList<>(allowedTwoFactorMethods);
    }

    public int getSessionTimeoutMinutes() {
        return sessionTimeoutMinutes;
    }

    public void setSessionTimeoutMinutes(int sessionTimeoutMinutes) {
        this.sessionTimeoutMinutes = sessionTimeoutMinutes;
    }

    public int getIdleTimeoutMinutes() {
        return idleTimeoutMinutes;
    }

    public void setIdleTimeoutMinutes(int idleTimeoutMinutes) {
        this.idleTimeoutMinutes = idleTimeoutMinutes;
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public void setMaxConcurrentSessions(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    public boolean isForceLogoutOnPasswordChange() {
        return forceLogoutOnPasswordChange;
    }

    public void setForceLogoutOnPasswordChange(boolean forceLogoutOnPasswordChange) {
        this.forceLogoutOnPasswordChange = forceLogoutOnPasswordChange;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }
}
