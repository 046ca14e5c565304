package com.makrcave.backend.modules.accesscontrol.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.makrcave.backend.modules.member.domain.Member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Login session of a member. Expiry is evaluated lazily: a session past {@code expiresAt} counts
 * as inactive even while {@code is_active} is still true.
 */
@Entity
@Table(name = "user_session")
public class UserSession {

    public static final String REASON_USER_LOGOUT = "user_logout";
    public static final String REASON_ADMIN_TERMINATED = "admin_terminated";
    public static final String REASON_PASSWORD_CHANGED = "password_changed";
    public static final String REASON_ACCOUNT_LOCKED = "account_locked";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false, updatable = false)
    private Member member;

    @Column(name = "session_token", nullable = false, unique = true, length = 255)
    private String sessionToken;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "text")
    private String userAgent;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "last_activity", nullable = false)
    private OffsetDateTime lastActivity;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "two_factor_verified", nullable = false)
    private boolean twoFactorVerified;

    @Column(name = "login_method", length = 50)
    private String loginMethod;

    @Column(name = "device_fingerprint", length = 255)
    private String deviceFingerprint;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Column(name = "end_reason", length = 100)
    private String endReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected UserSession() {
    }

    public UserSession(Member member, String sessionToken, OffsetDateTime startedAt, OffsetDateTime expiresAt) {
        this.member = member;
        this.sessionToken = sessionToken;
        this.lastActivity = startedAt;
        this.createdAt = startedAt;
        this.expiresAt = expiresAt;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = lastActivity;
        }
    }

    public boolean isExpired(OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }

    /**
     * Active flag and expiry combined; the only predicate to use when counting sessions.
     */
    public boolean isLive(OffsetDateTime now) {
        return active && !isExpired(now);
    }

    /**
     * @return {@code false} when the session was already ended
     */
    public boolean terminate(String reason, OffsetDateTime now) {
        if (!active) {
            return false;
        }
        active = false;
        endedAt = now;
        endReason = reason;
        return true;
    }

    public void extend(int minutes, OffsetDateTime now) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        expiresAt = now.plusMinutes(minutes);
        lastActivity = now;
    }

    public UUID getId() {
        return id;
    }

    public Member getMember() {
        return member;
    }

    public String getSessionToken() {
        return sessionToken;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getLastActivity() {
        return lastActivity;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isTwoFactorVerified() {
        return twoFactorVerified;
    }

    public void setTwoFactorVerified(boolean twoFactorVerified) {
        this.twoFactorVerified = twoFactorVerified;
    }

    public String getLoginMethod() {
        return loginMethod;
    }

    public void setLoginMethod(String loginMethod) {
        this.loginMethod = loginMethod;
    }

    public String getDeviceFingerprint() {
        return deviceFingerprint;
    }

    public void setDeviceFingerprint(String deviceFingerprint) {
        this.deviceFingerprint = deviceFingerprint;
    }

    public OffsetDateTime getEndedAt() {
        return endedAt;
    }

    public String getEndReason() {
        return endReason;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
