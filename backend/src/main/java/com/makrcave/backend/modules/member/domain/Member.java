package com.makrcave.backend.modules.member.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.makrcave.backend.global.jpa.AbstractTimestampedEntity;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.domain.UserSession;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Access-control view of a makerspace member. Profile and membership-plan data belong to the
 * membership service and are not mapped here.
 */
@Entity
@Table(name = "member")
public class Member extends AbstractTimestampedEntity {

    public static final int DEFAULT_MAX_CONCURRENT_SESSIONS = 5;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "makerspace_id", columnDefinition = "uuid")
    private UUID makerspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "primary_role", nullable = false, length = 32)
    private MemberRole primaryRole = MemberRole.MAKER;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "account_locked", nullable = false)
    private boolean accountLocked;

    @Column(name = "account_locked_until")
    private OffsetDateTime accountLockedUntil;

    @Column(name = "last_failed_login")
    private OffsetDateTime lastFailedLogin;

    @Column(name = "last_login")
    private OffsetDateTime lastLogin;

    @Column(name = "login_count", nullable = false)
    private int loginCount;

    @Column(name = "max_concurrent_sessions", nullable = false)
    private int maxConcurrentSessions = DEFAULT_MAX_CONCURRENT_SESSIONS;

    @Column(name = "requires_password_change", nullable = false)
    private boolean requiresPasswordChange;

    @Column(name = "two_factor_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "password_expires_at")
    private OffsetDateTime passwordExpiresAt;

    @ManyToMany
    @JoinTable(
            name = "member_role",
            joinColumns = @JoinColumn(name = "member_id"),
            inverseJoinColumns = @JoinColumn(name = "role_id")
    )
    private Set<Role> roles = new LinkedHashSet<>();

    @OneToMany(mappedBy = "member")
    private List<UserSession> sessions = new ArrayList<>();

    protected Member() {
    }

    public Member(String email, String firstName, String lastName, UUID makerspaceId) {
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.makerspaceId = makerspaceId;
    }

    /**
     * Reports the lock state and clears an elapsed lock as a side effect, so a caller never sees
     * a stale lock once {@code accountLockedUntil} has passed.
     */
    public boolean isAccountLocked(OffsetDateTime now) {
        if (!accountLocked) {
            return false;
        }
        if (accountLockedUntil != null && now.isAfter(accountLockedUntil)) {
            resetFailedLogins();
            return false;
        }
        return true;
    }

    /**
     * Counts one failed login and locks the account once {@code maxAttempts} is reached.
     *
     * @return {@code true} if this attempt locked the account
     */
    public boolean incrementFailedLogin(int maxAttempts, Duration lockoutDuration, OffsetDateTime now) {
        failedLoginAttempts++;
        lastFailedLogin = now;
        if (!accountLocked && failedLoginAttempts >= maxAttempts) {
            accountLocked = true;
            accountLockedUntil = now.plus(lockoutDuration);
            return true;
        }
        return false;
    }

    public void resetFailedLogins() {
        failedLoginAttempts = 0;
        accountLocked = false;
        accountLockedUntil = null;
    }

    public void recordSuccessfulLogin(OffsetDateTime now) {
        resetFailedLogins();
        lastLogin = now;
        loginCount++;
    }

    public long countLiveSessions(OffsetDateTime now) {
        return sessions.stream().filter(session -> session.isLive(now)).count();
    }

    /**
     * Active, unlocked and below {@code sessionCap} live sessions.
     */
    public boolean canCreateNewSession(OffsetDateTime now, int sessionCap) {
        return active && !isAccountLocked(now) && countLiveSessions(now) < sessionCap;
    }

    /**
     * @return number of sessions that were ended
     */
    public int terminateAllSessions(String reason, OffsetDateTime now) {
        int terminated = 0;
        for (UserSession session : sessions) {
            if (session.isLive(now) && session.terminate(reason, now)) {
                terminated++;
            }
        }
        return terminated;
    }

    public Optional<Role> highestPriorityRole() {
        return roles.stream().max(Comparator.comparingInt(Role::getPriorityLevel));
    }

    public boolean holdsRole(Role role) {
        return roles.stream().anyMatch(held -> held == role || (held.getId() != null && held.getId().equals(role.getId())));
    }

    public void addRole(Role role) {
        roles.add(role);
    }

    public boolean removeRole(Role role) {
        return roles.removeIf(held -> held == role || (held.getId() != null && held.getId().equals(role.getId())));
    }

    public void addSession(UserSession session) {
        sessions.add(session);
    }

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public UUID getMakerspaceId() {
        return makerspaceId;
    }

    public void setMakerspaceId(UUID makerspaceId) {
        this.makerspaceId = makerspaceId;
    }

    public MemberRole getPrimaryRole() {
        return primaryRole;
    }

    public void setPrimaryRole(MemberRole primaryRole) {
        this.primaryRole = primaryRole;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public boolean isAccountLockedFlag() {
        return accountLocked;
    }

    public void lockUntil(OffsetDateTime until) {
        this.accountLocked = true;
        this.accountLockedUntil = until;
    }

    public OffsetDateTime getAccountLockedUntil() {
        return accountLockedUntil;
    }

    public OffsetDateTime getLastFailedLogin() {
        return lastFailedLogin;
    }

    public OffsetDateTime getLastLogin() {
        return lastLogin;
    }

    public int getLoginCount() {
        return loginCount;
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public void setMaxConcurrentSessions(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    public boolean isRequiresPasswordChange() {
        return requiresPasswordChange;
    }

    public void setRequiresPasswordChange(boolean requiresPasswordChange) {
        this.requiresPasswordChange = requiresPasswordChange;
    }

    public boolean isTwoFactorEnabled() {
        return twoFactorEnabled;
    }

    public void setTwoFactorEnabled(boolean twoFactorEnabled) {
        this.twoFactorEnabled = twoFactorEnabled;
    }

    public OffsetDateTime getPasswordExpiresAt() {
        return passwordExpiresAt;
    }

    public void setPasswordExpiresAt(OffsetDateTime passwordExpiresAt) {
        this.passwordExpiresAt = passwordExpiresAt;
    }

    public Set<Role> getRoles() {
        return roles;
    }

    public List<UserSession> getSessions() {
        return sessions;
    }
}
