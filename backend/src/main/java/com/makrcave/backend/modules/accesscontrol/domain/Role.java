package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.makrcave.backend.global.jpa.AbstractTimestampedEntity;
import com.makrcave.backend.modules.member.domain.Member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.LastModifiedBy;

/**
 * A prioritised bundle of permissions, optionally scoped to one makerspace and optionally
 * inheriting from a parent role. The parent link is not guaranteed acyclic in stored data;
 * resolve effective permissions through {@link RoleHierarchyResolver}.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    public static final int DEFAULT_SESSION_TIMEOUT_MINUTES = 480;
    public static final int DEFAULT_MAX_CONCURRENT_SESSIONS = 5;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "role_type", nullable = false, length = 32)
    private RoleType roleType = RoleType.CUSTOM;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_assignable", nullable = false)
    private boolean assignable = true;

    @Column(name = "max_assignments")
    private Integer maxAssignments;

    @Column(name = "makerspace_id", columnDefinition = "uuid")
    private UUID makerspaceId;

    @Column(name = "is_default", nullable = false)
    private boolean defaultRole;

    @Column(name = "priority_level", nullable = false)
    private int priorityLevel;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_role_id")
    private Role parentRole;

    @ManyToMany
    @JoinTable(
            name = "role_permission",
            joinColumns = @JoinColumn(name = "role_id"),
            inverseJoinColumns = @JoinColumn(name = "permission_id")
    )
    private Set<Permission> permissions = new LinkedHashSet<>();

    @Column(name = "session_timeout_minutes", nullable = false)
    private int sessionTimeoutMinutes = DEFAULT_SESSION_TIMEOUT_MINUTES;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "allowed_ip_ranges", columnDefinition = "jsonb")
    private List<String> allowedIpRanges = new ArrayList<>();

    @Column(name = "requires_two_factor", nullable = false)
    private boolean requiresTwoFactor;

    @Column(name = "max_concurrent_sessions", nullable = false)
    private int maxConcurrentSessions = DEFAULT_MAX_CONCURRENT_SESSIONS;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "feature_flags", columnDefinition = "jsonb")
    private Map<String, Object> featureFlags = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "dashboard_config", columnDefinition = "jsonb")
    private Map<String, Object> dashboardConfig = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "menu_restrictions", columnDefinition = "jsonb")
    private Map<String, Object> menuRestrictions = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "required_membership_plans", columnDefinition = "jsonb")
    private List<String> requiredMembershipPlans = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "excluded_membership_plans", columnDefinition = "jsonb")
    private List<String> excludedMembershipPlans = new ArrayList<>();

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @LastModifiedBy
    @Column(name = "last_modified_by")
    private UUID lastModifiedBy;

    protected Role() {
    }

    public Role(String name, RoleType roleType, boolean system) {
        this.name = name;
        this.roleType = roleType;
        this.system = system;
    }

    /**
     * Reason this role cannot be granted to {@code member}, or empty when it can.
     *
     * @param currentHolders number of members holding the role right now
     */
    public Optional<String> assignmentBlocker(Member member, long currentHolders) {
        if (!active) {
            return Optional.of("Role '%s' is not active".formatted(name));
        }
        if (!assignable) {
            return Optional.of("Role '%s' is not assignable".formatted(name));
        }
        if (makerspaceId != null && !Objects.equals(makerspaceId, member.getMakerspaceId())) {
            return Optional.of("Role '%s' belongs to a different makerspace".formatted(name));
        }
        if (maxAssignments != null && currentHolders >= maxAssignments) {
            return Optional.of("Role '%s' has reached its maximum of %d assignments".formatted(name, maxAssignments));
        }
        return Optional.empty();
    }

    public boolean canAssignTo(Member member, long currentHolders) {
        return assignmentBlocker(member, currentHolders).isEmpty();
    }

    public boolean isGlobal() {
        return makerspaceId == null;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public RoleType getRoleType() {
        return roleType;
    }

    public void setRoleType(RoleType roleType) {
        this.roleType = roleType;
    }

    public boolean isSystem() {
        return system;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isAssignable() {
        return assignable;
    }

    public void setAssignable(boolean assignable) {
        this.assignable = assignable;
    }

    public Integer getMaxAssignments() {
        return maxAssignments;
    }

    public void setMaxAssignments(Integer maxAssignments) {
        this.maxAssignments = maxAssignments;
    }

    public UUID getMakerspaceId() {
        return makerspaceId;
    }

    public void setMakerspaceId(UUID makerspaceId) {
        this.makerspaceId = makerspaceId;
    }

    public boolean isDefaultRole() {
        return defaultRole;
    }

    public void setDefaultRole(boolean defaultRole) {
        this.defaultRole = defaultRole;
    }

    public int getPriorityLevel() {
        return priorityLevel;
    }

    public void setPriorityLevel(int priorityLevel) {
        this.priorityLevel = priorityLevel;
    }

    public Role getParentRole() {
        return parentRole;
    }

    public void setParentRole(Role parentRole) {
        this.parentRole = parentRole;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public void replacePermissions(Set<Permission> replacement) {
        permissions.clear();
        if (replacement != null) {
            permissions.addAll(replacement);
        }
    }

    public void addPermission(Permission permission) {
        permissions.add(permission);
    }

    public int getSessionTimeoutMinutes() {
        return sessionTimeoutMinutes;
    }

    public void setSessionTimeoutMinutes(int sessionTimeoutMinutes) {
        this.sessionTimeoutMinutes = sessionTimeoutMinutes;
    }

    public List<String> getAllowedIpRanges() {
        return allowedIpRanges;
    }

    public void setAllowedIpRanges(List<String> allowedIpRanges) {
        this.allowedIpRanges = allowedIpRanges == null ? new ArrayList<>() : new ArrayList<>(allowedIpRanges);
    }

    public boolean isRequiresTwoFactor() {
        return requiresTwoFactor;
    }

    public void setRequiresTwoFactor(boolean requiresTwoFactor) {
        this.requiresTwoFactor = requiresTwoFactor;
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    public void setMaxConcurrentSessions(int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    public Map<String, Object> getFeatureFlags() {
        return featureFlags;
    }

    public void setFeatureFlags(Map<String, Object> featureFlags) {
        this.featureFlags = featureFlags == null ? new HashMap<>() : new HashMap<>(featureFlags);
    }

    public Map<String, Object> getDashboardConfig() {
        return dashboardConfig;
    }

    public void setDashboardConfig(Map<String, Object> dashboardConfig) {
        this.dashboardConfig = dashboardConfig == null ? new HashMap<>() : new HashMap<>(dashboardConfig);
    }

    public Map<String, Object> getMenuRestrictions() {
        return menuRestrictions;
    }

    public void setMenuRestrictions(Map<String, Object> menuRestrictions) {
        this.menuRestrictions = menuRestrictions == null ? new HashMap<>() : new HashMap<>(menuRestrictions);
    }

    public List<String> getRequiredMembershipPlans() {
        return requiredMembershipPlans;
    }

    public void setRequiredMembershipPlans(List<String> requiredMembershipPlans) {
        this.requiredMembershipPlans = requiredMembershipPlans == null ? new ArrayList<>() : new ArrayList<>(requiredMembershipPlans);
    }

    public List<String> getExcludedMembershipPlans() {
        return excludedMembershipPlans;
    }

    public void setExcludedMembershipPlans(List<String> excludedMembershipPlans) {
        this.excludedMembershipPlans = excludedMembershipPlans == null ? new ArrayList<>() : new ArrayList<>(excludedMembershipPlans);
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public UUID getLastModifiedBy() {
        return lastModifiedBy;
    }
}
