package com.makrcave.backend.modules.accesscontrol.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.makrcave.backend.modules.member.domain.Member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One grant or revocation of a role, with the member's complete effective permission set
 * before and after the change. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "role_assignment_log")
public class RoleAssignmentLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    // plain columns: the ledger outlives deleted custom roles
    @Column(name = "role_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID roleId;

    @Column(name = "role_name", nullable = false, updatable = false, length = 100)
    private String roleName;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false, updatable = false)
    private Member member;

    @Column(name = "modified_by", updatable = false, columnDefinition = "uuid")
    private UUID modifiedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 16)
    private RoleAssignmentAction action;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "previous_permissions", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> previousPermissions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_permissions", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> newPermissions;

    @Column(name = "reason", updatable = false, columnDefinition = "text")
    private String reason;

    @Column(name = "effective_date", updatable = false)
    private OffsetDateTime effectiveDate;

    @Column(name = "expiry_date", updatable = false)
    private OffsetDateTime expiryDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected RoleAssignmentLog() {
    }

    private RoleAssignmentLog(Builder builder) {
        this.roleId = builder.role.getId();
        this.roleName = builder.role.getName();
        this.member = builder.member;
        this.modifiedBy = builder.modifiedBy;
        this.action = builder.action;
        this.previousPermissions = List.copyOf(builder.previousPermissions);
        this.newPermissions = List.copyOf(builder.newPermissions);
        this.reason = builder.reason;
        this.effectiveDate = builder.effectiveDate;
        this.expiryDate = builder.expiryDate;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder(RoleAssignmentAction action, Role role, Member member) {
        return new Builder(action, role, member);
    }

    public UUID getId() {
        return id;
    }

    public UUID getRoleId() {
        return roleId;
    }

    public String getRoleName() {
        return roleName;
    }

    public Member getMember() {
        return member;
    }

    public UUID getModifiedBy() {
        return modifiedBy;
    }

    public RoleAssignmentAction getAction() {
        return action;
    }

    public List<String> getPreviousPermissions() {
        return previousPermissions;
    }

    public List<String> getNewPermissions() {
        return newPermissions;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getEffectiveDate() {
        return effectiveDate;
    }

    public OffsetDateTime getExpiryDate() {
        return expiryDate;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public static final class Builder {

        private final RoleAssignmentAction action;
        private final Role role;
        private final Member member;
        private UUID modifiedBy;
        private List<String> previousPermissions = new ArrayList<>();
        private List<String> newPermissions = new ArrayList<>();
        private String reason;
        private OffsetDateTime effectiveDate;
        private OffsetDateTime expiryDate;
        private OffsetDateTime createdAt;

        private Builder(RoleAssignmentAction action, Role role, Member member) {
            this.action = action;
            this.role = role;
            this.member = member;
        }

        public Builder modifiedBy(UUID modifiedBy) {
            this.modifiedBy = modifiedBy;
            return this;
        }

        public Builder previousPermissions(Collection<String> codes) {
            this.previousPermissions = new ArrayList<>(codes);
            return this;
        }

        public Builder newPermissions(Collection<String> codes) {
            this.newPermissions = new ArrayList<>(codes);
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder effectiveDate(OffsetDateTime effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder expiryDate(OffsetDateTime expiryDate) {
            this.expiryDate = expiryDate;
            return this;
        }

        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RoleAssignmentLog build() {
            if (createdAt == null) {
                throw new IllegalStateException("createdAt is required");
            }
            return new RoleAssignmentLog(this);
        }
    }
}
