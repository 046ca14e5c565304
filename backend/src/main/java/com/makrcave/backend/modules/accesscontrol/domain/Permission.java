package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.makrcave.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.springframework.data.annotation.CreatedBy;

@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "codename", nullable = false, unique = true, updatable = false, length = 100)
    private String codename;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_type", nullable = false, length = 64)
    private PermissionType permissionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_scope", nullable = false, length = 32)
    private AccessScope accessScope = AccessScope.MAKERSPACE;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "requires_two_factor", nullable = false)
    private boolean requiresTwoFactor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "resource_types", columnDefinition = "jsonb")
    private List<String> resourceTypes = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_restrictions", columnDefinition = "jsonb")
    private Map<String, Object> fieldRestrictions = new HashMap<>();

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    protected Permission() {
    }

    public Permission(String codename, String name, PermissionType permissionType, boolean system) {
        this.codename = codename;
        this.name = name;
        this.permissionType = permissionType;
        this.system = system;
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

    public String getCodename() {
        return codename;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public PermissionType getPermissionType() {
        return permissionType;
    }

    public void setPermissionType(PermissionType permissionType) {
        this.permissionType = permissionType;
    }

    public AccessScope getAccessScope() {
        return accessScope;
    }

    public void setAccessScope(AccessScope accessScope) {
        this.accessScope = accessScope;
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

    public boolean isRequiresTwoFactor() {
        return requiresTwoFactor;
    }

    public void setRequiresTwoFactor(boolean requiresTwoFactor) {
        this.requiresTwoFactor = requiresTwoFactor;
    }

    public List<String> getResourceTypes() {
        return resourceTypes;
    }

    public void setResourceTypes(List<String> resourceTypes) {
        this.resourceTypes = resourceTypes == null ? new ArrayList<>() : new ArrayList<>(resourceTypes);
    }

    public Map<String, Object> getFieldRestrictions() {
        return fieldRestrictions;
    }

    public void setFieldRestrictions(Map<String, Object> fieldRestrictions) {
        this.fieldRestrictions = fieldRestrictions == null ? new HashMap<>() : new HashMap<>(fieldRestrictions);
    }

    public UUID getCreatedBy() {
        return createdBy;
    }
}
