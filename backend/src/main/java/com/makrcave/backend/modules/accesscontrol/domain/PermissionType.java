package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed permission catalog. Every system permission is one of these codes; custom permissions
 * reuse a type for grouping but carry their own codename.
 */
public enum PermissionType {

    // member management
    VIEW_MEMBERS("view_members"),
    CREATE_MEMBERS("create_members"),
    EDIT_MEMBERS("edit_members"),
    DELETE_MEMBERS("delete_members"),
    SUSPEND_MEMBERS("suspend_members"),
    EXPORT_MEMBERS("export_members"),

    // equipment
    VIEW_EQUIPMENT("view_equipment"),
    CREATE_EQUIPMENT("create_equipment"),
    EDIT_EQUIPMENT("edit_equipment"),
    DELETE_EQUIPMENT("delete_equipment"),
    MANAGE_RESERVATIONS("manage_reservations"),
    VIEW_ALL_RESERVATIONS("view_all_reservations"),

    // projects
    VIEW_ALL_PROJECTS("view_all_projects"),
    MANAGE_PUBLIC_PROJECTS("manage_public_projects"),
    APPROVE_PROJECTS("approve_projects"),

    // inventory
    VIEW_INVENTORY("view_inventory"),
    MANAGE_INVENTORY("manage_inventory"),
    APPROVE_PURCHASES("approve_purchases"),
    VIEW_INVENTORY_REPORTS("view_inventory_reports"),

    // billing
    VIEW_BILLING("view_billing"),
    MANAGE_BILLING("manage_billing"),
    VIEW_FINANCIAL_REPORTS("view_financial_reports"),
    PROCESS_PAYMENTS("process_payments"),

    // analytics
    VIEW_ANALYTICS("view_analytics"),
    EXPORT_REPORTS("export_reports"),
    VIEW_USAGE_STATS("view_usage_stats"),

    // system administration
    MANAGE_SETTINGS("manage_settings"),
    MANAGE_ROLES("manage_roles"),
    MANAGE_PERMISSIONS("manage_permissions"),
    SYSTEM_ADMIN("system_admin"),

    // makerspace management
    CREATE_MAKERSPACES("create_makerspaces"),
    EDIT_MAKERSPACE_SETTINGS("edit_makerspace_settings"),
    DELETE_MAKERSPACES("delete_makerspaces");

    private final String code;

    PermissionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<PermissionType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
