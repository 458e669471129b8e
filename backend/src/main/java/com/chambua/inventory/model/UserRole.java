package com.chambua.inventory.model;

import com.chambua.inventory.auth.Permission;

import java.util.EnumSet;
import java.util.Set;

public enum UserRole {
    SUPER_ADMIN(EnumSet.allOf(Permission.class)),
    ADMIN(EnumSet.of(Permission.MANAGE_USERS, Permission.VIEW_REPORTS, Permission.MANAGE_INVENTORY, Permission.MANAGE_SALES)),
    MANAGER(EnumSet.of(Permission.VIEW_REPORTS, Permission.MANAGE_INVENTORY, Permission.MANAGE_SALES)),
    CASHIER(EnumSet.of(Permission.MANAGE_SALES)),
    INVENTORY(EnumSet.of(Permission.MANAGE_INVENTORY)),
    VIEWER(EnumSet.of(Permission.VIEW_REPORTS));

    private final Set<Permission> permissions;

    UserRole(Set<Permission> permissions) {
        this.permissions = permissions;
    }

    public boolean grants(Permission permission) {
        return permissions.contains(permission);
    }
}
