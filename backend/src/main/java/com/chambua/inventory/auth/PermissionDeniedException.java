package com.chambua.inventory.auth;

public class PermissionDeniedException extends RuntimeException {

    private final Permission permission;

    public PermissionDeniedException(String username, Permission permission) {
        super("Access denied. Required permission: " + permission.code() + " (user " + username + ")");
        this.permission = permission;
    }

    public Permission getPermission() { return permission; }
}
