package com.chambua.inventory.auth;

import com.chambua.inventory.model.UserRole;

import java.util.Objects;

/**
 * Already-authenticated caller of an import or export. {@code defaultLocationId} is the
 * location assigned to the user and may be null.
 */
public record CallerContext(String username, UserRole role, Long defaultLocationId) {

    public CallerContext {
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public boolean hasPermission(Permission permission) {
        return role.grants(permission);
    }

    public void require(Permission permission) {
        if (!hasPermission(permission)) {
            throw new PermissionDeniedException(username, permission);
        }
    }
}
