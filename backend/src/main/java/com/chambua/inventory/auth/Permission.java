package com.chambua.inventory.auth;

public enum Permission {
    MANAGE_USERS("manage_users"),
    VIEW_REPORTS("view_reports"),
    MANAGE_INVENTORY("manage_inventory"),
    MANAGE_SALES("manage_sales");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
