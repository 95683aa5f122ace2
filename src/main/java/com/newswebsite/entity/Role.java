package com.newswebsite.entity;

public enum Role {
    EDITOR,
    ADMIN;

    /**
     * Parses a role name case-sensitively, returning null for anything that is not a known role.
     */
    public static Role fromName(String name) {
        if (name == null) {
            return null;
        }
        for (Role role : values()) {
            if (role.name().equals(name)) {
                return role;
            }
        }
        return null;
    }
}
