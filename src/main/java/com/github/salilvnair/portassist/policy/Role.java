package com.github.salilvnair.portassist.policy;

import java.util.Locale;

/**
 * Caller roles, declared from least to most privileged.
 */
public enum Role {

    ANON,
    CARRIER,
    OPERATOR,
    ADMIN;

    public static final String UNAUTHENTICATED_ALIAS = "UNAUTHENTICATED";

    /**
     * Trim and upper-case; {@code UNAUTHENTICATED} and anything unrecognized
     * map to {@link #ANON}.
     */
    public static Role normalize(String role) {
        if (role == null || role.isBlank()) {
            return ANON;
        }
        String normalized = role.trim().toUpperCase(Locale.ROOT);
        if (UNAUTHENTICATED_ALIAS.equals(normalized)) {
            return ANON;
        }
        for (Role value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        return ANON;
    }
}
