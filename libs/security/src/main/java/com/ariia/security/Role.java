package com.ariia.security;

import java.util.Optional;

/**
 * Platform roles. The set is closed: a role string that does not map to one of these constants
 * is rejected wherever it enters the system (token claims, legacy headers, stored user rows).
 * <p>
 * There is no hierarchy. A {@code system_admin} is not implicitly a {@code tenant_admin};
 * protected operations list every role they accept.
 */
public enum Role {

    SYSTEM_ADMIN("system_admin"),
    TENANT_ADMIN("tenant_admin"),
    TENANT_USER("tenant_user");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The wire representation (e.g., "tenant_admin"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its wire value. Matching is exact (case-sensitive).
     *
     * @param value the string to match, may be null
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
