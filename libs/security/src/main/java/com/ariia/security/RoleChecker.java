package com.ariia.security;

import java.util.Set;

/**
 * Role-based access checks. Membership is exact, and impersonation status never changes the
 * outcome: an impersonation session is checked with the impersonated user's role.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the context holds exactly the given role.
     */
    public static boolean hasRole(AuthContext context, Role required) {
        return context.role() == required;
    }

    /**
     * Checks if the context holds ANY of the given roles.
     */
    public static boolean hasAnyRole(AuthContext context, Role... allowed) {
        for (Role role : allowed) {
            if (hasRole(context, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rejects the request unless the context's role is in {@code allowedRoles}.
     *
     * @throws AuthException with {@link AuthErrorCode#FORBIDDEN} when the role is not allowed
     */
    public static void requireRole(AuthContext context, Set<Role> allowedRoles) {
        if (!allowedRoles.contains(context.role())) {
            throw new AuthException(AuthErrorCode.FORBIDDEN,
                    "role %s not in %s".formatted(context.role().value(), allowedRoles));
        }
    }
}
