package com.ariia.security;

import java.time.Instant;

/**
 * Resolved identity of a request. The only artifact handed to downstream collaborators;
 * never persisted.
 * <p>
 * Identity fields always describe the effective user. For an impersonation session that is the
 * impersonated user, and {@link #impersonator()} names the operator acting behind them.
 *
 * @param userId       effective user ID
 * @param email        effective user's email
 * @param tenantId     effective user's current tenant
 * @param tenantSlug   effective user's current tenant slug
 * @param role         effective user's role
 * @param impersonator operator behind this session, or null
 * @param tokenId      {@code jti} of the presented token, or null when resolved without a token
 * @param expiresAt    expiry of the presented token, or null when resolved without a token
 */
public record AuthContext(
        long userId,
        String email,
        long tenantId,
        String tenantSlug,
        Role role,
        Impersonator impersonator,
        String tokenId,
        Instant expiresAt
) {

    public AuthContext {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** Context for a plain session of the given user. */
    public static AuthContext of(long userId, String email, long tenantId, String tenantSlug, Role role) {
        return new AuthContext(userId, email, tenantId, tenantSlug, role, null, null, null);
    }

    public boolean isImpersonating() {
        return impersonator != null;
    }

    /** Same identity, bound to the given token. */
    public AuthContext withToken(String tokenId, Instant expiresAt) {
        return new AuthContext(userId, email, tenantId, tenantSlug, role, impersonator, tokenId, expiresAt);
    }
}
