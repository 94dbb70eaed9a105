package com.ariia.security.revocation;

/**
 * Key layout of the revocation side-store. Every key is namespaced by tenant.
 */
public final class RevocationKeys {

    private RevocationKeys() {
        // utility class
    }

    /** Marker for a single revoked token: {@code t{tenant}:blacklist:jti:{jti}}. */
    public static String token(long tenantId, String jti) {
        return "t%d:blacklist:jti:%s".formatted(tenantId, jti);
    }

    /** Marker revoking every session of a user: {@code t{tenant}:user_blacklisted:{user}}. */
    public static String user(long tenantId, long userId) {
        return "t%d:user_blacklisted:%d".formatted(tenantId, userId);
    }
}
