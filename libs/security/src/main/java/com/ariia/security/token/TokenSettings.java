package com.ariia.security.token;

import java.time.Duration;

/**
 * Signing and lifetime settings for {@link TokenCodec}.
 *
 * @param secret           HMAC-SHA256 signing secret shared by every instance of the platform
 * @param defaultTtl       lifetime of a normal session token (default 12h)
 * @param maxTtl           upper bound for any requested lifetime, also the revocation marker TTL (default 12h)
 * @param impersonationTtl lifetime of an impersonation token (default 45 min), must be shorter than a normal session
 */
public record TokenSettings(String secret, Duration defaultTtl, Duration maxTtl, Duration impersonationTtl) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(12);
    public static final Duration DEFAULT_IMPERSONATION_TTL = Duration.ofMinutes(45);

    public TokenSettings {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            defaultTtl = DEFAULT_TTL;
        }
        if (maxTtl == null || maxTtl.isZero() || maxTtl.isNegative()) {
            maxTtl = defaultTtl;
        }
        if (impersonationTtl == null || impersonationTtl.isZero() || impersonationTtl.isNegative()) {
            impersonationTtl = DEFAULT_IMPERSONATION_TTL;
        }
        if (defaultTtl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("defaultTtl %s exceeds maxTtl %s".formatted(defaultTtl, maxTtl));
        }
        if (impersonationTtl.compareTo(defaultTtl) >= 0) {
            throw new IllegalArgumentException(
                    "impersonationTtl %s must be shorter than defaultTtl %s".formatted(impersonationTtl, defaultTtl));
        }
    }

    /** Settings with default lifetimes. */
    public static TokenSettings withSecret(String secret) {
        return new TokenSettings(secret, null, null, null);
    }

    /** Hides the secret. */
    @Override
    public String toString() {
        return "TokenSettings[secret=***, defaultTtl=%s, maxTtl=%s, impersonationTtl=%s]"
                .formatted(defaultTtl, maxTtl, impersonationTtl);
    }
}
