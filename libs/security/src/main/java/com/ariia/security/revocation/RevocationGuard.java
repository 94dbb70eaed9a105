package com.ariia.security.revocation;

import com.ariia.observability.MetricFactory;
import com.ariia.security.token.TokenPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Revokes tokens and users and answers whether a token has been revoked.
 * <p>
 * The side-store is a second line of defence behind signature and expiry. When it cannot be
 * reached, {@link #isRevoked} answers {@code false}, logs a warning and increments
 * {@value #FAIL_OPEN_METRIC}; revocation writes log a warning and report {@code false}.
 * Tokens issued before a lost write still expire on their own.
 */
public final class RevocationGuard {

    public static final String FAIL_OPEN_METRIC = "auth.revocation.fail_open";

    private static final Logger log = LoggerFactory.getLogger(RevocationGuard.class);
    private static final Duration MIN_MARKER_TTL = Duration.ofSeconds(1);

    private final RevocationStore store;
    private final Duration maxTtl;
    private final Clock clock;
    private final MetricFactory metrics;

    /**
     * @param maxTtl  lifetime of a user marker when none is given; matches the longest token
     *                lifetime so every outstanding token is covered
     * @param metrics may be null
     */
    public RevocationGuard(RevocationStore store, Duration maxTtl, Clock clock, MetricFactory metrics) {
        this.store = store;
        this.maxTtl = maxTtl;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Whether the token or its subject has been revoked.
     */
    public boolean isRevoked(TokenPayload payload) {
        return isRevoked(payload.tenantId(), payload.subject(), payload.jti());
    }

    /**
     * Checks the jti marker, then the user marker. Never throws for store failures.
     */
    public boolean isRevoked(long tenantId, long userId, String jti) {
        try {
            if (jti != null && store.exists(RevocationKeys.token(tenantId, jti))) {
                return true;
            }
            return store.exists(RevocationKeys.user(tenantId, userId));
        } catch (RuntimeException e) {
            log.warn("Revocation store unavailable, treating token as not revoked: tenantId={}, userId={}, jti={}",
                    tenantId, userId, jti, e);
            if (metrics != null) {
                metrics.counter(FAIL_OPEN_METRIC, "Revocation checks that failed open").increment();
            }
            return false;
        }
    }

    /**
     * Revokes every session of a user for the maximum token lifetime.
     *
     * @return whether the marker was written
     */
    public boolean revokeUser(long userId, long tenantId) {
        return revokeUser(userId, tenantId, maxTtl);
    }

    /**
     * Revokes every session of a user. Idempotent: a second call only refreshes the marker.
     *
     * @param ttl marker lifetime, null for the maximum token lifetime
     * @return whether the marker was written
     */
    public boolean revokeUser(long userId, long tenantId, Duration ttl) {
        String key = RevocationKeys.user(tenantId, userId);
        if (!write(key, ttl == null ? maxTtl : ttl)) {
            return false;
        }
        log.info("Revoked all sessions: tenantId={}, userId={}", tenantId, userId);
        return true;
    }

    /**
     * Revokes one token for the rest of its lifetime.
     *
     * @return whether the marker was written
     */
    public boolean revokeToken(TokenPayload payload) {
        return revokeToken(payload.tenantId(), payload.jti(), payload.expiresAt());
    }

    /**
     * Revokes the token {@code jti} until {@code expiresAt}.
     *
     * @return whether the marker was written
     */
    public boolean revokeToken(long tenantId, String jti, Instant expiresAt) {
        if (jti == null || jti.isBlank()) {
            throw new IllegalArgumentException("jti must not be blank");
        }
        if (!write(RevocationKeys.token(tenantId, jti), Duration.between(clock.instant(), expiresAt))) {
            return false;
        }
        log.info("Revoked token: tenantId={}, jti={}", tenantId, jti);
        return true;
    }

    private boolean write(String key, Duration ttl) {
        Duration effective = ttl.compareTo(MIN_MARKER_TTL) < 0 ? MIN_MARKER_TTL : ttl;
        try {
            store.setWithTtl(key, effective);
            return true;
        } catch (RuntimeException e) {
            log.warn("Revocation store unavailable, marker not written: key={}", key, e);
            return false;
        }
    }
}
