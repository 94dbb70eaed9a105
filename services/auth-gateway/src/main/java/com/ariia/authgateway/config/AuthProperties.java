package com.ariia.authgateway.config;

import com.ariia.security.legacy.LegacySettings;
import com.ariia.security.token.TokenSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Auth core settings, bound from {@code ariia.auth.*}.
 *
 * <pre>
 * ariia:
 *   auth:
 *     secret: ${ARIIA_AUTH_SECRET}
 *     default-ttl: 12h
 *     max-ttl: 12h
 *     impersonation-ttl: 45m
 *     revocation-store: redis
 *     transition-mode: false
 *     allow-header-fallback: false
 * </pre>
 *
 * @param secret              HMAC signing secret, at least 32 characters
 * @param defaultTtl          normal session lifetime
 * @param maxTtl              longest lifetime a token may have
 * @param impersonationTtl    ghost session lifetime
 * @param revocationStore     where revocation markers live
 * @param transitionMode      token migration window is open
 * @param allowHeaderFallback unsigned legacy headers are accepted during the window
 * @param cookieSecure        whether auth cookies carry the Secure attribute (default true)
 */
@ConfigurationProperties(prefix = "ariia.auth")
@Validated
public record AuthProperties(
        @NotBlank @Size(min = 32) String secret,
        Duration defaultTtl,
        Duration maxTtl,
        Duration impersonationTtl,
        RevocationStoreType revocationStore,
        boolean transitionMode,
        boolean allowHeaderFallback,
        Boolean cookieSecure) {

    /** Backing store for revocation markers. */
    public enum RevocationStoreType {
        REDIS,
        MEMORY
    }

    public AuthProperties {
        if (revocationStore == null) {
            revocationStore = RevocationStoreType.REDIS;
        }
        if (cookieSecure == null) {
            cookieSecure = Boolean.TRUE;
        }
    }

    public TokenSettings tokenSettings() {
        return new TokenSettings(secret, defaultTtl, maxTtl, impersonationTtl);
    }

    public LegacySettings legacySettings() {
        return new LegacySettings(transitionMode, allowHeaderFallback);
    }

    /** Hides the secret. */
    @Override
    public String toString() {
        return "AuthProperties[secret=***, defaultTtl=%s, maxTtl=%s, impersonationTtl=%s, revocationStore=%s, "
                .formatted(defaultTtl, maxTtl, impersonationTtl, revocationStore)
                + "transitionMode=%s, allowHeaderFallback=%s, cookieSecure=%s]"
                .formatted(transitionMode, allowHeaderFallback, cookieSecure);
    }
}
