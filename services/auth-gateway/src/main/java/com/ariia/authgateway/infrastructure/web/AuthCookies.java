package com.ariia.authgateway.infrastructure.web;

import com.ariia.authgateway.config.AuthProperties;
import com.ariia.security.token.IssuedToken;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Browser session cookies.
 *
 * <p>{@value #ACCESS_COOKIE} carries the token and is never readable by scripts;
 * {@value #CSRF_COOKIE} is a random value the front end echoes back. Both are SameSite=Lax on
 * path {@code /} and live as long as the token.
 */
@Component
public class AuthCookies {

    public static final String ACCESS_COOKIE = "ariia_access_token";
    public static final String CSRF_COOKIE = "ariia_csrf_token";

    private static final int CSRF_BYTES = 24;
    private static final String SAME_SITE = "Lax";

    private final SecureRandom random = new SecureRandom();
    private final boolean secure;
    private final Clock clock;

    public AuthCookies(AuthProperties properties, Clock clock) {
        this.secure = properties.cookieSecure();
        this.clock = clock;
    }

    /** Adds both session cookies for a freshly issued token. */
    public void write(HttpHeaders headers, IssuedToken token) {
        Duration lifetime = Duration.between(clock.instant(), token.payload().expiresAt());
        if (lifetime.isNegative()) {
            lifetime = Duration.ZERO;
        }
        headers.add(HttpHeaders.SET_COOKIE, cookie(ACCESS_COOKIE, token.token(), true, lifetime).toString());
        headers.add(HttpHeaders.SET_COOKIE, cookie(CSRF_COOKIE, csrfValue(), false, lifetime).toString());
    }

    /** Expires both session cookies. */
    public void clear(HttpHeaders headers) {
        headers.add(HttpHeaders.SET_COOKIE, cookie(ACCESS_COOKIE, "", true, Duration.ZERO).toString());
        headers.add(HttpHeaders.SET_COOKIE, cookie(CSRF_COOKIE, "", false, Duration.ZERO).toString());
    }

    private ResponseCookie cookie(String name, String value, boolean httpOnly, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(httpOnly)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private String csrfValue() {
        byte[] bytes = new byte[CSRF_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
