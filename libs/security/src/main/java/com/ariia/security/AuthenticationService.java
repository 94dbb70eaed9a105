package com.ariia.security;

import com.ariia.observability.MetricFactory;
import com.ariia.security.impersonation.ImpersonationManager;
import com.ariia.security.legacy.LegacyFallbackResolver;
import com.ariia.security.password.PasswordHasher;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.PrincipalResolver;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;
import com.ariia.security.revocation.RevocationGuard;
import com.ariia.security.token.IssuedToken;
import com.ariia.security.token.TokenCodec;
import com.ariia.security.token.TokenPayload;
import com.ariia.security.token.TokenSubject;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the auth core for transports and collaborators.
 * <p>
 * Request resolution is always decode, then revocation check, then principal lookup. The
 * legacy header path is consulted only when no token was presented at all.
 */
public class AuthenticationService {

    public static final String RESOLVE_METRIC = "auth.resolve";
    public static final String LOGIN_METRIC = "auth.login";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final TokenCodec tokenCodec;
    private final PasswordHasher passwordHasher;
    private final PrincipalDirectory directory;
    private final PrincipalResolver principalResolver;
    private final RevocationGuard revocationGuard;
    private final ImpersonationManager impersonationManager;
    @SuppressWarnings("deprecation")
    private final LegacyFallbackResolver legacyFallback;
    private final MetricFactory metrics;

    /**
     * @param metrics may be null
     */
    @SuppressWarnings("deprecation")
    public AuthenticationService(
            TokenCodec tokenCodec,
            PasswordHasher passwordHasher,
            PrincipalDirectory directory,
            PrincipalResolver principalResolver,
            RevocationGuard revocationGuard,
            ImpersonationManager impersonationManager,
            LegacyFallbackResolver legacyFallback,
            MetricFactory metrics) {
        this.tokenCodec = tokenCodec;
        this.passwordHasher = passwordHasher;
        this.directory = directory;
        this.principalResolver = principalResolver;
        this.revocationGuard = revocationGuard;
        this.impersonationManager = impersonationManager;
        this.legacyFallback = legacyFallback;
        this.metrics = metrics;
    }

    /**
     * Resolves a raw token.
     *
     * @throws AuthException any session-level code
     */
    public AuthContext resolve(String rawToken) {
        return counted(() -> principalResolver.resolve(tokenCodec.decode(rawToken)));
    }

    /**
     * Resolves whatever the request presented: bearer header first, then cookie, then the
     * legacy headers when that fallback is enabled.
     *
     * @throws AuthException MISSING_CREDENTIALS when nothing usable was presented
     */
    @SuppressWarnings("deprecation")
    public AuthContext resolve(RequestCredentials credentials) {
        Optional<String> bearer = BearerTokenExtractor.extract(credentials.authorizationHeader());
        if (bearer.isPresent()) {
            return resolve(bearer.get());
        }
        if (credentials.cookieToken() != null && !credentials.cookieToken().isBlank()) {
            return resolve(credentials.cookieToken());
        }
        if (legacyFallback != null && legacyFallback.enabled()) {
            return counted(() -> legacyFallback.resolve(
                    credentials.legacyUserId(), credentials.legacyTenantId(), credentials.legacyRole()));
        }
        AuthException missing = AuthException.unauthenticated(AuthErrorCode.MISSING_CREDENTIALS, "no token presented");
        countResolve(outcome(missing.code()));
        throw missing;
    }

    /**
     * Checks credentials and issues a normal session token.
     *
     * @throws IllegalArgumentException when the email is not plausibly an address
     * @throws AuthException            INVALID_CREDENTIALS or TENANT_INACTIVE
     */
    public LoginResult login(String email, String password) {
        String normalized = normalizeEmail(email);
        Timer.Sample sample = metrics == null ? null : Timer.start(metrics.registry());
        String outcome = "success";
        try {
            Optional<UserAccount> found = directory.findUserByEmail(normalized);
            if (found.isEmpty()) {
                passwordHasher.verify(password, passwordHasher.dummyHash());
                outcome = outcome(AuthErrorCode.INVALID_CREDENTIALS);
                throw AuthException.unauthenticated(AuthErrorCode.INVALID_CREDENTIALS, "unknown email");
            }
            UserAccount user = found.get();
            if (!passwordHasher.verify(password, user.passwordHash()) || !user.active()) {
                outcome = outcome(AuthErrorCode.INVALID_CREDENTIALS);
                throw AuthException.unauthenticated(AuthErrorCode.INVALID_CREDENTIALS,
                        "bad password or inactive user " + user.id());
            }
            Tenant tenant = directory.findTenantById(user.tenantId())
                    .filter(Tenant::active)
                    .orElse(null);
            if (tenant == null) {
                outcome = outcome(AuthErrorCode.TENANT_INACTIVE);
                throw AuthException.unauthenticated(AuthErrorCode.TENANT_INACTIVE, "tenant " + user.tenantId());
            }

            IssuedToken token = tokenCodec.issue(
                    new TokenSubject(user.id(), user.email(), tenant.id(), tenant.slug(), user.role()));
            AuthContext context = AuthContext.of(user.id(), user.email(), tenant.id(), tenant.slug(), user.role())
                    .withToken(token.payload().jti(), token.payload().expiresAt());
            log.info("User signed in: userId={}, tenantId={}", user.id(), tenant.id());
            return new LoginResult(token, context);
        } finally {
            if (sample != null) {
                sample.stop(metrics.timer(LOGIN_METRIC, "Sign-in attempts", MetricFactory.TAG_OUTCOME, outcome));
            }
        }
    }

    /**
     * Revokes the presented token for the rest of its lifetime. A token that does not verify
     * has nothing left to revoke.
     *
     * @return whether a revocation marker was written
     */
    public boolean logout(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return false;
        }
        TokenPayload payload;
        try {
            payload = tokenCodec.decode(rawToken);
        } catch (AuthException e) {
            log.debug("Logout with unusable token: {}", e.code());
            return false;
        }
        return revocationGuard.revokeToken(payload);
    }

    /**
     * @throws AuthException FORBIDDEN unless the role is allowed
     */
    public void requireRole(AuthContext context, Set<Role> allowedRoles) {
        RoleChecker.requireRole(context, allowedRoles);
    }

    /**
     * Revokes every session of a user.
     *
     * @return whether the marker was written
     */
    public boolean revokeUser(long userId, long tenantId) {
        return revocationGuard.revokeUser(userId, tenantId);
    }

    public IssuedToken startImpersonation(AuthContext actor, long targetUserId, String reason) {
        return impersonationManager.start(actor, targetUserId, reason);
    }

    public IssuedToken stopImpersonation(AuthContext context) {
        return impersonationManager.stop(context);
    }

    /**
     * Trims and lower-cases an email.
     *
     * @throws IllegalArgumentException when there is no {@code @} or it sits at either end
     */
    public static String normalizeEmail(String email) {
        String normalized = email == null ? "" : email.strip().toLowerCase(Locale.ROOT);
        if (!normalized.contains("@") || normalized.startsWith("@") || normalized.endsWith("@")) {
            throw new IllegalArgumentException("Invalid email format");
        }
        return normalized;
    }

    private AuthContext counted(Supplier<AuthContext> resolution) {
        try {
            AuthContext context = resolution.get();
            countResolve("success");
            return context;
        } catch (AuthException e) {
            countResolve(outcome(e.code()));
            throw e;
        }
    }

    private void countResolve(String outcome) {
        if (metrics != null) {
            metrics.countOutcome(RESOLVE_METRIC, "Request authentication attempts", outcome);
        }
    }

    private static String outcome(AuthErrorCode code) {
        return code.name().toLowerCase(Locale.ROOT);
    }
}
