package com.ariia.security.legacy;

import com.ariia.security.AuthContext;
import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.Role;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives an {@link AuthContext} from the unsigned {@code X-User-Id}, {@code X-Tenant-Id} and
 * {@code X-Role} headers.
 * <p>
 * Compatibility shim for clients that predate signed tokens. It is never reached from the
 * token path and only runs when {@link LegacySettings#enabled()}. The claimed principal must
 * still exist, be active, hold the claimed role and belong to the claimed tenant. Every use
 * is logged.
 *
 * @deprecated remove once every client presents signed tokens
 */
@Deprecated
public final class LegacyFallbackResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String TENANT_ID_HEADER = "X-Tenant-Id";
    public static final String ROLE_HEADER = "X-Role";

    private static final Logger log = LoggerFactory.getLogger(LegacyFallbackResolver.class);

    private final LegacySettings settings;
    private final PrincipalDirectory directory;

    public LegacyFallbackResolver(LegacySettings settings, PrincipalDirectory directory) {
        this.settings = settings;
        this.directory = directory;
    }

    public boolean enabled() {
        return settings.enabled();
    }

    /**
     * @throws AuthException MISSING_CREDENTIALS when disabled, MALFORMED, INVALID_ROLE or PRINCIPAL_NOT_FOUND
     */
    public AuthContext resolve(String userIdHeader, String tenantIdHeader, String roleHeader) {
        if (!settings.enabled()) {
            throw AuthException.unauthenticated(AuthErrorCode.MISSING_CREDENTIALS, "header fallback disabled");
        }
        long userId = parseId(userIdHeader, USER_ID_HEADER);
        long tenantId = parseId(tenantIdHeader, TENANT_ID_HEADER);
        Role role = Role.fromString(roleHeader == null ? null : roleHeader.strip())
                .orElseThrow(() -> AuthException.unauthenticated(AuthErrorCode.INVALID_ROLE,
                        ROLE_HEADER + "=" + roleHeader));

        UserAccount user = directory.findUserById(userId)
                .filter(UserAccount::active)
                .filter(candidate -> candidate.tenantId() == tenantId && candidate.role() == role)
                .orElseThrow(() -> principalNotFound(userId, tenantId));
        Tenant tenant = directory.findTenantById(tenantId)
                .filter(Tenant::active)
                .orElseThrow(() -> principalNotFound(userId, tenantId));

        log.warn("Legacy header authentication used: userId={}, tenantId={}, role={}",
                userId, tenantId, role.value());
        return AuthContext.of(user.id(), user.email(), tenant.id(), tenant.slug(), role);
    }

    private static long parseId(String value, String header) {
        if (value == null || value.isBlank()) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "missing " + header);
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw AuthException.unauthenticated(AuthErrorCode.MALFORMED, "non-numeric " + header);
        }
    }

    private static AuthException principalNotFound(long userId, long tenantId) {
        return AuthException.unauthenticated(AuthErrorCode.PRINCIPAL_NOT_FOUND,
                "legacy principal userId=%d tenantId=%d".formatted(userId, tenantId));
    }
}
