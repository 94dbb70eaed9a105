package com.ariia.security.testing;

import com.ariia.security.AuthContext;
import com.ariia.security.Impersonator;
import com.ariia.security.Role;

import java.time.Instant;

/**
 * Ready-made {@link AuthContext} instances for tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope through a
 * normal dependency. The package name marks it as test-only.
 */
public final class TestAuthContextFactory {

    public static final long DEFAULT_USER_ID = 100L;
    public static final long DEFAULT_TENANT_ID = 10L;

    private TestAuthContextFactory() {
        // utility class
    }

    /** A tenant user in the default tenant. */
    public static AuthContext create() {
        return create(DEFAULT_USER_ID, DEFAULT_TENANT_ID, Role.TENANT_USER);
    }

    public static AuthContext createWithRole(Role role) {
        return create(DEFAULT_USER_ID, DEFAULT_TENANT_ID, role);
    }

    public static AuthContext createForTenant(long tenantId) {
        return create(DEFAULT_USER_ID, tenantId, Role.TENANT_USER);
    }

    public static AuthContext create(long userId, long tenantId, Role role) {
        return AuthContext.of(userId, "user" + userId + "@ariia.test", tenantId, "tenant-" + tenantId, role);
    }

    /**
     * A session in which system admin {@code actorUserId} of tenant {@code actorTenantId}
     * impersonates {@code target}.
     */
    public static AuthContext impersonating(AuthContext target, long actorUserId, long actorTenantId) {
        Impersonator impersonator = new Impersonator(actorUserId, "user" + actorUserId + "@ariia.test",
                Role.SYSTEM_ADMIN, actorTenantId, "tenant-" + actorTenantId, "test impersonation", Instant.EPOCH);
        return new AuthContext(target.userId(), target.email(), target.tenantId(), target.tenantSlug(),
                target.role(), impersonator, target.tokenId(), target.expiresAt());
    }
}
