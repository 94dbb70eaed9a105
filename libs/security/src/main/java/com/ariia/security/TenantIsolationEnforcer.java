package com.ariia.security;

/**
 * Enforces tenant isolation by comparing the request's tenant against a resource's tenant.
 * <p>
 * System admins operate the whole platform and may cross tenants. Every other role is confined
 * to its current tenant. An impersonation session carries the impersonated user's role, so an
 * operator impersonating a tenant user is confined like that user.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the context may act on a resource of {@code resourceTenantId}.
     *
     * @param context          the resolved auth context
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if the tenants differ and the role may not cross them
     */
    public static void enforce(AuthContext context, long resourceTenantId) {
        if (context.role() == Role.SYSTEM_ADMIN) {
            return;
        }
        if (context.tenantId() != resourceTenantId) {
            throw new TenantMismatchException(context.tenantId(), resourceTenantId);
        }
    }
}
