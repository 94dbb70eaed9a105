package com.ariia.security;

/**
 * Thrown when a request attempts to act on a resource belonging to a different tenant.
 * <p>
 * A RuntimeException: tenant mismatch is a security error, not a recoverable condition.
 */
public class TenantMismatchException extends RuntimeException {

    private final long contextTenantId;
    private final long resourceTenantId;

    public TenantMismatchException(long contextTenantId, long resourceTenantId) {
        super("Tenant mismatch: context tenant %d cannot access resource of tenant %d"
                .formatted(contextTenantId, resourceTenantId));
        this.contextTenantId = contextTenantId;
        this.resourceTenantId = resourceTenantId;
    }

    public long contextTenantId() {
        return contextTenantId;
    }

    public long resourceTenantId() {
        return resourceTenantId;
    }
}
