package com.ariia.observability;

/**
 * Immutable correlation context that flows through a single request.
 * <p>
 * The HTTP entry point establishes a context holding the correlation and request IDs. Once the
 * caller's credentials have been resolved, the context is widened with the tenant, the effective
 * user and, for impersonation sessions, the operator acting behind that user. All values are
 * injected into SLF4J MDC so every log line of the request carries them.
 *
 * @param correlationId unique ID for the business flow, propagated by the client when present
 * @param requestId     unique ID for this specific request
 * @param tenantId      tenant of the resolved principal (null before resolution)
 * @param userId        effective user of the request (null before resolution)
 * @param actorUserId   operator behind an impersonation session (null otherwise)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String tenantId,
        String userId,
        String actorUserId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the effective user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the impersonating operator's user ID. */
    public static final String MDC_ACTOR_USER_ID = "actorUserId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a request whose principal is not known yet.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null, null);
    }

    /**
     * Returns a copy of this context carrying the resolved principal.
     *
     * @param tenantId    tenant of the principal
     * @param userId      effective user
     * @param actorUserId impersonating operator, or null
     */
    public CorrelationContext withPrincipal(String tenantId, String userId, String actorUserId) {
        return new CorrelationContext(correlationId, requestId, tenantId, userId, actorUserId);
    }
}
