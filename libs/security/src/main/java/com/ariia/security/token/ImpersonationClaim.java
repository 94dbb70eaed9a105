package com.ariia.security.token;

import com.ariia.security.Role;

import java.time.Instant;

/**
 * The {@code imp} claim: who really started an impersonation session and why.
 * <p>
 * These are claims, not facts. The actor is looked up again on every request and the token is
 * rejected outright if the actor is no longer an active system admin in an active tenant.
 *
 * @param active          only {@code true} claims are honoured
 * @param actorUserId     operator's user ID
 * @param actorEmail      operator's email at start time
 * @param actorRole       operator's role at start time
 * @param actorTenantId   operator's tenant at start time
 * @param actorTenantSlug operator's tenant slug at start time
 * @param reason          reason entered by the operator
 * @param startedAt       when the session started
 */
public record ImpersonationClaim(
        boolean active,
        long actorUserId,
        String actorEmail,
        Role actorRole,
        long actorTenantId,
        String actorTenantSlug,
        String reason,
        Instant startedAt
) {
}
