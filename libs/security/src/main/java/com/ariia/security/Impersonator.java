package com.ariia.security;

import java.time.Instant;

/**
 * The operator behind an impersonation session, as resolved from the system-of-record at
 * request time (not as claimed in the token).
 *
 * @param userId     operator's user ID
 * @param email      operator's email
 * @param role       operator's role (always {@link Role#SYSTEM_ADMIN} for a resolved session)
 * @param tenantId   operator's current tenant
 * @param tenantSlug operator's current tenant slug
 * @param reason     reason entered when the session started
 * @param startedAt  when the session started
 */
public record Impersonator(
        long userId,
        String email,
        Role role,
        long tenantId,
        String tenantSlug,
        String reason,
        Instant startedAt
) {
}
