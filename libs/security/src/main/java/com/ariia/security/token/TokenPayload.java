package com.ariia.security.token;

import com.ariia.security.Role;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * The signed claim set. Immutable once issued; revocation lives in a separate side-store.
 *
 * @param subject       user ID ({@code sub})
 * @param email         user's email
 * @param tenantId      user's tenant at issuance ({@code tenant_id})
 * @param tenantSlug    user's tenant slug at issuance ({@code tenant_slug})
 * @param role          user's role at issuance
 * @param expiresAt     absolute expiry ({@code exp}), truncated to whole seconds
 * @param jti           unique token identifier, target of single-token revocation
 * @param impersonation {@code imp} claim, or null
 */
public record TokenPayload(
        long subject,
        String email,
        long tenantId,
        String tenantSlug,
        Role role,
        Instant expiresAt,
        String jti,
        ImpersonationClaim impersonation
) {

    public TokenPayload {
        if (expiresAt != null) {
            expiresAt = expiresAt.truncatedTo(ChronoUnit.SECONDS);
        }
    }

    /** Whether this payload carries an honoured impersonation claim. */
    public boolean isImpersonation() {
        return impersonation != null && impersonation.active();
    }
}
