package com.ariia.security.principal;

import com.ariia.security.AuthContext;
import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.Impersonator;
import com.ariia.security.Role;
import com.ariia.security.revocation.RevocationGuard;
import com.ariia.security.token.ImpersonationClaim;
import com.ariia.security.token.TokenPayload;

/**
 * Turns a verified {@link TokenPayload} into an {@link AuthContext}.
 * <p>
 * Only called with payloads that passed {@code TokenCodec.decode}; no claim reaches a lookup
 * before its signature has been checked. Identity fields of the result come from the current
 * user and tenant rows, not from the token: a user moved to another tenant resolves to the new
 * tenant, and revocation markers are checked under both tenants.
 */
public final class PrincipalResolver {

    private final PrincipalDirectory directory;
    private final RevocationGuard revocationGuard;

    public PrincipalResolver(PrincipalDirectory directory, RevocationGuard revocationGuard) {
        this.directory = directory;
        this.revocationGuard = revocationGuard;
    }

    /**
     * @throws AuthException REVOKED, PRINCIPAL_NOT_FOUND or TENANT_INACTIVE
     */
    public AuthContext resolve(TokenPayload payload) {
        if (revocationGuard.isRevoked(payload)) {
            throw AuthException.unauthenticated(AuthErrorCode.REVOKED, "jti=" + payload.jti());
        }
        UserAccount user = activeUser(payload.subject());
        // markers are written under the user's current tenant, which wins over the token's
        if (user.tenantId() != payload.tenantId()
                && revocationGuard.isRevoked(user.tenantId(), user.id(), payload.jti())) {
            throw AuthException.unauthenticated(AuthErrorCode.REVOKED,
                    "jti=" + payload.jti() + " revoked under current tenant " + user.tenantId());
        }
        Tenant tenant = activeTenant(user.tenantId());

        Impersonator impersonator = payload.isImpersonation()
                ? resolveActor(payload.impersonation())
                : null;

        return new AuthContext(
                user.id(),
                user.email(),
                tenant.id(),
                tenant.slug(),
                user.role(),
                impersonator,
                payload.jti(),
                payload.expiresAt());
    }

    /**
     * Loads a user that may act right now.
     *
     * @throws AuthException PRINCIPAL_NOT_FOUND when missing or inactive
     */
    public UserAccount activeUser(long userId) {
        return directory.findUserById(userId)
                .filter(UserAccount::active)
                .orElseThrow(() -> AuthException.unauthenticated(AuthErrorCode.PRINCIPAL_NOT_FOUND,
                        "user " + userId + " missing or inactive"));
    }

    /**
     * Loads a tenant whose members may act right now.
     *
     * @throws AuthException TENANT_INACTIVE when missing or inactive
     */
    public Tenant activeTenant(long tenantId) {
        return directory.findTenantById(tenantId)
                .filter(Tenant::active)
                .orElseThrow(() -> AuthException.unauthenticated(AuthErrorCode.TENANT_INACTIVE,
                        "tenant " + tenantId + " missing or inactive"));
    }

    // Any failure here rejects the whole token; an impersonation session is never downgraded.
    private Impersonator resolveActor(ImpersonationClaim claim) {
        UserAccount actor = activeUser(claim.actorUserId());
        if (actor.role() != Role.SYSTEM_ADMIN) {
            throw AuthException.unauthenticated(AuthErrorCode.PRINCIPAL_NOT_FOUND,
                    "impersonation actor " + actor.id() + " is no longer system_admin");
        }
        Tenant actorTenant = activeTenant(actor.tenantId());
        if (revocationGuard.isRevoked(actorTenant.id(), actor.id(), null)) {
            throw AuthException.unauthenticated(AuthErrorCode.REVOKED,
                    "impersonation actor " + actor.id() + " has been revoked");
        }
        return new Impersonator(
                actor.id(),
                actor.email(),
                actor.role(),
                actorTenant.id(),
                actorTenant.slug(),
                claim.reason(),
                claim.startedAt());
    }
}
