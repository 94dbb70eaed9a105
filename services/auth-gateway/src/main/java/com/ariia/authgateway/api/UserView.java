package com.ariia.authgateway.api;

import com.ariia.security.AuthContext;
import com.ariia.security.Impersonator;
import com.ariia.security.token.ImpersonationClaim;
import com.ariia.security.token.TokenPayload;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The caller as the client sees it. {@code impersonation} is present only in a ghost session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserView(
        long id,
        String email,
        String role,
        long tenantId,
        String tenantSlug,
        ImpersonationView impersonation) {

    /**
     * The operator behind a ghost session.
     */
    public record ImpersonationView(
            boolean active,
            long actorUserId,
            String actorEmail,
            String actorRole,
            long actorTenantId,
            String actorTenantSlug,
            String reason,
            String startedAt) {

        static ImpersonationView of(Impersonator impersonator) {
            return new ImpersonationView(
                    true,
                    impersonator.userId(),
                    impersonator.email(),
                    impersonator.role().value(),
                    impersonator.tenantId(),
                    impersonator.tenantSlug(),
                    impersonator.reason() == null ? "" : impersonator.reason(),
                    impersonator.startedAt() == null ? "" : impersonator.startedAt().toString());
        }

        static ImpersonationView of(ImpersonationClaim claim) {
            return new ImpersonationView(
                    true,
                    claim.actorUserId(),
                    claim.actorEmail(),
                    claim.actorRole().value(),
                    claim.actorTenantId(),
                    claim.actorTenantSlug(),
                    claim.reason(),
                    claim.startedAt().toString());
        }
    }

    public static UserView of(AuthContext context) {
        return new UserView(
                context.userId(),
                context.email(),
                context.role().value(),
                context.tenantId(),
                context.tenantSlug(),
                context.isImpersonating() ? ImpersonationView.of(context.impersonator()) : null);
    }

    /** View of a token that was just issued, before any request has resolved it. */
    public static UserView of(TokenPayload payload) {
        return new UserView(
                payload.subject(),
                payload.email(),
                payload.role().value(),
                payload.tenantId(),
                payload.tenantSlug(),
                payload.isImpersonation() ? ImpersonationView.of(payload.impersonation()) : null);
    }
}
