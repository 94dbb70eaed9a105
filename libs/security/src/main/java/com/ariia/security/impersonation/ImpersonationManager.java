package com.ariia.security.impersonation;

import com.ariia.security.AuthContext;
import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.Impersonator;
import com.ariia.security.Role;
import com.ariia.security.audit.AuditActions;
import com.ariia.security.audit.AuditRecord;
import com.ariia.security.audit.AuditSink;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;
import com.ariia.security.revocation.RevocationGuard;
import com.ariia.security.token.ImpersonationClaim;
import com.ariia.security.token.IssuedToken;
import com.ariia.security.token.TokenCodec;
import com.ariia.security.token.TokenSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Starts and stops ghost sessions in which a system admin acts as another user.
 * <p>
 * A session is either impersonating or not; there is no nesting. Every precondition failure
 * raises a typed {@link AuthException} before anything is issued, and a token is only handed
 * out after its audit record has been written.
 */
public final class ImpersonationManager {

    public static final int MIN_REASON_LENGTH = 8;
    public static final int MAX_REASON_LENGTH = 500;

    private static final Logger log = LoggerFactory.getLogger(ImpersonationManager.class);

    private final TokenCodec tokenCodec;
    private final PrincipalDirectory directory;
    private final AuditSink auditSink;
    private final RevocationGuard revocationGuard;
    private final Clock clock;

    public ImpersonationManager(TokenCodec tokenCodec, PrincipalDirectory directory, AuditSink auditSink,
                                RevocationGuard revocationGuard, Clock clock) {
        this.tokenCodec = tokenCodec;
        this.directory = directory;
        this.auditSink = auditSink;
        this.revocationGuard = revocationGuard;
        this.clock = clock;
    }

    /**
     * Issues a short-lived token carrying the target's identity and the actor's claim.
     *
     * @param actor        resolved context of the operator
     * @param targetUserId user to impersonate
     * @param reason       operator-entered reason, {@value #MIN_REASON_LENGTH}..{@value #MAX_REASON_LENGTH} characters after trimming
     * @throws AuthException            FORBIDDEN, CONFLICT or INVALID_TARGET
     * @throws IllegalArgumentException when the reason is too short or too long
     */
    public IssuedToken start(AuthContext actor, long targetUserId, String reason) {
        // a ghost session carries the target's role, so this must precede the role check
        if (actor.isImpersonating()) {
            throw AuthException.actionable(AuthErrorCode.CONFLICT, "Already in impersonation mode");
        }
        if (actor.role() != Role.SYSTEM_ADMIN) {
            throw new AuthException(AuthErrorCode.FORBIDDEN, "actor role " + actor.role().value());
        }
        if (targetUserId == actor.userId()) {
            throw AuthException.actionable(AuthErrorCode.INVALID_TARGET, "Self impersonation is not allowed");
        }
        String trimmedReason = validReason(reason);

        UserAccount target = directory.findUserById(targetUserId)
                .filter(UserAccount::active)
                .orElseThrow(() -> AuthException.actionable(AuthErrorCode.INVALID_TARGET,
                        "Target user not found or inactive"));
        if (target.role() == Role.SYSTEM_ADMIN) {
            throw AuthException.actionable(AuthErrorCode.FORBIDDEN,
                    "Impersonating system admin accounts is not allowed");
        }
        Tenant tenant = activeTenant(target.tenantId())
                .orElseThrow(() -> AuthException.actionable(AuthErrorCode.INVALID_TARGET,
                        "Target tenant not found or inactive"));

        ImpersonationClaim claim = new ImpersonationClaim(
                true,
                actor.userId(),
                actor.email(),
                actor.role(),
                actor.tenantId(),
                actor.tenantSlug(),
                trimmedReason,
                clock.instant());
        IssuedToken token = tokenCodec.issue(
                new TokenSubject(target.id(), target.email(), tenant.id(), tenant.slug(), target.role()),
                tokenCodec.settings().impersonationTtl(),
                claim);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target_email", target.email());
        details.put("target_role", target.role().value());
        details.put("target_tenant_id", target.tenantId());
        details.put("reason", trimmedReason);
        auditSink.write(new AuditRecord(actor.userId(), actor.email(), actor.tenantId(),
                AuditActions.IMPERSONATION_START, AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER,
                Long.toString(target.id()), details, claim.startedAt()));

        log.info("Impersonation started: actorUserId={}, targetUserId={}, targetTenantId={}, jti={}",
                actor.userId(), target.id(), tenant.id(), token.payload().jti());
        return token;
    }

    /**
     * Ends a ghost session and issues a normal token for the operator behind it. The ghost token
     * is revoked best-effort, the same way as on logout.
     *
     * @param current resolved context of the ghost session
     * @throws AuthException CONFLICT when not impersonating, FORBIDDEN when the operator is no longer valid
     */
    public IssuedToken stop(AuthContext current) {
        if (!current.isImpersonating()) {
            throw AuthException.actionable(AuthErrorCode.CONFLICT, "No active impersonation session");
        }
        Impersonator impersonator = current.impersonator();
        UserAccount actor = directory.findUserById(impersonator.userId())
                .filter(UserAccount::active)
                .filter(user -> user.role() == Role.SYSTEM_ADMIN)
                .orElseThrow(() -> AuthException.actionable(AuthErrorCode.FORBIDDEN,
                        "Impersonation actor is invalid"));
        Tenant actorTenant = activeTenant(actor.tenantId())
                .orElseThrow(() -> AuthException.actionable(AuthErrorCode.FORBIDDEN,
                        "Actor tenant not found or inactive"));

        IssuedToken token = tokenCodec.issue(
                new TokenSubject(actor.id(), actor.email(), actorTenant.id(), actorTenant.slug(), actor.role()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target_email", current.email());
        details.put("target_tenant_id", current.tenantId());
        details.put("reason", impersonator.reason() == null ? "" : impersonator.reason());
        Instant now = clock.instant();
        auditSink.write(new AuditRecord(actor.id(), actor.email(), actorTenant.id(),
                AuditActions.IMPERSONATION_STOP, AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER,
                Long.toString(current.userId()), details, now));

        boolean ghostRevoked = current.tokenId() != null && current.expiresAt() != null
                && revocationGuard.revokeToken(current.tenantId(), current.tokenId(), current.expiresAt());

        log.info("Impersonation stopped: actorUserId={}, targetUserId={}, ghostRevoked={}",
                actor.id(), current.userId(), ghostRevoked);
        return token;
    }

    private Optional<Tenant> activeTenant(long tenantId) {
        return directory.findTenantById(tenantId).filter(Tenant::active);
    }

    private static String validReason(String reason) {
        String trimmed = reason == null ? "" : reason.strip();
        if (trimmed.length() < MIN_REASON_LENGTH || trimmed.length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("reason must be between %d and %d characters"
                    .formatted(MIN_REASON_LENGTH, MAX_REASON_LENGTH));
        }
        return trimmed;
    }
}
