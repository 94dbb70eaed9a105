package com.ariia.authgateway.application;

import com.ariia.security.AuthContext;
import com.ariia.security.AuthErrorCode;
import com.ariia.security.AuthException;
import com.ariia.security.AuthenticationService;
import com.ariia.security.Role;
import com.ariia.security.TenantIsolationEnforcer;
import com.ariia.security.audit.AuditActions;
import com.ariia.security.audit.AuditRecord;
import com.ariia.security.audit.AuditSink;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.UserAccount;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Signs a user out everywhere.
 *
 * <p>System admins may target anyone. Tenant admins may target users of their own tenant that
 * are not system admins. Every attempt that passes the checks is audited, including one whose
 * marker could not be written.
 */
@Service
public class SessionRevocationService {

    private static final Logger log = LoggerFactory.getLogger(SessionRevocationService.class);
    private static final Set<Role> ALLOWED_ROLES = Set.of(Role.SYSTEM_ADMIN, Role.TENANT_ADMIN);

    private final AuthenticationService authenticationService;
    private final PrincipalDirectory directory;
    private final AuditSink auditSink;
    private final Clock clock;

    public SessionRevocationService(
            AuthenticationService authenticationService, PrincipalDirectory directory, AuditSink auditSink, Clock clock) {
        this.authenticationService = authenticationService;
        this.directory = directory;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    /**
     * @return the revoked user, and whether the revocation marker was written
     * @throws AuthException FORBIDDEN for a disallowed caller, INVALID_TARGET for an unknown user
     */
    public Result revokeAllSessions(AuthContext caller, long targetUserId) {
        authenticationService.requireRole(caller, ALLOWED_ROLES);
        UserAccount target = directory.findUserById(targetUserId)
                .orElseThrow(() -> AuthException.actionable(AuthErrorCode.INVALID_TARGET, "Target user not found"));
        if (caller.role() != Role.SYSTEM_ADMIN && target.role() == Role.SYSTEM_ADMIN) {
            throw AuthException.actionable(AuthErrorCode.FORBIDDEN, "Cannot revoke system admin sessions");
        }
        TenantIsolationEnforcer.enforce(caller, target.tenantId());

        boolean revoked = authenticationService.revokeUser(target.id(), target.tenantId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target_email", target.email());
        details.put("target_tenant_id", target.tenantId());
        details.put("marker_written", revoked);
        auditSink.write(new AuditRecord(caller.userId(), caller.email(), caller.tenantId(),
                AuditActions.SESSIONS_REVOKE, AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER,
                Long.toString(target.id()), details, clock.instant()));

        if (!revoked) {
            log.warn("Sessions not revoked, store unavailable: targetUserId={}, tenantId={}",
                    target.id(), target.tenantId());
        }
        return new Result(target.id(), target.tenantId(), revoked);
    }

    /** Outcome of a revocation. */
    public record Result(long userId, long tenantId, boolean revoked) {
    }
}
