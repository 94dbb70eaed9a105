package com.ariia.security.audit;

/**
 * Action names written by the auth core.
 */
public final class AuditActions {

    public static final String IMPERSONATION_START = "auth.impersonation.start";
    public static final String IMPERSONATION_STOP = "auth.impersonation.stop";
    public static final String SESSIONS_REVOKE = "auth.sessions.revoke";

    private AuditActions() {
        // constants
    }
}
