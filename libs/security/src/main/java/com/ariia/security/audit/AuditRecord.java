package com.ariia.security.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit-log entry emitted by the auth core.
 *
 * @param actorUserId user who performed the action
 * @param actorEmail  that user's email
 * @param tenantId    tenant the entry is filed under
 * @param action      dotted action name, e.g. {@code auth.impersonation.start}
 * @param category    coarse grouping, e.g. {@code security}
 * @param targetType  kind of object acted upon, e.g. {@code user}
 * @param targetId    ID of that object
 * @param details     free-form details; sensitive keys are redacted by the sink
 * @param createdAt   when the action happened
 */
public record AuditRecord(
        long actorUserId,
        String actorEmail,
        long tenantId,
        String action,
        String category,
        String targetType,
        String targetId,
        Map<String, Object> details,
        Instant createdAt
) {

    public static final String CATEGORY_SECURITY = "security";
    public static final String TARGET_USER = "user";

    public AuditRecord {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be blank");
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
