package com.ariia.security.audit;

/**
 * The single audit port. Owned by the surrounding application.
 * <p>
 * A failing write propagates to the caller; operations that must be audited do not complete
 * without their record.
 */
@FunctionalInterface
public interface AuditSink {

    void write(AuditRecord record);
}
