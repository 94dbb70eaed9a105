package com.ariia.security.testing;

import com.ariia.security.audit.AuditRecord;
import com.ariia.security.audit.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link AuditSink} that keeps every record in memory and can be told to fail.
 */
public final class RecordingAuditSink implements AuditSink {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void write(AuditRecord record) {
        if (failing) {
            throw new IllegalStateException("audit sink unavailable");
        }
        records.add(record);
    }

    public List<AuditRecord> records() {
        return List.copyOf(records);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
