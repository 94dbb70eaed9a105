package com.ariia.authgateway.infrastructure.persistence;

import com.ariia.observability.SensitiveDataRedactor;
import com.ariia.security.audit.AuditRecord;
import com.ariia.security.audit.AuditSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Appends audit records to {@code audit_logs}.
 *
 * <p>Details are redacted and stored as JSON. Write failures propagate so callers that must not
 * proceed without an audit trail can abort.
 */
public class JdbcAuditSink implements AuditSink {

    private static final String INSERT =
            "INSERT INTO audit_logs (actor_user_id, actor_email, tenant_id, action, category, target_type, "
                    + "target_id, details_json, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SensitiveDataRedactor redactor;

    public JdbcAuditSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SensitiveDataRedactor redactor) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.redactor = redactor;
    }

    @Override
    public void write(AuditRecord record) {
        String details;
        try {
            details = objectMapper.writeValueAsString(redactor.redact(record.details()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit details for " + record.action(), e);
        }
        jdbcTemplate.update(INSERT,
                record.actorUserId(),
                record.actorEmail(),
                record.tenantId(),
                record.action(),
                record.category(),
                record.targetType(),
                record.targetId(),
                details,
                OffsetDateTime.ofInstant(record.createdAt(), ZoneOffset.UTC));
    }
}
