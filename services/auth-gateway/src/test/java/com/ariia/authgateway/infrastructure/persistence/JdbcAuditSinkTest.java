package com.ariia.authgateway.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ariia.observability.SensitiveDataRedactor;
import com.ariia.security.audit.AuditActions;
import com.ariia.security.audit.AuditRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcAuditSink")
class JdbcAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JdbcTemplate jdbcTemplate;
    private JdbcAuditSink sink;

    @BeforeEach
    void setUp() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:audit-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration/auth").load().migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);
        sink = new JdbcAuditSink(jdbcTemplate, objectMapper, new SensitiveDataRedactor());
    }

    @Test
    @DisplayName("stores every column of the record")
    void storesRecord() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target_email", "u@acme.test");
        details.put("reason", "investigating billing ticket");

        sink.write(new AuditRecord(1, "root@ariia.test", 1, AuditActions.IMPERSONATION_START,
                AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER, "11", details,
                Instant.parse("2026-03-01T12:00:00Z")));

        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM audit_logs");
        assertThat(row)
                .containsEntry("actor_email", "root@ariia.test")
                .containsEntry("action", "auth.impersonation.start")
                .containsEntry("category", "security")
                .containsEntry("target_type", "user")
                .containsEntry("target_id", "11");
        assertThat(((Number) row.get("actor_user_id")).longValue()).isEqualTo(1L);
    }

    @Test
    @DisplayName("redacts sensitive detail keys before storing")
    void redactsDetails() throws Exception {
        sink.write(new AuditRecord(1, "root@ariia.test", 1, AuditActions.SESSIONS_REVOKE,
                AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER, "11",
                Map.of("access_token", "abc.def", "target_tenant_id", 2), Instant.now()));

        String json = jdbcTemplate.queryForObject("SELECT details_json FROM audit_logs", String.class);
        JsonNode details = objectMapper.readTree(json);
        assertThat(details.get("access_token").asText()).isEqualTo(SensitiveDataRedactor.REDACTED);
        assertThat(details.get("target_tenant_id").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("propagates write failures")
    void propagatesFailures() {
        jdbcTemplate.execute("DROP TABLE audit_logs");

        assertThatThrownBy(() -> sink.write(new AuditRecord(1, "root@ariia.test", 1, AuditActions.SESSIONS_REVOKE,
                AuditRecord.CATEGORY_SECURITY, AuditRecord.TARGET_USER, "11", Map.of(), Instant.now())))
                .isInstanceOf(DataAccessException.class);
    }
}
