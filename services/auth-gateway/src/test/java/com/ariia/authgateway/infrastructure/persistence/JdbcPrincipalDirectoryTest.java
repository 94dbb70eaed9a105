package com.ariia.authgateway.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ariia.security.Role;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcPrincipalDirectory")
class JdbcPrincipalDirectoryTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcPrincipalDirectory directory;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:directory-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration/auth").load().migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);
        directory = new JdbcPrincipalDirectory(jdbcTemplate);

        appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(JdbcPrincipalDirectory.class)).addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(JdbcPrincipalDirectory.class)).detachAppender(appender);
    }

    @Nested
    @DisplayName("tenants")
    class Tenants {

        @Test
        @DisplayName("inserted tenants are found by id and slug")
        void insertAndFind() {
            long id = directory.insertTenant("acme", "Acme Inc");

            assertThat(directory.findTenantById(id)).contains(new Tenant(id, "acme", "Acme Inc", true));
            assertThat(directory.findTenantBySlug("acme")).map(Tenant::id).contains(id);
        }

        @Test
        @DisplayName("reports inactive tenants as such")
        void inactiveTenant() {
            long id = directory.insertTenant("gone", "Gone");
            jdbcTemplate.update("UPDATE tenants SET is_active = FALSE WHERE id = ?", id);

            assertThat(directory.findTenantById(id)).map(Tenant::active).contains(false);
        }

        @Test
        @DisplayName("unknown ids are absent")
        void unknownTenant() {
            assertThat(directory.findTenantById(999)).isEmpty();
            assertThat(directory.findTenantBySlug("nope")).isEmpty();
        }
    }

    @Nested
    @DisplayName("users")
    class Users {

        private long tenantId;

        @BeforeEach
        void createTenant() {
            tenantId = directory.insertTenant("acme", "Acme");
        }

        @Test
        @DisplayName("inserted users are found by id and email")
        void insertAndFind() {
            long id = directory.insertUser(tenantId, "a@acme.test", "Ada", Role.TENANT_ADMIN, "hash");

            UserAccount byId = directory.findUserById(id).orElseThrow();
            assertThat(byId.tenantId()).isEqualTo(tenantId);
            assertThat(byId.email()).isEqualTo("a@acme.test");
            assertThat(byId.fullName()).isEqualTo("Ada");
            assertThat(byId.role()).isEqualTo(Role.TENANT_ADMIN);
            assertThat(byId.passwordHash()).isEqualTo("hash");
            assertThat(byId.active()).isTrue();
            assertThat(directory.findUserByEmail("a@acme.test")).contains(byId);
        }

        @Test
        @DisplayName("a stored role outside the closed set makes the row absent and logs a warning")
        void unknownRoleIsAbsent() {
            long id = directory.insertUser(tenantId, "b@acme.test", null, Role.TENANT_USER, "hash");
            jdbcTemplate.update("UPDATE users SET role = 'superuser' WHERE id = ?", id);

            assertThat(directory.findUserById(id)).isEmpty();
            assertThat(directory.findUserByEmail("b@acme.test")).isEmpty();
            assertThat(appender.list)
                    .anySatisfy(event -> assertThat(event.getFormattedMessage()).contains("superuser"));
        }
    }
}
