package com.ariia.authgateway.infrastructure.persistence;

import com.ariia.security.Role;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * {@link PrincipalDirectory} over the {@code users} and {@code tenants} tables.
 *
 * <p>Rows whose {@code role} is not one of the platform roles are skipped with a warning. The two
 * insert methods exist for first-start provisioning only.
 */
public class JdbcPrincipalDirectory implements PrincipalDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcPrincipalDirectory.class);

    private static final String USER_COLUMNS =
            "SELECT id, tenant_id, email, full_name, role, password_hash, is_active FROM users ";
    private static final String TENANT_COLUMNS = "SELECT id, slug, name, is_active FROM tenants ";

    private static final RowMapper<Tenant> TENANT_MAPPER = (rs, rowNum) -> new Tenant(
            rs.getLong("id"), rs.getString("slug"), rs.getString("name"), rs.getBoolean("is_active"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcPrincipalDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserAccount> findUserById(long userId) {
        return firstUser(jdbcTemplate.query(USER_COLUMNS + "WHERE id = ?", this::mapUser, userId));
    }

    @Override
    public Optional<UserAccount> findUserByEmail(String email) {
        return firstUser(jdbcTemplate.query(USER_COLUMNS + "WHERE email = ?", this::mapUser, email));
    }

    @Override
    public Optional<Tenant> findTenantById(long tenantId) {
        return jdbcTemplate.query(TENANT_COLUMNS + "WHERE id = ?", TENANT_MAPPER, tenantId).stream().findFirst();
    }

    public Optional<Tenant> findTenantBySlug(String slug) {
        return jdbcTemplate.query(TENANT_COLUMNS + "WHERE slug = ?", TENANT_MAPPER, slug).stream().findFirst();
    }

    public long insertTenant(String slug, String name) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            var statement = connection.prepareStatement(
                    "INSERT INTO tenants (slug, name, is_active) VALUES (?, ?, TRUE)", new String[] {"id"});
            statement.setString(1, slug);
            statement.setString(2, name);
            return statement;
        }, keys);
        return keys.getKey().longValue();
    }

    public long insertUser(long tenantId, String email, String fullName, Role role, String passwordHash) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            var statement = connection.prepareStatement(
                    "INSERT INTO users (tenant_id, email, full_name, role, password_hash, is_active) "
                            + "VALUES (?, ?, ?, ?, ?, TRUE)",
                    new String[] {"id"});
            statement.setLong(1, tenantId);
            statement.setString(2, email);
            statement.setString(3, fullName);
            statement.setString(4, role.value());
            statement.setString(5, passwordHash);
            return statement;
        }, keys);
        return keys.getKey().longValue();
    }

    // Null marks a row with an unknown role; such rows never leave this class.
    private UserAccount mapUser(ResultSet rs, int rowNum) throws SQLException {
        String storedRole = rs.getString("role");
        Optional<Role> role = Role.fromString(storedRole);
        if (role.isEmpty()) {
            log.warn("Ignoring user with unknown role: userId={}, role={}", rs.getLong("id"), storedRole);
            return null;
        }
        return new UserAccount(
                rs.getLong("id"),
                rs.getLong("tenant_id"),
                rs.getString("email"),
                rs.getString("full_name"),
                role.get(),
                rs.getString("password_hash"),
                rs.getBoolean("is_active"));
    }

    private static Optional<UserAccount> firstUser(List<UserAccount> rows) {
        return rows.stream().filter(Objects::nonNull).findFirst();
    }
}
