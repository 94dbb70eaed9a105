package com.ariia.authgateway.application;

import com.ariia.authgateway.config.BootstrapProperties;
import com.ariia.authgateway.config.ServiceProperties;
import com.ariia.authgateway.infrastructure.persistence.JdbcPrincipalDirectory;
import com.ariia.security.AuthenticationService;
import com.ariia.security.Role;
import com.ariia.security.password.PasswordHasher;
import com.ariia.security.principal.Tenant;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the system tenant and the platform operator on first start.
 *
 * <p>In production the runner refuses a weak or known-default admin password; the exception
 * aborts application startup. Existing rows are never modified.
 */
@Component
public class SystemAdminBootstrap implements ApplicationRunner {

    static final int MIN_PRODUCTION_PASSWORD_LENGTH = 12;
    static final Set<String> WEAK_PASSWORDS =
            Set.of("password123", "password", "admin", "changeme", "arni", "12345678", "");

    private static final Logger log = LoggerFactory.getLogger(SystemAdminBootstrap.class);

    private final BootstrapProperties bootstrap;
    private final ServiceProperties service;
    private final JdbcPrincipalDirectory directory;
    private final PasswordHasher passwordHasher;

    public SystemAdminBootstrap(
            BootstrapProperties bootstrap,
            ServiceProperties service,
            JdbcPrincipalDirectory directory,
            PasswordHasher passwordHasher) {
        this.bootstrap = bootstrap;
        this.service = service;
        this.directory = directory;
        this.passwordHasher = passwordHasher;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!bootstrap.enabled()) {
            log.debug("System admin bootstrap disabled");
            return;
        }
        String password = bootstrap.adminPassword() == null ? "" : bootstrap.adminPassword();
        if (service.isProduction()) {
            checkProductionPassword(password);
        } else if (password.isBlank()) {
            log.warn("No system admin password configured, skipping bootstrap");
            return;
        }

        Tenant tenant = directory.findTenantBySlug(bootstrap.tenantSlug()).orElse(null);
        long tenantId;
        if (tenant == null) {
            tenantId = directory.insertTenant(bootstrap.tenantSlug(), bootstrap.tenantName());
            log.info("Created system tenant: tenantId={}, slug={}", tenantId, bootstrap.tenantSlug());
        } else {
            tenantId = tenant.id();
        }

        String email = AuthenticationService.normalizeEmail(bootstrap.adminEmail());
        if (directory.findUserByEmail(email).isPresent()) {
            log.debug("System admin already present: email={}", email);
            return;
        }
        long userId = directory.insertUser(tenantId, email, "System Admin", Role.SYSTEM_ADMIN,
                passwordHasher.hash(password));
        log.info("Created system admin: userId={}, tenantId={}", userId, tenantId);
    }

    static void checkProductionPassword(String password) {
        if (WEAK_PASSWORDS.contains(password.toLowerCase(Locale.ROOT))) {
            throw new IllegalStateException(
                    "Refusing startup in production: system admin password is weak or a known default");
        }
        if (password.length() < MIN_PRODUCTION_PASSWORD_LENGTH) {
            throw new IllegalStateException("Refusing startup in production: system admin password must be at least "
                    + MIN_PRODUCTION_PASSWORD_LENGTH + " characters");
        }
    }
}
