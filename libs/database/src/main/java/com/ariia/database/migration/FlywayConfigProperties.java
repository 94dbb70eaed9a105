package com.ariia.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Flyway settings for the auth schema.
 *
 * <p>Migrations run against the application's own {@code DataSource}; only where to find them and
 * whether to run them are configurable.
 *
 * <pre>{@code
 * ariia:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/auth
 * }</pre>
 *
 * @param enabled   whether to migrate on startup (default true)
 * @param locations Flyway migration locations (default {@value #DEFAULT_LOCATIONS})
 */
@Validated
@ConfigurationProperties(prefix = "ariia.flyway")
public record FlywayConfigProperties(Boolean enabled, @NotBlank String locations) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/auth";

    public FlywayConfigProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null) {
            locations = DEFAULT_LOCATIONS;
        }
    }
}
