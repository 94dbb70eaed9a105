package com.ariia.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the auth schema on startup.
 *
 * <p>Services importing this configuration should switch off Spring Boot's own Flyway
 * auto-configuration ({@code spring.flyway.enabled: false}) so the schema is migrated once, from
 * {@link FlywayConfigProperties#locations()}.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "ariia.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AuthSchemaMigrationConfig {

    /** Bean name of the auth schema Flyway instance. */
    public static final String AUTH_FLYWAY_BEAN = "authFlyway";

    @Bean(name = AUTH_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway authFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return createFlyway(dataSource, properties);
    }

    /**
     * Builds the Flyway instance used for the auth schema. Clean is always disabled.
     */
    static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
