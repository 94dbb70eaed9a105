package com.ariia.authgateway.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service, bound from {@code ariia.service.*}.
 *
 * <pre>
 * ariia:
 *   service:
 *     name: auth-gateway
 *     environment: production
 * </pre>
 *
 * @param name        service name used for logging and metric tags. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description
 */
@ConfigurationProperties(prefix = "ariia.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public static final String PRODUCTION = "production";

    /**
     * Applies defaults before Bean Validation runs.
     */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }

    public boolean isProduction() {
        return PRODUCTION.equalsIgnoreCase(environment);
    }
}
