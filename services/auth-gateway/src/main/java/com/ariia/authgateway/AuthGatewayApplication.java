package com.ariia.authgateway;

import com.ariia.authgateway.config.AuthProperties;
import com.ariia.authgateway.config.BootstrapProperties;
import com.ariia.authgateway.config.ServiceProperties;
import com.ariia.database.migration.AuthSchemaMigrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * ARIIA auth gateway: sign-in, session resolution, revocation and impersonation over HTTP.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation and principal fields in the logging MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Auth schema migration through {@link AuthSchemaMigrationConfig}
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, AuthProperties.class, BootstrapProperties.class})
@Import(AuthSchemaMigrationConfig.class)
public class AuthGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthGatewayApplication.class, args);
        log.info("ARIIA auth gateway started");
    }
}
