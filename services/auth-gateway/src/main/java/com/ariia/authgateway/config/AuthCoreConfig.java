package com.ariia.authgateway.config;

import com.ariia.authgateway.infrastructure.persistence.JdbcAuditSink;
import com.ariia.authgateway.infrastructure.persistence.JdbcPrincipalDirectory;
import com.ariia.authgateway.infrastructure.redis.RedisRevocationStore;
import com.ariia.observability.MetricFactory;
import com.ariia.observability.SensitiveDataRedactor;
import com.ariia.security.AuthenticationService;
import com.ariia.security.audit.AuditSink;
import com.ariia.security.impersonation.ImpersonationManager;
import com.ariia.security.legacy.LegacyFallbackResolver;
import com.ariia.security.password.PasswordHasher;
import com.ariia.security.principal.PrincipalResolver;
import com.ariia.security.revocation.RevocationGuard;
import com.ariia.security.revocation.RevocationStore;
import com.ariia.security.testing.InMemoryRevocationStore;
import com.ariia.security.token.TokenCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the auth core from {@link AuthProperties}.
 *
 * <p>The core classes are plain Java; this is the only place they meet Spring. The revocation
 * store follows {@code ariia.auth.revocation-store}: {@code redis} for any deployment with more
 * than one instance, {@code memory} for tests and single-process development.
 */
@Configuration
public class AuthCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthCoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, ServiceProperties serviceProperties) {
        return new MetricFactory(meterRegistry, serviceProperties.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public PasswordHasher passwordHasher() {
        return new PasswordHasher();
    }

    @Bean
    public TokenCodec tokenCodec(AuthProperties properties, Clock clock) {
        return new TokenCodec(properties.tokenSettings(), clock);
    }

    @Bean
    public JdbcPrincipalDirectory principalDirectory(JdbcTemplate jdbcTemplate) {
        return new JdbcPrincipalDirectory(jdbcTemplate);
    }

    @Bean
    public AuditSink auditSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SensitiveDataRedactor redactor) {
        return new JdbcAuditSink(jdbcTemplate, objectMapper, redactor);
    }

    @Bean
    public RevocationStore revocationStore(
            AuthProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate, Clock clock) {
        if (properties.revocationStore() == AuthProperties.RevocationStoreType.MEMORY) {
            log.warn("Using in-process revocation store; revocations are not shared between instances");
            return new InMemoryRevocationStore(clock);
        }
        return new RedisRevocationStore(redisTemplate.getObject());
    }

    @Bean
    public RevocationGuard revocationGuard(
            RevocationStore store, TokenCodec tokenCodec, Clock clock, MetricFactory metricFactory) {
        return new RevocationGuard(store, tokenCodec.settings().maxTtl(), clock, metricFactory);
    }

    @Bean
    public PrincipalResolver principalResolver(JdbcPrincipalDirectory directory, RevocationGuard guard) {
        return new PrincipalResolver(directory, guard);
    }

    @Bean
    public ImpersonationManager impersonationManager(
            TokenCodec tokenCodec, JdbcPrincipalDirectory directory, AuditSink auditSink,
            RevocationGuard guard, Clock clock) {
        return new ImpersonationManager(tokenCodec, directory, auditSink, guard, clock);
    }

    @Bean
    @SuppressWarnings("deprecation")
    public LegacyFallbackResolver legacyFallbackResolver(AuthProperties properties, JdbcPrincipalDirectory directory) {
        if (properties.legacySettings().enabled()) {
            log.warn("Legacy header fallback is enabled; unsigned identity headers are accepted");
        }
        return new LegacyFallbackResolver(properties.legacySettings(), directory);
    }

    @Bean
    @SuppressWarnings("deprecation")
    public AuthenticationService authenticationService(
            TokenCodec tokenCodec,
            PasswordHasher passwordHasher,
            JdbcPrincipalDirectory directory,
            PrincipalResolver principalResolver,
            RevocationGuard revocationGuard,
            ImpersonationManager impersonationManager,
            LegacyFallbackResolver legacyFallbackResolver,
            MetricFactory metricFactory) {
        return new AuthenticationService(tokenCodec, passwordHasher, directory, principalResolver,
                revocationGuard, impersonationManager, legacyFallbackResolver, metricFactory);
    }
}
