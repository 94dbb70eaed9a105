package com.ariia.authgateway.infrastructure.redis;

import com.ariia.security.revocation.RevocationStore;
import com.ariia.security.revocation.RevocationStoreException;
import java.time.Duration;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Revocation markers in Redis.
 *
 * <p>Each marker is a plain string key with value {@code "1"} and a Redis TTL. Command timeouts
 * come from {@code spring.data.redis.timeout}; any Redis failure surfaces as
 * {@link RevocationStoreException}.
 */
public class RedisRevocationStore implements RevocationStore {

    private static final String MARKER = "1";

    private final StringRedisTemplate redisTemplate;

    public RedisRevocationStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            throw new RevocationStoreException("Redis check failed for " + key, e);
        }
    }

    @Override
    public void setWithTtl(String key, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, MARKER, ttl);
        } catch (DataAccessException e) {
            throw new RevocationStoreException("Redis write failed for " + key, e);
        }
    }
}
