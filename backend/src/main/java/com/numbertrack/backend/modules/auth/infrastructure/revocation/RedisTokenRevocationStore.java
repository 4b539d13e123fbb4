package com.numbertrack.backend.modules.auth.infrastructure.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.numbertrack.backend.modules.auth.application.TokenRevocationStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared revocation list in Redis. Each key lives exactly as long as the token it blocks.
 */
@Component
@ConditionalOnProperty(value = "app.auth.revocation-store", havingValue = "redis")
public class RedisTokenRevocationStore implements TokenRevocationStore {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenRevocationStore.class);
    static final String KEY_PREFIX = "numbertrack:revoked-token:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisTokenRevocationStore(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public void revoke(String tokenId, OffsetDateTime expiresAt) {
        Duration ttl = Duration.between(OffsetDateTime.now(clock), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        redisTemplate.opsForValue().set(KEY_PREFIX + tokenId, "1", ttl);
        log.debug("revoked token {} for {}s", tokenId, ttl.toSeconds());
    }

    @Override
    public boolean isRevoked(String tokenId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + tokenId));
    }
}
