package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link TokenCache} backed by Redis, shared by all instances of the service.
 *
 * <p>Expiry is delegated to the Redis key TTL ({@code lifetime - refreshBuffer}). Redis errors fall
 * through to the refresher so an unavailable cache degrades to one sign-in per call.</p>
 */
public class RedisTokenCache implements TokenCache {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenCache.class);

    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final StringRedisTemplate redis;
    private final String keyPrefix;
    private final Duration refreshBuffer;

    /**
     * Creates the cache.
     *
     * @param redis redis template
     * @param keyPrefix namespace prepended to every key
     * @param refreshBuffer subtracted from the token lifetime
     */
    public RedisTokenCache(StringRedisTemplate redis, String keyPrefix, Duration refreshBuffer) {
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.refreshBuffer = refreshBuffer;
    }

    @Override
    public Optional<String> getOrRefresh(String key, Supplier<Optional<IssuedToken>> refresher) {
        String redisKey = keyPrefix + key;
        try {
            String cached = redis.opsForValue().get(redisKey);
            if (cached != null && !cached.isBlank()) {
                return Optional.of(cached);
            }
        } catch (RuntimeException ex) {
            log.warn("Token cache read failed for {}: {}", redisKey, ex.getMessage());
        }

        Optional<IssuedToken> issued = refresher.get();
        issued.ifPresent(t -> store(redisKey, t));
        return issued.map(IssuedToken::value);
    }

    @Override
    public void evict(String key) {
        try {
            redis.delete(keyPrefix + key);
        } catch (RuntimeException ex) {
            log.warn("Token cache evict failed for {}: {}", keyPrefix + key, ex.getMessage());
        }
    }

    private void store(String redisKey, IssuedToken token) {
        Duration ttl = token.lifetime().minus(refreshBuffer);
        if (ttl.compareTo(MIN_TTL) < 0) {
            ttl = MIN_TTL;
        }
        try {
            redis.opsForValue().set(redisKey, token.value(), ttl);
        } catch (RuntimeException ex) {
            log.warn("Token cache write failed for {}: {}", redisKey, ex.getMessage());
        }
    }
}
