package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisTokenCacheTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> ops;
    private RedisTokenCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = Mockito.mock(StringRedisTemplate.class);
        ops = Mockito.mock(ValueOperations.class);
        Mockito.when(redis.opsForValue()).thenReturn(ops);
        cache = new RedisTokenCache(redis, "reconciler:token:", Duration.ofMinutes(5));
    }

    @Test
    void hitDoesNotRefresh() {
        Mockito.when(ops.get("reconciler:token:k")).thenReturn("cached");

        Assertions.assertEquals(Optional.of("cached"), cache.getOrRefresh("k", () -> {
            throw new AssertionError("refresher must not run");
        }));
    }

    @Test
    void missStoresWithLifetimeMinusBuffer() {
        Optional<String> token = cache.getOrRefresh("k", () -> Optional.of(new IssuedToken("fresh", Duration.ofHours(1))));

        Assertions.assertEquals(Optional.of("fresh"), token);
        Mockito.verify(ops).set("reconciler:token:k", "fresh", Duration.ofMinutes(55));
    }

    @Test
    void unavailableRedisFallsThroughToRefresher() {
        Mockito.when(ops.get(Mockito.anyString())).thenThrow(new RedisConnectionFailureException("down"));
        Mockito.doThrow(new RedisConnectionFailureException("down")).when(ops)
                .set(Mockito.anyString(), Mockito.anyString(), Mockito.any(Duration.class));

        Assertions.assertEquals(Optional.of("fresh"),
                cache.getOrRefresh("k", () -> Optional.of(new IssuedToken("fresh", Duration.ofMinutes(1)))));
    }
}
