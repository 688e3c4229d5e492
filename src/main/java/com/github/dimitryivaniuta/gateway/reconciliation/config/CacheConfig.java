package com.github.dimitryivaniuta.gateway.reconciliation.config;

import com.github.dimitryivaniuta.gateway.reconciliation.cache.InMemoryTokenCache;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.RedisTokenCache;
import com.github.dimitryivaniuta.gateway.reconciliation.cache.TokenCache;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Token cache configuration.
 *
 * <p>The NetValve backoffice token is always process-local. The fulfillment admin token can be
 * shared through Redis ({@code app.fulfillment.token-cache=redis}) so a fleet signs in once.</p>
 */
@Configuration
public class CacheConfig {

    /**
     * Key prefix of tokens stored in Redis.
     */
    public static final String REDIS_TOKEN_PREFIX = "reconciler:token:";

    /**
     * System UTC clock.
     *
     * @return clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Cache of the NetValve backoffice bearer token.
     *
     * @param clock clock
     * @param props application properties
     * @return token cache
     */
    @Bean
    public TokenCache backofficeTokenCache(Clock clock, AppProperties props) {
        return new InMemoryTokenCache(clock, props.getNetvalve().getBackoffice().getRefreshBuffer());
    }

    /**
     * Cache of the fulfillment backend admin token.
     *
     * @param clock clock
     * @param props application properties
     * @param redis redis template, when Redis is configured
     * @return token cache
     */
    @Bean
    public TokenCache fulfillmentTokenCache(Clock clock, AppProperties props, ObjectProvider<StringRedisTemplate> redis) {
        StringRedisTemplate template = redis.getIfAvailable();
        if ("redis".equalsIgnoreCase(props.getFulfillment().getTokenCache()) && template != null) {
            return new RedisTokenCache(template, REDIS_TOKEN_PREFIX, Duration.ZERO);
        }
        return new InMemoryTokenCache(clock, Duration.ZERO);
    }
}
