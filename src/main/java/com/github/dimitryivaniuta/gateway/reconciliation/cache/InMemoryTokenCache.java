package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-local {@link TokenCache}.
 *
 * <p>An entry is served while {@code now < expiresAt - refreshBuffer}.</p>
 */
public class InMemoryTokenCache implements TokenCache {

    private record Entry(String value, Instant expiresAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration refreshBuffer;

    /**
     * Creates the cache.
     *
     * @param clock time source
     * @param refreshBuffer how long before expiry an entry stops being served
     */
    public InMemoryTokenCache(Clock clock, Duration refreshBuffer) {
        this.clock = clock;
        this.refreshBuffer = refreshBuffer;
    }

    @Override
    public Optional<String> getOrRefresh(String key, Supplier<Optional<IssuedToken>> refresher) {
        Entry cached = entries.get(key);
        Instant now = clock.instant();
        if (cached != null && now.isBefore(cached.expiresAt().minus(refreshBuffer))) {
            return Optional.of(cached.value());
        }

        Optional<IssuedToken> issued = refresher.get();
        issued.ifPresent(t -> entries.put(key, new Entry(t.value(), clock.instant().plus(t.lifetime()))));
        return issued.map(IssuedToken::value);
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }
}
