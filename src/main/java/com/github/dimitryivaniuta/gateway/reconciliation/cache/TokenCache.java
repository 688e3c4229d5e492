package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keyed cache of bearer tokens with explicit expiry.
 *
 * <p>Concurrent refreshes of the same key are not serialized: both refreshers run and the last write
 * wins. Every refresher returns a valid token, so the race only costs an extra sign-in.</p>
 */
public interface TokenCache {

    /**
     * Returns the cached token for {@code key} or obtains and caches a new one.
     *
     * @param key cache key
     * @param refresher called on a miss; an empty result is not cached
     * @return token, empty when the refresher could not obtain one
     */
    Optional<String> getOrRefresh(String key, Supplier<Optional<IssuedToken>> refresher);

    /**
     * Drops the token for {@code key}, forcing the next call to refresh.
     *
     * @param key cache key
     */
    void evict(String key);
}
