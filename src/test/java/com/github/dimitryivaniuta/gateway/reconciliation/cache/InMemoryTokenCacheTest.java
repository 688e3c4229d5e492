package com.github.dimitryivaniuta.gateway.reconciliation.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InMemoryTokenCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    @Test
    void servesCachedTokenUntilRefreshBuffer() {
        InMemoryTokenCache cache = new InMemoryTokenCache(clock, Duration.ofMinutes(5));
        AtomicInteger signIns = new AtomicInteger();

        Assertions.assertEquals(Optional.of("t1"), cache.getOrRefresh("k", () -> issue(signIns, "t1")));
        clock.advance(Duration.ofMinutes(54));
        Assertions.assertEquals(Optional.of("t1"), cache.getOrRefresh("k", () -> issue(signIns, "t2")));
        Assertions.assertEquals(1, signIns.get());

        // inside the five minute buffer before the one hour expiry
        clock.advance(Duration.ofMinutes(2));
        Assertions.assertEquals(Optional.of("t2"), cache.getOrRefresh("k", () -> issue(signIns, "t2")));
        Assertions.assertEquals(2, signIns.get());
    }

    @Test
    void emptyRefreshIsNotCached() {
        InMemoryTokenCache cache = new InMemoryTokenCache(clock, Duration.ZERO);
        AtomicInteger signIns = new AtomicInteger();

        Assertions.assertTrue(cache.getOrRefresh("k", Optional::empty).isEmpty());
        Assertions.assertEquals(Optional.of("t1"), cache.getOrRefresh("k", () -> issue(signIns, "t1")));
    }

    @Test
    void evictForcesRefresh() {
        InMemoryTokenCache cache = new InMemoryTokenCache(clock, Duration.ZERO);
        AtomicInteger signIns = new AtomicInteger();
        cache.getOrRefresh("k", () -> issue(signIns, "t1"));

        cache.evict("k");

        Assertions.assertEquals(Optional.of("t2"), cache.getOrRefresh("k", () -> issue(signIns, "t2")));
        Assertions.assertEquals(2, signIns.get());
    }

    private static Optional<IssuedToken> issue(AtomicInteger counter, String value) {
        counter.incrementAndGet();
        return Optional.of(new IssuedToken(value, Duration.ofHours(1)));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
