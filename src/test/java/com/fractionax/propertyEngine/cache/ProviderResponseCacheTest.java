package com.fractionax.propertyEngine.cache;

import com.fractionax.propertyEngine.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProviderResponseCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
    private final ProviderResponseCache<String, String> cache =
            new ProviderResponseCache<>("structures", Duration.ofHours(12), 100, clock);

    @Test
    @DisplayName("a value is loaded once and served until the TTL passes")
    void loadsOncePerTtl() {
        AtomicInteger loads = new AtomicInteger();

        assertEquals("v1", cache.get("555", key -> "v" + loads.incrementAndGet()));
        clock.advance(Duration.ofHours(11));
        assertEquals("v1", cache.get("555", key -> "v" + loads.incrementAndGet()));
        clock.advance(Duration.ofHours(2));
        assertEquals("v2", cache.get("555", key -> "v" + loads.incrementAndGet()));

        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("null answers and failures are not stored")
    void nullAndFailureNotStored() {
        assertNull(cache.get("555", key -> null));
        assertThrows(IllegalStateException.class, () -> cache.get("555", key -> {
            throw new IllegalStateException("provider down");
        }));

        assertEquals(0, cache.size());
        assertEquals("loaded", cache.get("555", key -> "loaded"));
    }

    @Test
    @DisplayName("clear drops every entry")
    void clear() {
        cache.get("555", key -> "a");
        cache.get("556", key -> "b");

        cache.clear();

        assertEquals(0, cache.size());
    }
}
