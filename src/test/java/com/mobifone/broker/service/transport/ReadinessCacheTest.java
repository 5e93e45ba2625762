package com.mobifone.broker.service.transport;

import com.mobifone.broker.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadinessCacheTest {
    private final MutableClock clock = MutableClock.startingNow();
    private final ReadinessCache cache = new ReadinessCache(Duration.ofSeconds(30), clock);

    @Test
    void entriesLiveForTheirTtl() {
        cache.put("10.0.0.5:3389", true);
        cache.put("10.0.0.6:3389", false);

        clock.advance(Duration.ofSeconds(29));
        assertEquals(Optional.of(true), cache.get("10.0.0.5:3389"));
        assertEquals(Optional.of(false), cache.get("10.0.0.6:3389"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("10.0.0.5:3389").isEmpty());
        assertEquals(1, cache.size());
    }

    @Test
    void evictionDropsOnlyExpiredEntries() {
        cache.put("old:5900", false);
        clock.advance(Duration.ofSeconds(20));
        cache.put("fresh:5900", true);
        clock.advance(Duration.ofSeconds(15));

        cache.evictExpired();

        assertEquals(1, cache.size());
        assertEquals(Optional.of(true), cache.get("fresh:5900"));
    }

    @Test
    void invalidateForgetsImmediately() {
        cache.put("10.0.0.5:3389", false);
        cache.invalidate("10.0.0.5:3389");

        assertTrue(cache.get("10.0.0.5:3389").isEmpty());
    }
}
