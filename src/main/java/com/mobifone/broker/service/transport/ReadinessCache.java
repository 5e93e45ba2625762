package com.mobifone.broker.service.transport;

import com.mobifone.broker.configuration.BrokerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probe outcomes per address, kept for a fixed TTL. Negative results are cached too, so a
 * machine that is still booting is probed at most once per TTL window.
 */
@Slf4j
@Component
public class ReadinessCache {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public ReadinessCache(BrokerProperties properties, Clock clock) {
        this(properties.getReadiness().getTtl(), clock);
    }

    public ReadinessCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<Boolean> get(String address) {
        Entry entry = entries.get(address);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            entries.remove(address, entry);
            return Optional.empty();
        }
        return Optional.of(entry.ready);
    }

    public void put(String address, boolean ready) {
        entries.put(address, new Entry(ready, clock.instant().plus(ttl)));
    }

    public void invalidate(String address) {
        entries.remove(address);
    }

    public int size() {
        return entries.size();
    }

    @Scheduled(fixedDelayString = "${broker.readiness.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired readiness entries", evicted);
        }
    }

    private static final class Entry {
        private final boolean ready;
        private final Instant expiry;

        private Entry(boolean ready, Instant expiry) {
            this.ready = ready;
            this.expiry = expiry;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiry);
        }
    }
}
