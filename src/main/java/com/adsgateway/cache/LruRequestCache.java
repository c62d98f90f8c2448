package com.adsgateway.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size-bounded request cache with per-entry TTL.
 *
 * - LinkedHashMap in access order gives least-recently-used eviction
 * - Capacity is enforced on every store, independent of expiry
 * - Expired entries are dropped when looked up
 * - Stored payloads are deep copies and never handed out for mutation
 *
 * All operations are synchronized; the critical sections are tiny.
 */
@Slf4j
public class LruRequestCache implements RequestCache {

    private final int capacity;
    private final Clock clock;
    private final LinkedHashMap<String, CachedResponse> entries;

    private final Counter hits;
    private final Counter misses;
    private final Counter evictions;

    public LruRequestCache(int capacity, Clock clock, MeterRegistry meterRegistry) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.clock = clock;

        this.hits = Counter.builder("cache.requests.hits")
                .description("Request cache hits")
                .register(meterRegistry);
        this.misses = Counter.builder("cache.requests.misses")
                .description("Request cache misses, expired entries included")
                .register(meterRegistry);
        this.evictions = Counter.builder("cache.requests.evictions")
                .description("Entries evicted by the capacity bound")
                .register(meterRegistry);

        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedResponse> eldest) {
                boolean evict = size() > LruRequestCache.this.capacity;
                if (evict) {
                    evictions.increment();
                    log.trace("Evicting least recently used entry {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized Optional<JsonNode> lookup(String fingerprint) {
        CachedResponse entry = entries.get(fingerprint);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(fingerprint);
            misses.increment();
            log.trace("Entry {} expired", fingerprint);
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.value.deepCopy());
    }

    @Override
    public synchronized void store(String fingerprint, String owner, JsonNode value, Duration ttl) {
        entries.put(fingerprint, new CachedResponse(owner, value.deepCopy(), clock.instant().plus(ttl)));
    }

    @Override
    public synchronized int invalidateOwner(String owner) {
        int before = entries.size();
        entries.values().removeIf(entry -> owner.equals(entry.owner));
        int removed = before - entries.size();
        log.debug("Dropped {} cached responses of {}", removed, owner);
        return removed;
    }

    @Override
    public synchronized void invalidate(String fingerprint) {
        entries.remove(fingerprint);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        log.info("Request cache cleared");
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private static final class CachedResponse {
        private final String owner;
        private final JsonNode value;
        private final Instant expiresAt;

        private CachedResponse(String owner, JsonNode value, Instant expiresAt) {
            this.owner = owner;
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
