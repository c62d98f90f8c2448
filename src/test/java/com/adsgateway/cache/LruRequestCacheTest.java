package com.adsgateway.cache;

import com.adsgateway.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LruRequestCacheTest {

    private static final Duration TTL = Duration.ofSeconds(300);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private LruRequestCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        cache = new LruRequestCache(3, clock, meterRegistry);
    }

    private JsonNode payload(String id) {
        return objectMapper.createObjectNode().put("id", id);
    }

    @Test
    @DisplayName("Should serve entries until the TTL elapses")
    void shouldExpireAfterTtl() {
        cache.store("fp", payload("1"), TTL);

        clock.advance(Duration.ofSeconds(299));
        assertEquals(Optional.of(payload("1")), cache.lookup("fp"));

        clock.advance(Duration.ofSeconds(2));
        assertTrue(cache.lookup("fp").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should evict the least recently used entry at capacity")
    void shouldEvictLeastRecentlyUsed() {
        cache.store("a", payload("a"), TTL);
        cache.store("b", payload("b"), TTL);
        cache.store("c", payload("c"), TTL);

        // Touch a so b becomes the eldest
        cache.lookup("a");
        cache.store("d", payload("d"), TTL);

        assertEquals(3, cache.size());
        assertTrue(cache.lookup("b").isEmpty());
        assertTrue(cache.lookup("a").isPresent());
        assertTrue(cache.lookup("d").isPresent());
        assertEquals(1.0, meterRegistry.counter("cache.requests.evictions").count());
    }

    @Test
    @DisplayName("Should hand out copies that do not affect the stored entry")
    void shouldIsolateStoredPayload() {
        ObjectNode original = objectMapper.createObjectNode().put("id", "1");
        cache.store("fp", original, TTL);
        original.put("id", "mutated");

        ObjectNode served = (ObjectNode) cache.lookup("fp").orElseThrow();
        assertEquals("1", served.get("id").asText());
        served.put("id", "changed");

        assertEquals("1", cache.lookup("fp").orElseThrow().get("id").asText());
    }

    @Test
    @DisplayName("Should count hits and misses")
    void shouldCountHitsAndMisses() {
        cache.lookup("missing");
        cache.store("fp", payload("1"), TTL);
        cache.lookup("fp");

        assertEquals(1.0, meterRegistry.counter("cache.requests.hits").count());
        assertEquals(1.0, meterRegistry.counter("cache.requests.misses").count());
    }

    @Test
    @DisplayName("Should drop entries on invalidate and clear")
    void shouldInvalidateAndClear() {
        cache.store("a", payload("a"), TTL);
        cache.store("b", payload("b"), TTL);

        cache.invalidate("a");
        assertTrue(cache.lookup("a").isEmpty());
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should drop only the entries of one owner")
    void shouldInvalidateByOwner() {
        cache.store("a", "cred-1", payload("a"), TTL);
        cache.store("b", "cred-2", payload("b"), TTL);
        cache.store("c", "cred-1", payload("c"), TTL);

        assertEquals(2, cache.invalidateOwner("cred-1"));

        assertTrue(cache.lookup("a").isEmpty());
        assertTrue(cache.lookup("c").isEmpty());
        assertTrue(cache.lookup("b").isPresent());
        assertEquals(0, cache.invalidateOwner("cred-1"));
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LruRequestCache(0, clock, meterRegistry));
    }
}
