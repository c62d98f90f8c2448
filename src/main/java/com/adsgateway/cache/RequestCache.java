package com.adsgateway.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Recent remote responses keyed by request fingerprint.
 * Advisory only: callers must behave the same whether it hits or not.
 */
public interface RequestCache {

    /**
     * @return the stored payload, or empty when absent or expired
     */
    Optional<JsonNode> lookup(String fingerprint);

    /**
     * Store a payload, replacing any previous entry for the fingerprint.
     */
    default void store(String fingerprint, JsonNode value, Duration ttl) {
        store(fingerprint, null, value, ttl);
    }

    /**
     * Store a payload on behalf of {@code owner} (a credential identity), so that
     * {@link #invalidateOwner} can drop it later.
     */
    void store(String fingerprint, String owner, JsonNode value, Duration ttl);

    /**
     * Drop every entry stored on behalf of {@code owner}.
     *
     * @return number of entries removed
     */
    int invalidateOwner(String owner);

    void invalidate(String fingerprint);

    void clear();

    int size();
}
