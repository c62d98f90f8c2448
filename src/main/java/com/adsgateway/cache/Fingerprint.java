package com.adsgateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic cache and dedup key for a remote request.
 *
 * Named parameters are rendered with keys sorted at every nesting level, so
 * {@code {a, b}} and {@code {b, a}} collide. List values keep their order:
 * {@code fields=[spend, clicks]} and {@code fields=[clicks, spend]} are different requests.
 */
public final class Fingerprint {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Fingerprint() {
    }

    public static String of(String endpoint, String objectId, Map<String, ?> parameters, String credentialId) {
        return of(endpoint, objectId, parameters, false, credentialId);
    }

    /**
     * @param allPages true when the request collects every page rather than the first one
     */
    public static String of(String endpoint, String objectId, Map<String, ?> parameters,
                            boolean allPages, String credentialId) {
        Map<String, Object> shape = new LinkedHashMap<>();
        shape.put("credential", credentialId);
        shape.put("object", objectId);
        shape.put("endpoint", endpoint);
        shape.put("params", parameters);
        if (allPages) {
            shape.put("pages", "all");
        }

        try {
            return sha256(CANONICAL.writeValueAsString(shape));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable", e);
        }
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
