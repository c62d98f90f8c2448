package com.adsgateway.core;

import com.adsgateway.remote.GraphParams;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * One call description from the tool-invocation layer.
 *
 * <p>{@code parameters} values may be strings, numbers, booleans, lists (order kept, e.g.
 * {@code fields}) or maps (e.g. {@code time_range}). Parameter names themselves are unordered.
 */
@Value
@Builder(toBuilder = true)
public class ApiRequest {

    /**
     * Edge below the object, e.g. {@code insights} or {@code campaigns}; empty reads the object itself
     */
    @Builder.Default
    String endpoint = "";

    /**
     * Account or object id the call addresses
     */
    String objectId;

    /**
     * True when objectId names an ad account, so bare digits get the {@code act_} prefix
     */
    boolean accountScoped;

    /**
     * Shape the response is normalized into
     */
    EntityKind entityKind;

    @Singular
    Map<String, Object> parameters;

    @Singular
    Set<String> requiredScopes;

    /**
     * Follow {@code paging.cursors.after} until the last page and return every element
     */
    boolean allPages;

    /**
     * Graph path for this call, e.g. {@code act_123/insights}
     */
    public String path() {
        String object = accountScoped ? GraphParams.normalizeAccountId(objectId) : objectId.trim();
        return endpoint.isEmpty() ? object : object + "/" + endpoint;
    }

    /**
     * Checks for a read.
     */
    public void validate() {
        validateTarget();
        if (entityKind == null) {
            throw new IllegalArgumentException("entityKind is required");
        }
        if (entityKind == EntityKind.WRITE_RESULT) {
            throw new IllegalArgumentException("WRITE_RESULT is only produced by writes");
        }
    }

    /**
     * Checks for a write, which has no entity kind of its own.
     */
    public void validateTarget() {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("objectId is required");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
    }
}
