package com.adsgateway.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outbound edge to the remote ads API. One call, no retries, no caching.
 */
public interface RemoteAdsClient {

    /**
     * Read a node or edge.
     *
     * @param path        object id optionally followed by an edge, e.g. {@code act_123/insights}
     * @param query       already-encoded query parameters
     * @param accessToken token to authenticate with
     * @return parsed response body
     * @throws RemoteCallException when no response arrived or the remote service returned an error
     */
    JsonNode get(String path, Map<String, String> query, String accessToken);

    /**
     * Create or update through an edge or node. Parameters travel form-encoded in the body.
     *
     * @param path   e.g. {@code act_123/campaigns} to create, or a campaign id to update
     * @param form   already-encoded parameters
     * @throws RemoteCallException when no response arrived or the remote service returned an error
     */
    JsonNode post(String path, Map<String, String> form, String accessToken);
}
