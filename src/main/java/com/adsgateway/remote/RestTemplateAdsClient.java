package com.adsgateway.remote;

import com.adsgateway.core.MalformedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph API client over Spring's RestTemplate.
 *
 * The token travels in the Authorization header, never in the URL, so it
 * cannot leak into request logs. Error bodies of the form
 * {@code {"error": {"message", "code", "error_subcode", "is_transient"}}}
 * are unpacked into {@link RemoteCallException} for classification.
 */
@Slf4j
public class RestTemplateAdsClient implements RemoteAdsClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    /**
     * @param baseUrl versioned API root, e.g. {@code https://graph.facebook.com/v22.0}
     */
    public RestTemplateAdsClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public JsonNode get(String path, Map<String, String> query, String accessToken) {
        return exchange(HttpMethod.GET, buildUri(path, query), path,
                new HttpEntity<>(headers(accessToken)));
    }

    @Override
    public JsonNode post(String path, Map<String, String> form, String accessToken) {
        HttpHeaders headers = headers(accessToken);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        form.forEach(body::add);

        return exchange(HttpMethod.POST, buildUri(path, Map.of()), path, new HttpEntity<>(body, headers));
    }

    private JsonNode exchange(HttpMethod method, URI uri, String path, HttpEntity<?> entity) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, method, entity, String.class);
        } catch (RestClientResponseException e) {
            throw toRemoteFailure(e.getStatusCode().value(), e.getResponseBodyAsString(), path);
        } catch (ResourceAccessException e) {
            log.warn("No response from remote service for {} {}: {}", method, path, e.getMessage());
            throw new RemoteCallException("No response from remote service: " + e.getMessage(), e);
        }

        log.debug("{} {} -> {}", method, path, response.getStatusCode().value());
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException("Empty response body for " + path);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response for " + path + " is not JSON", e);
        }
    }

    private static HttpHeaders headers(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    URI buildUri(String path, Map<String, String> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(path.split("/"));

        // Values go in as template variables so JSON braces are encoded, not expanded
        Map<String, String> variables = new HashMap<>();
        int i = 0;
        for (Map.Entry<String, String> entry : query.entrySet()) {
            String variable = "p" + i++;
            builder.queryParam(entry.getKey(), "{" + variable + "}");
            variables.put(variable, entry.getValue());
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    private RemoteCallException toRemoteFailure(int status, String body, String path) {
        Integer code = null;
        Integer subcode = null;
        boolean transientHint = false;
        String message = "HTTP " + status;

        try {
            JsonNode error = body == null || body.isBlank() ? null : objectMapper.readTree(body).path("error");
            if (error != null && error.isObject()) {
                code = error.hasNonNull("code") ? error.get("code").asInt() : null;
                subcode = error.hasNonNull("error_subcode") ? error.get("error_subcode").asInt() : null;
                transientHint = error.path("is_transient").asBoolean(false);
                message = error.path("message").asText(message);
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body for {} is not JSON", path);
        }

        log.warn("Remote error for {}: status={}, code={}, subcode={}, message={}",
                path, status, code, subcode, message);
        return new RemoteCallException(status, code, subcode, transientHint, message);
    }
}
