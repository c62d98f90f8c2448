package com.adsgateway;

import com.adsgateway.auth.Credential;
import com.adsgateway.auth.CredentialRefresher;
import com.adsgateway.auth.CredentialStore;
import com.adsgateway.core.ApiRequest;
import com.adsgateway.core.ApiResult;
import com.adsgateway.core.EntityKind;
import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayException;
import com.adsgateway.core.StorageUnavailableException;
import com.adsgateway.gateway.ApiGateway;
import com.adsgateway.remote.GraphParams;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * HTTP surface of the gateway: tool invocations, credential intake from the
 * OAuth flow and a few admin operations.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class GatewayController {

    private final ApiGateway gateway;
    private final CredentialStore credentialStore;
    private final CredentialRefresher refresher;
    private final Clock clock;

    public GatewayController(ApiGateway gateway, CredentialStore credentialStore,
                             CredentialRefresher refresher, Clock clock) {
        this.gateway = gateway;
        this.credentialStore = credentialStore;
        this.refresher = refresher;
        this.clock = clock;
    }

    /**
     * Single entry point for tool calls. The HTTP status mirrors the result's error kind.
     */
    @PostMapping("/invoke")
    public ResponseEntity<ApiResult> invoke(
            @RequestHeader("X-Session-ID") String sessionId,
            @RequestBody InvokeRequest body) {

        ApiRequest request;
        try {
            request = body.toApiRequest(LocalDate.now(clock));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResult.failure(
                    new GatewayException(ErrorKind.PERMANENT_FAILURE, e.getMessage(), e)));
        }

        ApiResult result = gateway.invoke(sessionId, request);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    /**
     * Create or update a campaign, ad set or ad. Same body as {@code /invoke}; the
     * parameters are sent as the object's fields and no entity kind is needed.
     */
    @PostMapping("/write")
    public ResponseEntity<ApiResult> write(
            @RequestHeader("X-Session-ID") String sessionId,
            @RequestBody InvokeRequest body) {

        ApiRequest request;
        try {
            request = body.toApiRequest(LocalDate.now(clock));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResult.failure(
                    new GatewayException(ErrorKind.PERMANENT_FAILURE, e.getMessage(), e)));
        }

        ApiResult result = gateway.write(sessionId, request);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @PutMapping("/credentials/{sessionId}")
    public ResponseEntity<Map<String, String>> storeCredential(
            @PathVariable String sessionId,
            @RequestBody Credential credential) {

        credentialStore.put(sessionId, credential);

        Map<String, String> response = new HashMap<>();
        response.put("sessionId", sessionId);
        response.put("credential", credential.identity());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/credentials/{sessionId}")
    public ResponseEntity<Void> invalidateCredential(@PathVariable String sessionId) {
        credentialStore.invalidate(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/credentials")
    public ResponseEntity<Set<String>> sessions() {
        return ResponseEntity.ok(new TreeSet<>(credentialStore.sessions()));
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        boolean storeUp = credentialStore.isAvailable();

        Map<String, String> status = new HashMap<>();
        status.put("status", storeUp ? "UP" : "DEGRADED");
        status.put("credentialStore", storeUp ? "UP" : "DOWN");
        status.put("timestamp", String.valueOf(clock.millis()));
        return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(status);
    }

    /**
     * Run the token refresh now instead of waiting for the schedule
     */
    @PostMapping("/admin/credentials/refresh")
    public ResponseEntity<CredentialRefresher.RefreshReport> refreshCredentials() {
        log.info("Token refresh triggered by admin");
        return ResponseEntity.ok(refresher.refreshDue());
    }

    @DeleteMapping("/admin/cache")
    public ResponseEntity<Map<String, String>> clearCache() {
        gateway.clearCache();
        log.info("Request cache cleared by admin");

        Map<String, String> response = new HashMap<>();
        response.put("message", "Request cache cleared");
        return ResponseEntity.ok(response);
    }

    /**
     * Admin endpoint to reset the local quota of one credential
     */
    @DeleteMapping("/admin/rate-limits/{credentialId}")
    public ResponseEntity<Map<String, Object>> resetRateLimit(@PathVariable String credentialId) {
        gateway.resetRateLimit(credentialId);
        log.info("Rate limit reset by admin for credential {}", credentialId);

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Rate limit reset for credential: " + credentialId);
        response.put("remaining", gateway.availablePermits(credentialId));
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "Bad request");
        error.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, String>> storageUnavailable(StorageUnavailableException e) {
        log.error("Credential store unavailable", e);
        Map<String, String> error = new HashMap<>();
        error.put("error", "Credential store unavailable");
        error.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    static HttpStatus statusFor(ApiResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        switch (result.getErrorKind()) {
            case CREDENTIAL_EXPIRED:
            case CREDENTIAL_INVALID:
                return HttpStatus.UNAUTHORIZED;
            case INSUFFICIENT_SCOPE:
                return HttpStatus.FORBIDDEN;
            case RATE_LIMIT_EXCEEDED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case TRANSIENT:
            case MALFORMED_RESPONSE:
                return HttpStatus.BAD_GATEWAY;
            case STORAGE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    /**
     * Request body of {@code POST /api/invoke}. Date fields are folded into
     * {@code date_preset} or {@code time_range} parameters.
     */
    @Value
    @Builder
    @Jacksonized
    public static class InvokeRequest {

        String endpoint;
        String objectId;
        boolean accountScoped;
        EntityKind entityKind;

        @Singular
        Map<String, Object> parameters;

        @Singular
        Set<String> requiredScopes;

        String datePreset;
        String since;
        String until;

        boolean allPages;

        ApiRequest toApiRequest(LocalDate today) {
            ApiRequest.ApiRequestBuilder builder = ApiRequest.builder()
                    .endpoint(endpoint == null ? "" : endpoint)
                    .objectId(objectId)
                    .accountScoped(accountScoped)
                    .entityKind(entityKind)
                    .parameters(parameters)
                    .requiredScopes(requiredScopes)
                    .allPages(allPages);
            if (datePreset != null || since != null) {
                builder.parameters(GraphParams.timeRange(datePreset, since, until, today));
            }
            return builder.build();
        }
    }
}
