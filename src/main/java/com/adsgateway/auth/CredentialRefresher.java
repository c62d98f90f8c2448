package com.adsgateway.auth;

import com.adsgateway.core.StorageUnavailableException;
import com.adsgateway.remote.RemoteAdsClient;
import com.adsgateway.remote.RemoteCallException;
import com.adsgateway.retry.FailureClassifier;
import com.adsgateway.retry.Outcome;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Re-exchanges long-lived tokens that are about to expire.
 *
 * Each due credential is swapped for a fresh token through {@code oauth/access_token}.
 * A token the remote service refuses to exchange is dropped from the store so callers
 * are told to re-authenticate instead of failing later with a dead token. A refresh
 * that got no answer leaves the credential alone for the next run.
 */
@Slf4j
public class CredentialRefresher {

    static final String EXCHANGE_PATH = "oauth/access_token";

    // Lifetime of a long-lived token when the response does not say
    static final long DEFAULT_EXPIRES_IN_SECONDS = 5_184_000L;

    private static final double FAILURE_RATE_ALERT = 0.1;

    private final CredentialStore store;
    private final TokenValidator validator;
    private final RemoteAdsClient remote;
    private final String appId;
    private final String appSecret;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public CredentialRefresher(CredentialStore store,
                               TokenValidator validator,
                               RemoteAdsClient remote,
                               String appId,
                               String appSecret,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.store = store;
        this.validator = validator;
        this.remote = remote;
        this.appId = appId;
        this.appSecret = appSecret;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public boolean isConfigured() {
        return appId != null && !appId.isBlank() && appSecret != null && !appSecret.isBlank();
    }

    /**
     * Refresh every stored credential inside the refresh window.
     *
     * @throws StorageUnavailableException when the store cannot be reached; the run stops there
     */
    public RefreshReport refreshDue() {
        if (!isConfigured()) {
            log.debug("App credentials not configured, skipping token refresh");
            return new RefreshReport(0, 0, 0);
        }

        int due = 0;
        int refreshed = 0;
        int failed = 0;
        for (String sessionId : store.sessions()) {
            Optional<Credential> stored = store.get(sessionId);
            if (stored.isEmpty() || !validator.needsRefresh(stored.get())) {
                continue;
            }
            due++;
            if (refresh(sessionId, stored.get())) {
                refreshed++;
            } else {
                failed++;
            }
        }

        RefreshReport report = new RefreshReport(due, refreshed, failed);
        log.info("Token refresh completed: {} due, {} refreshed, {} failed", due, refreshed, failed);
        if (report.failureRate() > FAILURE_RATE_ALERT) {
            log.warn("High token refresh failure rate: {}/{} ({}%)",
                    failed, due, Math.round(report.failureRate() * 1000) / 10.0);
        }
        return report;
    }

    private boolean refresh(String sessionId, Credential current) {
        String identity = current.identity();
        Credential replacement;
        try {
            JsonNode response = remote.post(EXCHANGE_PATH, Map.of(
                    "grant_type", "fb_exchange_token",
                    "client_id", appId,
                    "client_secret", appSecret,
                    "fb_exchange_token", current.getAccessToken()), current.getAccessToken());
            replacement = replacementFor(current, response);
        } catch (RemoteCallException e) {
            if (FailureClassifier.classify(e) == Outcome.TRANSIENT) {
                count("deferred");
                log.warn("Token refresh for credential {} got no answer, keeping it until the next run: {}",
                        identity, e.getMessage());
                return false;
            }
            revoke(sessionId, identity, e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            revoke(sessionId, identity, e.getMessage());
            return false;
        }

        // The session may have re-authenticated while the exchange was running
        Optional<Credential> latest = store.get(sessionId);
        if (latest.isEmpty() || !latest.get().identity().equals(identity)) {
            count("superseded");
            log.info("Credential {} for session {} was replaced during refresh, keeping the newer one",
                    identity, sessionId);
            return true;
        }
        store.put(sessionId, replacement);
        count("refreshed");
        log.info("Refreshed credential {} for session {} as {}, now expires at {}",
                identity, sessionId, replacement.identity(), replacement.getExpiresAt());
        return true;
    }

    private Credential replacementFor(Credential current, JsonNode response) {
        String token = response.path("access_token").asText("");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Token exchange returned no access_token");
        }
        long expiresIn = response.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        if (expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        Instant now = clock.instant();
        Credential replacement = current.toBuilder()
                .accessToken(token)
                .expiresAt(now.plus(Duration.ofSeconds(expiresIn)))
                .storedAt(now)
                .build();
        replacement.validate();
        return replacement;
    }

    private void revoke(String sessionId, String identity, String reason) {
        count("revoked");
        Optional<Credential> latest = store.get(sessionId);
        if (latest.isPresent() && latest.get().identity().equals(identity)) {
            store.invalidate(sessionId);
            log.warn("Token refresh failed for credential {}, removed it from session {}: {}",
                    identity, sessionId, reason);
        } else {
            log.warn("Token refresh failed for credential {}, session {} already holds another: {}",
                    identity, sessionId, reason);
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("credentials.refresh", "outcome", outcome).increment();
    }

    /**
     * Tally of one refresh run
     */
    @Value
    public static class RefreshReport {
        int due;
        int refreshed;
        int failed;

        public double failureRate() {
            return due == 0 ? 0.0 : (double) failed / due;
        }
    }
}
