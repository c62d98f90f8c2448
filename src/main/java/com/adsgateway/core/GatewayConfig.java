package com.adsgateway.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Tuning knobs for the gateway.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class GatewayConfig {

    /**
     * Maximum number of remote calls per credential inside the window
     */
    @Builder.Default
    long quota = 200;

    /**
     * Trailing window for the quota
     */
    @Builder.Default
    Duration window = Duration.ofHours(1);

    /**
     * Longest single wait the rate limiter will hand out before rejecting
     */
    @Builder.Default
    Duration maxWait = Duration.ofHours(1);

    /**
     * How many times one invocation may wait on the limiter before giving up
     */
    @Builder.Default
    int maxAdmissionWaits = 3;

    @Builder.Default
    boolean cacheEnabled = true;

    @Builder.Default
    Duration cacheTtl = Duration.ofSeconds(300);

    @Builder.Default
    int cacheCapacity = 1000;

    /**
     * Attempt ceiling for transient and throttled remote failures, first attempt included
     */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseBackoff = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);

    /**
     * Fraction of each backoff delay that may be shaved off at random (0 disables jitter)
     */
    @Builder.Default
    double jitter = 0.2;

    /**
     * How long a caller waits for an invocation before abandoning it
     */
    @Builder.Default
    Duration invocationTimeout = Duration.ofSeconds(180);

    /**
     * Credentials expiring within this window are refreshed in the background and flagged on use
     */
    @Builder.Default
    Duration refreshWindow = Duration.ofDays(10);

    /**
     * Scopes required when a request names none
     */
    @Singular
    Set<String> defaultScopes;

    /**
     * Scopes required for writes when the request names none
     */
    @Builder.Default
    Set<String> writeScopes = Set.of("ads_management");

    /**
     * Upper bound on pages fetched for one request that asks for all pages
     */
    @Builder.Default
    int maxPages = 50;

    public void validate() {
        if (quota <= 0) {
            throw new IllegalArgumentException("quota must be positive");
        }
        requirePositive(window, "window");
        requirePositive(cacheTtl, "cacheTtl");
        requirePositive(invocationTimeout, "invocationTimeout");
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be negative");
        }
        if (maxAdmissionWaits < 0) {
            throw new IllegalArgumentException("maxAdmissionWaits cannot be negative");
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseBackoff == null || baseBackoff.isNegative()
                || maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= baseBackoff <= maxBackoff");
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    /**
     * Defaults matching the remote platform's standard tier
     */
    public static GatewayConfig defaults() {
        return GatewayConfig.builder()
                .defaultScope("ads_read")
                .build();
    }
}
