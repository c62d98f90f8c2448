package com.adsgateway.retry;

import com.adsgateway.core.GatewayConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed attempt is retried and after how long.
 * No I/O and no state, so it can be tested without a network.
 *
 * Delay for attempt n (1-based) is min(maxBackoff, baseBackoff * 2^(n-1)),
 * scaled down by a random factor in [1 - jitter, 1] so that callers that
 * failed together do not retry together.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final long baseMs;
    private final long maxMs;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryPolicy(GatewayConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     */
    public RetryPolicy(GatewayConfig config, DoubleSupplier random) {
        config.validate();
        this.maxAttempts = config.getMaxAttempts();
        this.baseMs = config.getBaseBackoff().toMillis();
        this.maxMs = config.getMaxBackoff().toMillis();
        this.jitter = config.getJitter();
        this.random = random;
    }

    /**
     * @param attempt number of the attempt that just failed, starting at 1
     * @param outcome how it failed
     */
    public RetryDecision decide(int attempt, Outcome outcome) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        boolean retryable = outcome == Outcome.TRANSIENT || outcome == Outcome.RATE_LIMITED;
        if (!retryable || attempt >= maxAttempts) {
            return RetryDecision.stop();
        }
        return RetryDecision.after(Duration.ofMillis(backoffMs(attempt)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private long backoffMs(int attempt) {
        int shift = Math.min(attempt - 1, 30);
        long exponential = baseMs << shift;
        if (exponential < 0 || exponential > maxMs) {
            exponential = maxMs;
        }
        double factor = 1.0 - jitter * random.getAsDouble();
        return Math.round(exponential * factor);
    }
}
