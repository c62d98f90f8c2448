package com.adsgateway.retry;

import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayException;
import com.adsgateway.core.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs one outbound call with bounded retries.
 *
 * - TRANSIENT and RATE_LIMITED: retried per {@link RetryPolicy}, surfaced as
 *   TRANSIENT / RATE_LIMIT_EXCEEDED once the attempt ceiling is reached
 * - AUTH_FAILURE: the auth callback runs (credential invalidation), then
 *   CREDENTIAL_INVALID is surfaced without retrying
 * - PERMANENT: surfaced immediately as PERMANENT_FAILURE
 *
 * A {@link GatewayException} thrown by the call itself passes through untouched.
 * Callers may narrow which outcomes are retried at all, e.g. to keep a
 * non-idempotent write from being sent twice after a timeout.
 */
@Slf4j
public class RetryExecutor {

    private static final Set<Outcome> RETRY_ALL = EnumSet.of(Outcome.TRANSIENT, Outcome.RATE_LIMITED);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Counter retries;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.retries = Counter.builder("gateway.remote.retries")
                .description("Remote call attempts that were retried")
                .register(meterRegistry);
    }

    public <T> T execute(Callable<T> call, Runnable onAuthFailure) throws InterruptedException {
        return execute(call, onAuthFailure, RETRY_ALL);
    }

    public <T> T execute(Callable<T> call, Runnable onAuthFailure, Set<Outcome> retryable)
            throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            Exception failure;
            try {
                return call.call();
            } catch (GatewayException e) {
                throw e;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                failure = e;
            }

            Outcome outcome = FailureClassifier.classify(failure);
            if (outcome == Outcome.AUTH_FAILURE) {
                log.warn("Remote service rejected the credential: {}", failure.getMessage());
                onAuthFailure.run();
                throw new GatewayException(ErrorKind.CREDENTIAL_INVALID,
                        "Credential was rejected by the remote service; re-authenticate", failure);
            }

            RetryDecision decision = retryable.contains(outcome)
                    ? policy.decide(attempt, outcome)
                    : RetryDecision.stop();
            if (!decision.isRetry()) {
                throw surface(outcome, attempt, failure);
            }

            retries.increment();
            log.warn("Remote call failed with {} (attempt {}/{}), retrying in {}ms: {}",
                    outcome, attempt, policy.getMaxAttempts(), decision.getDelay().toMillis(),
                    failure.getMessage());
            sleeper.sleep(decision.getDelay());
        }
    }

    private GatewayException surface(Outcome outcome, int attempts, Exception failure) {
        switch (outcome) {
            case TRANSIENT:
                log.error("Remote call failed after {} attempts: {}", attempts, failure.getMessage());
                return new GatewayException(ErrorKind.TRANSIENT,
                        "Remote call failed after " + attempts + " attempts: " + failure.getMessage(), failure);
            case RATE_LIMITED:
                log.error("Remote service kept throttling after {} attempts", attempts);
                return new GatewayException(ErrorKind.RATE_LIMIT_EXCEEDED,
                        "Remote service is throttling this credential: " + failure.getMessage(), failure);
            default:
                return new GatewayException(ErrorKind.PERMANENT_FAILURE,
                        "Remote call failed: " + failure.getMessage(), failure);
        }
    }
}
