package com.adsgateway.ratelimit;

import com.adsgateway.core.Admission;
import com.adsgateway.core.GatewayConfig;
import com.adsgateway.core.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding window log implementation.
 *
 * Keeps the timestamp of every admitted call per credential and counts
 * the ones inside the trailing window. Exact, unlike a weighted counter,
 * which matters here: the remote quota is small (hundreds per hour) and
 * overshooting it gets the whole credential throttled.
 *
 * How it works:
 * - Purge timestamps older than now - window
 * - Under quota: record now, ADMITTED
 * - At quota: the oldest timestamp leaves the window at oldest + window,
 *   so that is how long the caller has to wait
 * - Wait within maxWait: DELAYED(wait), otherwise REJECTED
 *
 * Each key has its own lock so check-and-record is atomic per credential
 * without serializing unrelated credentials.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final long quota;
    private final long windowMs;
    private final long maxWaitMs;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    // Metrics
    private final Counter admittedRequests;
    private final Counter delayedRequests;
    private final Counter rejectedRequests;

    public SlidingWindowRateLimiter(GatewayConfig config, Clock clock, MeterRegistry meterRegistry) {
        config.validate();
        this.quota = config.getQuota();
        this.windowMs = config.getWindow().toMillis();
        this.maxWaitMs = config.getMaxWait().toMillis();
        this.clock = clock;

        this.admittedRequests = Counter.builder("ratelimiter.requests.admitted")
                .description("Number of admitted remote calls")
                .register(meterRegistry);

        this.delayedRequests = Counter.builder("ratelimiter.requests.delayed")
                .description("Number of admission checks answered with a wait")
                .register(meterRegistry);

        this.rejectedRequests = Counter.builder("ratelimiter.requests.rejected")
                .description("Number of rejected remote calls")
                .register(meterRegistry);

        log.info("Sliding window limiter initialized: quota={}, window={}ms, maxWait={}ms",
                quota, windowMs, maxWaitMs);
    }

    @Override
    public Admission admit(String credentialId) {
        Window window = windows.computeIfAbsent(credentialId, k -> new Window());

        window.lock.lock();
        try {
            long now = clock.millis();
            window.purge(now - windowMs);

            if (window.timestamps.size() < quota) {
                window.timestamps.addLast(now);
                admittedRequests.increment();
                return Admission.admitted();
            }

            long wait = Math.max(1, window.timestamps.peekFirst() + windowMs - now);
            if (wait <= maxWaitMs) {
                delayedRequests.increment();
                log.warn("Quota reached for credential {}, next slot in {}ms", credentialId, wait);
                return Admission.delayed(Duration.ofMillis(wait));
            }

            rejectedRequests.increment();
            log.warn("Quota reached for credential {}, wait of {}ms exceeds bound", credentialId, wait);
            return Admission.rejected(Duration.ofMillis(wait));
        } finally {
            window.lock.unlock();
        }
    }

    @Override
    public long getAvailablePermits(String credentialId) {
        Window window = windows.get(credentialId);
        if (window == null) {
            return quota;
        }

        window.lock.lock();
        try {
            window.purge(clock.millis() - windowMs);
            return Math.max(0, quota - window.timestamps.size());
        } finally {
            window.lock.unlock();
        }
    }

    @Override
    public void reset(String credentialId) {
        windows.remove(credentialId);
        log.debug("Reset rate limit for credential: {}", credentialId);
    }

    @Override
    public void resetAll() {
        windows.clear();
        log.info("Reset all rate limit windows");
    }

    private static final class Window {
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<Long> timestamps = new ArrayDeque<>();

        private void purge(long cutoff) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.removeFirst();
            }
        }
    }
}
