package com.adsgateway.ratelimit;

import com.adsgateway.core.Admission;
import com.adsgateway.core.GatewayConfig;
import com.adsgateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SlidingWindowRateLimiter
 * Covers quota accounting, wait hints, and concurrent access
 */
class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        rateLimiter = new SlidingWindowRateLimiter(GatewayConfig.defaults(), clock, meterRegistry);
    }

    @Test
    @DisplayName("Should admit requests under quota")
    void shouldAdmitUnderQuota() {
        for (int i = 0; i < 200; i++) {
            assertTrue(rateLimiter.admit("cred").isAdmitted(), "request " + i);
        }
        assertEquals(0, rateLimiter.getAvailablePermits("cred"));
        assertEquals(200.0, meterRegistry.counter("ratelimiter.requests.admitted").count());
    }

    @Test
    @DisplayName("Should delay the 201st request until the oldest call leaves the window")
    void shouldDelayUntilOldestAgesOut() {
        assertTrue(rateLimiter.admit("cred").isAdmitted());
        clock.advance(Duration.ofMinutes(10));
        for (int i = 1; i < 200; i++) {
            assertTrue(rateLimiter.admit("cred").isAdmitted());
        }

        Admission delayed = rateLimiter.admit("cred");
        assertEquals(Admission.Decision.DELAYED, delayed.getDecision());
        assertEquals(Duration.ofMinutes(50), delayed.getRetryAfter());

        clock.advance(delayed.getRetryAfter());
        assertTrue(rateLimiter.admit("cred").isAdmitted());

        // Only the first call aged out, the slot is taken again
        assertFalse(rateLimiter.admit("cred").isAdmitted());
    }

    @Test
    @DisplayName("Should reject when the wait exceeds the bound")
    void shouldRejectWhenWaitTooLong() {
        GatewayConfig config = GatewayConfig.builder()
                .quota(2)
                .window(Duration.ofHours(1))
                .maxWait(Duration.ofMinutes(5))
                .build();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config, clock, meterRegistry);

        limiter.admit("cred");
        limiter.admit("cred");
        Admission admission = limiter.admit("cred");

        assertEquals(Admission.Decision.REJECTED, admission.getDecision());
        assertEquals(Duration.ofHours(1), admission.getRetryAfter());
        assertEquals(1.0, meterRegistry.counter("ratelimiter.requests.rejected").count());
    }

    @Test
    @DisplayName("Should keep credentials independent")
    void shouldIsolateCredentials() {
        GatewayConfig config = GatewayConfig.builder().quota(1).build();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config, clock, meterRegistry);

        assertTrue(limiter.admit("a").isAdmitted());
        assertFalse(limiter.admit("a").isAdmitted());
        assertTrue(limiter.admit("b").isAdmitted());
    }

    @Test
    @DisplayName("Should free the window on reset")
    void shouldResetWindow() {
        GatewayConfig config = GatewayConfig.builder().quota(1).build();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config, clock, meterRegistry);

        limiter.admit("cred");
        assertEquals(0, limiter.getAvailablePermits("cred"));

        limiter.reset("cred");
        assertEquals(1, limiter.getAvailablePermits("cred"));
        assertTrue(limiter.admit("cred").isAdmitted());
    }

    @Test
    @DisplayName("Should never admit more than quota under concurrent callers")
    void shouldHandleConcurrentRequests() throws InterruptedException {
        int threadCount = 20;
        int requestsPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger admitted = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < requestsPerThread; j++) {
                        if (rateLimiter.admit("shared").isAdmitted()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(200, admitted.get());
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void shouldValidateConfig() {
        GatewayConfig config = GatewayConfig.builder().quota(0).build();
        assertThrows(IllegalArgumentException.class,
                () -> new SlidingWindowRateLimiter(config, clock, meterRegistry));
    }
}
