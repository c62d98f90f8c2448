package com.adsgateway.retry;

import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayConfig;
import com.adsgateway.core.GatewayException;
import com.adsgateway.remote.RemoteCallException;
import com.adsgateway.support.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private RecordingSleeper sleeper;
    private SimpleMeterRegistry meterRegistry;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        GatewayConfig config = GatewayConfig.builder()
                .maxAttempts(3)
                .baseBackoff(Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(30))
                .jitter(0)
                .build();
        sleeper = new RecordingSleeper(null);
        meterRegistry = new SimpleMeterRegistry();
        executor = new RetryExecutor(new RetryPolicy(config), sleeper, meterRegistry);
    }

    @Test
    @DisplayName("Should succeed after two transient failures")
    void shouldRecoverFromTransientFailures() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(() -> {
            if (calls.incrementAndGet() <= 2) {
                throw RemoteCallException.status(500, "server error");
            }
            return "ok";
        }, () -> fail("auth callback must not run"));

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getSleeps());
        assertEquals(2.0, meterRegistry.counter("gateway.remote.retries").count());
    }

    @Test
    @DisplayName("Should surface TRANSIENT after exactly maxAttempts calls")
    void shouldGiveUpAfterCeiling() {
        AtomicInteger calls = new AtomicInteger();

        GatewayException e = assertThrows(GatewayException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RemoteCallException.status(500, "server error");
        }, () -> { }));

        assertEquals(ErrorKind.TRANSIENT, e.getKind());
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Should surface RATE_LIMIT_EXCEEDED when the remote service keeps throttling")
    void shouldSurfaceThrottling() {
        GatewayException e = assertThrows(GatewayException.class, () -> executor.execute(() -> {
            throw new RemoteCallException(400, 17, null, false, "User request limit reached");
        }, () -> { }));

        assertEquals(ErrorKind.RATE_LIMIT_EXCEEDED, e.getKind());
        assertEquals(2, sleeper.getSleeps().size());
    }

    @Test
    @DisplayName("Should run the auth callback once and not retry on auth failure")
    void shouldInvalidateOnAuthFailure() {
        AtomicInteger calls = new AtomicInteger();
        AtomicBoolean invalidated = new AtomicBoolean();

        GatewayException e = assertThrows(GatewayException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new RemoteCallException(400, 190, 463, false, "Session has expired");
        }, () -> invalidated.set(true)));

        assertEquals(ErrorKind.CREDENTIAL_INVALID, e.getKind());
        assertEquals(1, calls.get());
        assertTrue(invalidated.get());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    @DisplayName("Should fail immediately on permanent errors")
    void shouldNotRetryPermanentFailure() {
        AtomicInteger calls = new AtomicInteger();

        GatewayException e = assertThrows(GatewayException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new RemoteCallException(400, 100, null, false, "Invalid parameter");
        }, () -> { }));

        assertEquals(ErrorKind.PERMANENT_FAILURE, e.getKind());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should pass gateway errors from the call through untouched")
    void shouldPassThroughGatewayErrors() {
        GatewayException local = new GatewayException(ErrorKind.RATE_LIMIT_EXCEEDED, "local quota");

        GatewayException e = assertThrows(GatewayException.class,
                () -> executor.execute(() -> { throw local; }, () -> { }));

        assertSame(local, e);
        assertTrue(sleeper.getSleeps().isEmpty());
    }
}
