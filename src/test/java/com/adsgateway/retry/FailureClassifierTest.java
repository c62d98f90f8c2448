package com.adsgateway.retry;

import com.adsgateway.remote.RemoteCallException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private static RemoteCallException graphError(int status, Integer code, boolean transientHint) {
        return new RemoteCallException(status, code, null, transientHint, "error");
    }

    @Test
    @DisplayName("Should classify token errors as auth failures whatever the status")
    void shouldClassifyAuthFailures() {
        assertEquals(Outcome.AUTH_FAILURE, FailureClassifier.classify(graphError(400, 190, false)));
        assertEquals(Outcome.AUTH_FAILURE, FailureClassifier.classify(graphError(400, 102, false)));
        assertEquals(Outcome.AUTH_FAILURE, FailureClassifier.classify(RemoteCallException.status(401, "no")));
    }

    @Test
    @DisplayName("Should classify throttling codes as rate limited")
    void shouldClassifyThrottling() {
        assertEquals(Outcome.RATE_LIMITED, FailureClassifier.classify(graphError(400, 17, false)));
        assertEquals(Outcome.RATE_LIMITED, FailureClassifier.classify(graphError(400, 613, false)));
        assertEquals(Outcome.RATE_LIMITED, FailureClassifier.classify(graphError(400, 80004, false)));
        assertEquals(Outcome.RATE_LIMITED, FailureClassifier.classify(RemoteCallException.status(429, "slow down")));
    }

    @Test
    @DisplayName("Should classify server errors and missing responses as transient")
    void shouldClassifyTransient() {
        assertEquals(Outcome.TRANSIENT, FailureClassifier.classify(RemoteCallException.status(500, "oops")));
        assertEquals(Outcome.TRANSIENT, FailureClassifier.classify(RemoteCallException.status(503, "down")));
        assertEquals(Outcome.TRANSIENT, FailureClassifier.classify(graphError(400, 2, false)));
        assertEquals(Outcome.TRANSIENT, FailureClassifier.classify(graphError(400, 100, true)));
        assertEquals(Outcome.TRANSIENT, FailureClassifier.classify(
                new RemoteCallException("timeout", new IOException("read timed out"))));
    }

    @Test
    @DisplayName("Should classify everything else as permanent")
    void shouldClassifyPermanent() {
        assertEquals(Outcome.PERMANENT, FailureClassifier.classify(graphError(400, 100, false)));
        assertEquals(Outcome.PERMANENT, FailureClassifier.classify(RemoteCallException.status(404, "missing")));
        assertEquals(Outcome.PERMANENT, FailureClassifier.classify(new IllegalStateException("bug")));
    }
}
