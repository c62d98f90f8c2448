package com.adsgateway.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a rate limiter admission check.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Admission {

    public enum Decision { ADMITTED, DELAYED, REJECTED }

    private static final Admission ADMITTED = new Admission(Decision.ADMITTED, Duration.ZERO);

    Decision decision;

    /**
     * How long to wait before asking again. Only meaningful for DELAYED and REJECTED.
     */
    Duration retryAfter;

    public static Admission admitted() {
        return ADMITTED;
    }

    public static Admission delayed(Duration retryAfter) {
        return new Admission(Decision.DELAYED, retryAfter);
    }

    public static Admission rejected(Duration retryAfter) {
        return new Admission(Decision.REJECTED, retryAfter);
    }

    public boolean isAdmitted() {
        return decision == Decision.ADMITTED;
    }
}
