package com.adsgateway.retry;

import lombok.Value;

import java.time.Duration;

@Value
public class RetryDecision {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    boolean retry;
    Duration delay;

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision after(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
