package com.adsgateway.core;

import java.time.Duration;

/**
 * Blocking pause used for rate-limit waits and retry backoff.
 * Swapped out in tests so nothing actually sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
