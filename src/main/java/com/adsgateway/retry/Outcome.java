package com.adsgateway.retry;

/**
 * Classification of one attempt at a remote call.
 */
public enum Outcome {
    SUCCESS,
    /** Timeout, 5xx, or the remote service saying "try again". */
    TRANSIENT,
    /** Remote-side throttling, independent of the local limiter. */
    RATE_LIMITED,
    /** Credential rejected. */
    AUTH_FAILURE,
    /** Bad request, unknown object, forbidden object. */
    PERMANENT
}
