package com.adsgateway.gateway;

/**
 * Where an invocation is in its lifecycle:
 * VALIDATING, CACHE_CHECK, then RATE_LIMITING and EXECUTING on a miss, then NORMALIZING and DONE.
 * FAILED can be reached from any stage.
 */
public enum InvocationStage {
    VALIDATING,
    CACHE_CHECK,
    RATE_LIMITING,
    EXECUTING,
    NORMALIZING,
    DONE,
    FAILED
}
