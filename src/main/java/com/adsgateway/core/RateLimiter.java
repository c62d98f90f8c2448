package com.adsgateway.core;

/**
 * Core interface for admitting outbound calls against a per-credential quota.
 */
public interface RateLimiter {

    /**
     * Check the quota for the given credential and record the call if it fits.
     * Check and record happen as one atomic step per key.
     *
     * @param credentialId credential identity, never the raw token
     * @return ADMITTED, DELAYED with the time until a slot frees up, or REJECTED
     *         when that time exceeds the configured maximum wait
     */
    Admission admit(String credentialId);

    /**
     * Get remaining permits for a credential in the current window.
     *
     * @param credentialId credential identity
     * @return number of calls that would be admitted right now
     */
    long getAvailablePermits(String credentialId);

    /**
     * Reset the window for a specific credential.
     * Use carefully - mainly for testing or admin overrides.
     *
     * @param credentialId credential identity
     */
    void reset(String credentialId);

    /**
     * Drop every tracked window.
     */
    void resetAll();
}
