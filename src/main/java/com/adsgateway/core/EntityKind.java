package com.adsgateway.core;

/**
 * Canonical entity shapes the normalizer knows how to produce.
 */
public enum EntityKind {
    ACCOUNT,
    CAMPAIGN,
    AD_SET,
    AD,
    INSIGHT,
    /** Acknowledgement of a create or update */
    WRITE_RESULT
}
