package com.adsgateway.core;

/**
 * Every way an invocation can fail, as reported to callers.
 */
public enum ErrorKind {

    /** No usable credential: absent, invalidated, or past its expiry. */
    CREDENTIAL_EXPIRED,

    /** Credential lacks one or more scopes the operation needs. */
    INSUFFICIENT_SCOPE,

    /** Remote service rejected the credential. */
    CREDENTIAL_INVALID,

    /** Local quota exhausted beyond the wait bound, or remote throttling outlasted retries. */
    RATE_LIMIT_EXCEEDED,

    /** Retries exhausted on timeouts or server-side errors. */
    TRANSIENT,

    /** Bad request, unknown object or forbidden object. */
    PERMANENT_FAILURE,

    /** Remote payload did not have the expected shape. */
    MALFORMED_RESPONSE,

    /** Credential storage could not be reached. */
    STORAGE_UNAVAILABLE
}
