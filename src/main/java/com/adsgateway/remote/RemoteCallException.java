package com.adsgateway.remote;

import lombok.Getter;

/**
 * A remote call that did not produce a usable response.
 *
 * Carries what the remote service said about the failure so it can be
 * classified: the HTTP status (0 when no response arrived at all) and the
 * Graph API error object's {@code code}, {@code error_subcode} and
 * {@code is_transient} when the body had one.
 */
@Getter
public class RemoteCallException extends RuntimeException {

    public static final int NO_RESPONSE = 0;

    private final int httpStatus;
    private final Integer errorCode;
    private final Integer errorSubcode;
    private final boolean transientHint;

    public RemoteCallException(int httpStatus, Integer errorCode, Integer errorSubcode,
                               boolean transientHint, String message) {
        super(message);
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
        this.errorSubcode = errorSubcode;
        this.transientHint = transientHint;
    }

    public RemoteCallException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = NO_RESPONSE;
        this.errorCode = null;
        this.errorSubcode = null;
        this.transientHint = true;
    }

    public static RemoteCallException status(int httpStatus, String message) {
        return new RemoteCallException(httpStatus, null, null, false, message);
    }

    public boolean isNoResponse() {
        return httpStatus == NO_RESPONSE;
    }
}
