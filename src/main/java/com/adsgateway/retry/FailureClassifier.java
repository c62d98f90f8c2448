package com.adsgateway.retry;

import com.adsgateway.remote.RemoteCallException;

import java.util.Set;

/**
 * Maps a failed attempt onto exactly one {@link Outcome}.
 *
 * Graph API error codes take precedence over the HTTP status because the
 * remote service reports throttling and token problems with 400 and 403 as often as
 * with 429 and 401. Checked in order: auth, throttling, transient, then permanent.
 */
public final class FailureClassifier {

    private static final Set<Integer> AUTH_CODES = Set.of(102, 190);

    // 4 app, 17 user, 32 page, 613 custom; 80000-80014 business use case
    private static final Set<Integer> THROTTLE_CODES = Set.of(4, 17, 32, 613);

    private static final Set<Integer> TRANSIENT_CODES = Set.of(1, 2);

    private FailureClassifier() {
    }

    public static Outcome classify(Throwable failure) {
        if (!(failure instanceof RemoteCallException)) {
            return Outcome.PERMANENT;
        }
        RemoteCallException e = (RemoteCallException) failure;
        if (e.isNoResponse()) {
            return Outcome.TRANSIENT;
        }

        Integer code = e.getErrorCode();
        int status = e.getHttpStatus();

        if ((code != null && AUTH_CODES.contains(code)) || status == 401) {
            return Outcome.AUTH_FAILURE;
        }
        if ((code != null && (THROTTLE_CODES.contains(code) || (code >= 80000 && code <= 80014)))
                || status == 429) {
            return Outcome.RATE_LIMITED;
        }
        if ((code != null && TRANSIENT_CODES.contains(code)) || e.isTransientHint() || status >= 500) {
            return Outcome.TRANSIENT;
        }
        return Outcome.PERMANENT;
    }
}
