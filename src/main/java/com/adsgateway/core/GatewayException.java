package com.adsgateway.core;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Failure of a gateway operation, tagged with the kind reported to callers.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final Set<String> missingScopes;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, message, (Throwable) null);
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.missingScopes = Collections.emptySet();
    }

    private GatewayException(ErrorKind kind, String message, Set<String> missingScopes) {
        super(message);
        this.kind = kind;
        this.missingScopes = Collections.unmodifiableSet(new TreeSet<>(missingScopes));
    }

    public static GatewayException insufficientScope(Set<String> missing) {
        return new GatewayException(ErrorKind.INSUFFICIENT_SCOPE,
                "Credential is missing required scopes: " + new TreeSet<>(missing), missing);
    }
}
