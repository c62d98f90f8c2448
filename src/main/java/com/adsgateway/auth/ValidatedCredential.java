package com.adsgateway.auth;

import lombok.Value;

/**
 * A credential that passed the local checks for one invocation.
 * The remote service may still reject it.
 */
@Value
public class ValidatedCredential {

    String sessionId;
    Credential credential;

    /**
     * True when the credential expires inside the refresh window
     */
    boolean refreshDue;

    public String identity() {
        return credential.identity();
    }

    public String accessToken() {
        return credential.getAccessToken();
    }
}
