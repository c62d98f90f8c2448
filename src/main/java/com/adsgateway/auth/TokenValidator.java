package com.adsgateway.auth;

import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Local checks run before a credential is used. No network calls.
 *
 * Checked in order: present, not expired, scopes sufficient.
 */
@Slf4j
public class TokenValidator {

    private final Clock clock;
    private final Duration refreshWindow;

    public TokenValidator(Clock clock, Duration refreshWindow) {
        this.clock = clock;
        this.refreshWindow = refreshWindow;
    }

    public ValidatedCredential ensureUsable(String sessionId, Optional<Credential> stored,
                                            Set<String> requiredScopes) {
        Credential credential = stored.orElseThrow(() -> new GatewayException(ErrorKind.CREDENTIAL_EXPIRED,
                "No usable credential for session " + sessionId + "; re-authenticate"));

        Instant now = clock.instant();
        if (credential.isExpiredAt(now)) {
            throw new GatewayException(ErrorKind.CREDENTIAL_EXPIRED,
                    "Credential expired at " + credential.getExpiresAt() + "; re-authenticate");
        }

        Set<String> missing = new TreeSet<>(requiredScopes);
        missing.removeAll(credential.getScopes());
        if (!missing.isEmpty()) {
            throw GatewayException.insufficientScope(missing);
        }

        boolean refreshDue = needsRefresh(credential);
        if (refreshDue) {
            log.warn("Credential {} for session {} expires at {}, re-authenticate soon",
                    credential.identity(), sessionId, credential.getExpiresAt());
        }
        return new ValidatedCredential(sessionId, credential, refreshDue);
    }

    /**
     * True when the credential expires within the refresh window but has not expired yet.
     */
    public boolean needsRefresh(Credential credential) {
        if (credential.getExpiresAt() == null) {
            return false;
        }
        Instant now = clock.instant();
        return !credential.isExpiredAt(now) && credential.getExpiresAt().isBefore(now.plus(refreshWindow));
    }
}
