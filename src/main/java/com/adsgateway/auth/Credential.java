package com.adsgateway.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Access token plus what the remote service granted with it.
 * Produced by the OAuth flow; replaced wholesale, never merged.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Credential {

    private static final Pattern TOKEN_FORMAT = Pattern.compile("^[A-Za-z0-9_-]{50,}$");

    @ToString.Exclude
    String accessToken;

    /**
     * Null when the token does not expire until revoked
     */
    Instant expiresAt;

    @Singular
    Set<String> scopes;

    @Singular
    List<String> accountIds;

    /**
     * Remote user the token was issued to, when known
     */
    String remoteUserId;

    Instant storedAt;

    /**
     * Stable, non-reversible handle for this token. Safe to log and to use as a map key.
     */
    @JsonIgnore
    public String identity() {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(accessToken.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Long-lived platform tokens are long runs of URL-safe characters.
     */
    public void validate() {
        if (accessToken == null || !TOKEN_FORMAT.matcher(accessToken).matches()) {
            throw new IllegalArgumentException("Invalid token format");
        }
    }
}
