package com.adsgateway.auth;

import java.util.Optional;
import java.util.Set;

/**
 * Durable holder of one credential per session.
 * Allows swapping backends without changing gateway logic.
 *
 * Implementations throw {@link com.adsgateway.core.StorageUnavailableException}
 * when the backend cannot be reached; they do not retry.
 */
public interface CredentialStore {

    Optional<Credential> get(String sessionId);

    /**
     * Replace the session's credential. Atomic with respect to concurrent reads:
     * a reader sees either the old credential or the new one.
     *
     * @throws IllegalArgumentException if the token format is invalid
     */
    void put(String sessionId, Credential credential);

    /**
     * Forget the session's credential, e.g. after the remote service rejected it.
     */
    void invalidate(String sessionId);

    /**
     * Sessions that currently hold a credential
     */
    Set<String> sessions();

    /**
     * Health check
     */
    boolean isAvailable();
}
