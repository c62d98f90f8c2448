package com.adsgateway.auth;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store. Does not survive restarts; meant for development and tests.
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentMap<String, Credential> credentials = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCredentialStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Credential> get(String sessionId) {
        return Optional.ofNullable(credentials.get(sessionId));
    }

    @Override
    public void put(String sessionId, Credential credential) {
        credential.validate();
        credentials.put(sessionId, credential.toBuilder().storedAt(clock.instant()).build());
        log.info("Credential {} stored for session {}", credential.identity(), sessionId);
    }

    @Override
    public void invalidate(String sessionId) {
        Credential removed = credentials.remove(sessionId);
        if (removed != null) {
            log.info("Credential {} invalidated for session {}", removed.identity(), sessionId);
        }
    }

    @Override
    public Set<String> sessions() {
        return Set.copyOf(credentials.keySet());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
