package com.adsgateway.auth;

import com.adsgateway.core.StorageUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed credential store.
 *
 * Each credential is a single JSON document written with one SET, so a
 * replacement is atomic for readers. Keys of expiring credentials outlive the
 * expiry by a day: an expired credential must still be readable so callers get
 * "expired" rather than "missing", and the key cleans itself up afterwards.
 *
 * Reads go through a short-lived local cache to avoid a Redis round trip per
 * gateway call. Writes through this instance hit Redis first and then replace
 * the local entry; writes by other processes become visible once the local
 * entry expires.
 */
@Slf4j
public class RedisCredentialStore implements CredentialStore {

    private static final String KEY_PREFIX = "cred:";
    private static final Duration EXPIRED_GRACE = Duration.ofDays(1);

    private final JedisPool jedisPool;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Cache<String, Credential> localCache;

    public RedisCredentialStore(String host, int port, ObjectMapper objectMapper,
                                Clock clock, Duration localCacheTtl) {
        this(createPool(host, port), objectMapper, clock, localCacheTtl);
        log.info("Redis credential store initialized: {}:{}", host, port);
    }

    public RedisCredentialStore(JedisPool jedisPool, ObjectMapper objectMapper,
                                Clock clock, Duration localCacheTtl) {
        this.jedisPool = jedisPool;
        this.objectMapper = objectMapper;
        this.clock = clock;

        // Short TTL to balance round trips vs staleness across processes
        if (localCacheTtl != null && !localCacheTtl.isZero()) {
            this.localCache = Caffeine.newBuilder()
                    .expireAfterWrite(localCacheTtl.toMillis(), TimeUnit.MILLISECONDS)
                    .maximumSize(10000)
                    .build();
        } else {
            this.localCache = null;
        }
    }

    private static JedisPool createPool(String host, int port) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(32);
        poolConfig.setMaxIdle(8);
        poolConfig.setMinIdle(2);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofSeconds(2));
        return new JedisPool(poolConfig, host, port);
    }

    @Override
    public Optional<Credential> get(String sessionId) {
        if (localCache == null) {
            return Optional.ofNullable(load(sessionId));
        }
        // Atomic per key: a concurrent put or invalidate waits for this load and then wins
        return Optional.ofNullable(localCache.get(sessionId, this::load));
    }

    private Credential load(String sessionId) {
        String json;
        try (Jedis jedis = jedisPool.getResource()) {
            json = jedis.get(key(sessionId));
        } catch (JedisException e) {
            throw new StorageUnavailableException("Credential store unavailable", e);
        }
        if (json == null) {
            return null;
        }

        try {
            return objectMapper.readValue(json, Credential.class);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Stored credential for session " + sessionId + " is unreadable", e);
        }
    }

    @Override
    public void put(String sessionId, Credential credential) {
        credential.validate();
        Credential stored = credential.toBuilder().storedAt(clock.instant()).build();

        String json;
        try {
            json = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credential is not serializable", e);
        }

        SetParams params = new SetParams();
        if (stored.getExpiresAt() != null) {
            params.exAt(stored.getExpiresAt().plus(EXPIRED_GRACE).getEpochSecond());
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.set(key(sessionId), json, params);
        } catch (JedisException e) {
            throw new StorageUnavailableException("Credential store unavailable", e);
        }

        if (localCache != null) {
            localCache.put(sessionId, stored);
        }
        log.info("Credential {} stored for session {}", stored.identity(), sessionId);
    }

    @Override
    public void invalidate(String sessionId) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(key(sessionId));
        } catch (JedisException e) {
            throw new StorageUnavailableException("Credential store unavailable", e);
        }
        if (localCache != null) {
            localCache.invalidate(sessionId);
        }
        log.info("Credential invalidated for session {}", sessionId);
    }

    @Override
    public Set<String> sessions() {
        Set<String> sessions = new HashSet<>();
        ScanParams params = new ScanParams().match(KEY_PREFIX + "*").count(100);
        try (Jedis jedis = jedisPool.getResource()) {
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                for (String key : page.getResult()) {
                    sessions.add(key.substring(KEY_PREFIX.length()));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        } catch (JedisException e) {
            throw new StorageUnavailableException("Credential store unavailable", e);
        }
        return sessions;
    }

    @Override
    public boolean isAvailable() {
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    private static String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
