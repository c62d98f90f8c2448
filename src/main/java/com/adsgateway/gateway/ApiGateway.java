package com.adsgateway.gateway;

import com.adsgateway.auth.Credential;
import com.adsgateway.auth.CredentialStore;
import com.adsgateway.auth.TokenValidator;
import com.adsgateway.auth.ValidatedCredential;
import com.adsgateway.cache.Fingerprint;
import com.adsgateway.cache.InFlightRegistry;
import com.adsgateway.cache.RequestCache;
import com.adsgateway.core.Admission;
import com.adsgateway.core.ApiRequest;
import com.adsgateway.core.ApiResult;
import com.adsgateway.core.EntityKind;
import com.adsgateway.core.ErrorKind;
import com.adsgateway.core.GatewayConfig;
import com.adsgateway.core.GatewayException;
import com.adsgateway.core.MalformedResponseException;
import com.adsgateway.core.RateLimiter;
import com.adsgateway.core.Sleeper;
import com.adsgateway.normalize.NormalizedEntity;
import com.adsgateway.normalize.ResponseNormalizer;
import com.adsgateway.normalize.WriteResult;
import com.adsgateway.remote.GraphParams;
import com.adsgateway.remote.RemoteAdsClient;
import com.adsgateway.retry.Outcome;
import com.adsgateway.retry.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single choke point for every call to the remote ads API.
 *
 * Per read:
 * VALIDATING → CACHE_CHECK → (RATE_LIMITING → EXECUTING)? → NORMALIZING → DONE,
 * any stage may end in FAILED.
 *
 * - Local failures (credential, scope, local quota) return before any remote call
 * - Cache misses for the same fingerprint share one flight; the flight re-checks
 *   the cache, waits for quota, calls out with retries and stores the payload
 * - Every attempt and every page goes back through the limiter, so retries and
 *   pagination count against quota too
 * - Payloads are cached raw and normalized on every path; a payload that fails
 *   normalization is evicted so it is not served again
 *
 * Writes skip the cache and the flights, are retried only when the remote service
 * throttled them, and drop every cached read of the writing credential.
 *
 * Never throws: every outcome is an {@link ApiResult}.
 */
@Slf4j
public class ApiGateway implements AutoCloseable {

    // A write that timed out may still have been applied; only throttled writes are resent
    private static final Set<Outcome> WRITE_RETRYABLE = EnumSet.of(Outcome.RATE_LIMITED);

    private final GatewayConfig config;
    private final CredentialStore credentialStore;
    private final TokenValidator tokenValidator;
    private final RateLimiter rateLimiter;
    private final RequestCache cache;
    private final RetryExecutor retryExecutor;
    private final RemoteAdsClient remoteClient;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final ExecutorService flightExecutor;
    private final InFlightRegistry<JsonNode> inFlight;
    private final ConcurrentMap<String, WriteEpoch> writeEpochs = new ConcurrentHashMap<>();

    private final MeterRegistry meterRegistry;
    private final Counter remoteCalls;
    private final Counter invocations;
    private final Counter writes;

    public ApiGateway(GatewayConfig config,
                      CredentialStore credentialStore,
                      TokenValidator tokenValidator,
                      RateLimiter rateLimiter,
                      RequestCache cache,
                      RetryExecutor retryExecutor,
                      RemoteAdsClient remoteClient,
                      ResponseNormalizer normalizer,
                      ObjectMapper objectMapper,
                      Sleeper sleeper,
                      MeterRegistry meterRegistry) {

        config.validate();
        this.config = config;
        this.credentialStore = credentialStore;
        this.tokenValidator = tokenValidator;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.retryExecutor = retryExecutor;
        this.remoteClient = remoteClient;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;

        AtomicInteger threadCount = new AtomicInteger();
        this.flightExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gateway-flight-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.inFlight = new InFlightRegistry<>(flightExecutor);

        this.remoteCalls = Counter.builder("gateway.remote.calls")
                .description("Remote call attempts, retries and pages included")
                .register(meterRegistry);
        this.invocations = Counter.builder("gateway.invocations")
                .description("Gateway read invocations")
                .register(meterRegistry);
        this.writes = Counter.builder("gateway.writes")
                .description("Gateway write invocations")
                .register(meterRegistry);

        log.info("Gateway initialized: quota={}/{}, cache={} (ttl={}, capacity={}), maxAttempts={}",
                config.getQuota(), config.getWindow(), config.isCacheEnabled() ? "on" : "off",
                config.getCacheTtl(), config.getCacheCapacity(), config.getMaxAttempts());
    }

    public ApiResult invoke(String sessionId, ApiRequest request) {
        invocations.increment();
        InvocationStage stage = InvocationStage.VALIDATING;
        try {
            request.validate();
            Set<String> requiredScopes = request.getRequiredScopes().isEmpty()
                    ? config.getDefaultScopes()
                    : request.getRequiredScopes();
            ValidatedCredential credential = tokenValidator.ensureUsable(
                    sessionId, credentialStore.get(sessionId), requiredScopes);

            ApiRequest effective = withCurrencyField(request);
            String path = effective.path();
            String fingerprint = Fingerprint.of(effective.getEndpoint(), path, effective.getParameters(),
                    effective.isAllPages(), credential.identity());

            stage = transition(stage, InvocationStage.CACHE_CHECK, fingerprint);
            JsonNode payload = null;
            if (config.isCacheEnabled()) {
                payload = cache.lookup(fingerprint).orElse(null);
            }
            if (payload == null) {
                stage = transition(stage, InvocationStage.RATE_LIMITING, fingerprint);
                payload = awaitFlight(fingerprint, () -> fetch(fingerprint, path, effective, credential));
            }

            stage = transition(stage, InvocationStage.NORMALIZING, fingerprint);
            List<NormalizedEntity> data = normalize(payload, effective, fingerprint);

            transition(stage, InvocationStage.DONE, fingerprint);
            return ApiResult.success(data);

        } catch (GatewayException e) {
            return fail(stage, e);
        } catch (IllegalArgumentException e) {
            return fail(stage, new GatewayException(ErrorKind.PERMANENT_FAILURE, "Invalid request: " + e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure at {}", stage, e);
            return fail(stage, new GatewayException(ErrorKind.PERMANENT_FAILURE, "Unexpected error: " + e.getMessage(), e));
        }
    }

    /**
     * Create or update a remote object, e.g. {@code POST act_123/campaigns} or {@code POST <campaign id>}.
     * Requires {@code ads_management} unless the request names other scopes.
     */
    public ApiResult write(String sessionId, ApiRequest request) {
        writes.increment();
        InvocationStage stage = InvocationStage.VALIDATING;
        AtomicBoolean attempted = new AtomicBoolean();
        String identity = null;
        try {
            request.validateTarget();
            Set<String> requiredScopes = request.getRequiredScopes().isEmpty()
                    ? config.getWriteScopes()
                    : request.getRequiredScopes();
            ValidatedCredential credential = tokenValidator.ensureUsable(
                    sessionId, credentialStore.get(sessionId), requiredScopes);
            identity = credential.identity();

            String path = request.path();
            Map<String, String> form = GraphParams.encode(request.getParameters(), objectMapper);

            stage = transition(stage, InvocationStage.RATE_LIMITING, path);
            JsonNode response = retryExecutor.execute(() -> {
                awaitAdmission(credential.identity(), null);
                transition(InvocationStage.RATE_LIMITING, InvocationStage.EXECUTING, path);
                attempted.set(true);
                remoteCalls.increment();
                return remoteClient.post(path, form, credential.accessToken());
            }, () -> invalidateCredential(credential), WRITE_RETRYABLE);

            stage = transition(stage, InvocationStage.NORMALIZING, path);
            WriteResult result = normalizer.normalizeWrite(response, path);
            log.info("Write to {} by credential {} applied (id={})", path, identity, result.getId());

            transition(stage, InvocationStage.DONE, path);
            return ApiResult.success(List.of(result));

        } catch (GatewayException e) {
            return fail(stage, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(stage, new GatewayException(ErrorKind.TRANSIENT, "Write interrupted", e));
        } catch (IllegalArgumentException e) {
            return fail(stage, new GatewayException(ErrorKind.PERMANENT_FAILURE, "Invalid request: " + e.getMessage(), e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure at {}", stage, e);
            return fail(stage, new GatewayException(ErrorKind.PERMANENT_FAILURE, "Unexpected error: " + e.getMessage(), e));
        } finally {
            // Also after a failed attempt: the remote side may have applied it anyway
            if (attempted.get()) {
                dropCachedReads(identity);
            }
        }
    }

    /**
     * Runs once per flight, on the flight executor.
     */
    private JsonNode fetch(String fingerprint, String path, ApiRequest request,
                           ValidatedCredential credential) throws InterruptedException {
        if (config.isCacheEnabled()) {
            Optional<JsonNode> hit = cache.lookup(fingerprint);
            if (hit.isPresent()) {
                return hit.get();
            }
        }

        String identity = credential.identity();
        WriteEpoch epoch = writeEpoch(identity);
        long seen = epoch.current();

        Map<String, String> query = GraphParams.encode(request.getParameters(), objectMapper);
        JsonNode payload = request.isAllPages()
                ? fetchAllPages(fingerprint, path, query, credential)
                : fetchPage(fingerprint, path, query, credential);

        if (config.isCacheEnabled()
                && !epoch.runIfUnchanged(seen, () -> cache.store(fingerprint, identity, payload, config.getCacheTtl()))) {
            log.debug("Not caching {}: credential {} wrote while it was fetched", fingerprint, identity);
        }
        return payload;
    }

    private JsonNode fetchPage(String fingerprint, String path, Map<String, String> query,
                               ValidatedCredential credential) throws InterruptedException {
        return retryExecutor.execute(() -> {
            awaitAdmission(credential.identity(), fingerprint);
            transition(InvocationStage.RATE_LIMITING, InvocationStage.EXECUTING, fingerprint);
            remoteCalls.increment();
            return remoteClient.get(path, query, credential.accessToken());
        }, () -> invalidateCredential(credential));
    }

    /**
     * Follows the {@code after} cursor until the remote service stops announcing a next page,
     * and folds every page's {@code data} into one envelope.
     */
    private JsonNode fetchAllPages(String fingerprint, String path, Map<String, String> query,
                                   ValidatedCredential credential) throws InterruptedException {
        ArrayNode elements = objectMapper.createArrayNode();
        Map<String, String> pageQuery = query;
        for (int page = 1; ; page++) {
            JsonNode body = fetchPage(fingerprint, path, pageQuery, credential);
            JsonNode data = body.get("data");
            if (data == null || !data.isArray()) {
                throw new MalformedResponseException("Page " + page + " of " + path + " has no 'data' array");
            }
            elements.addAll((ArrayNode) data);

            String after = nextCursor(body);
            if (after == null) {
                log.debug("Collected {} elements from {} pages of {}", elements.size(), page, path);
                break;
            }
            if (page >= config.getMaxPages()) {
                throw new GatewayException(ErrorKind.PERMANENT_FAILURE,
                        path + " has more than " + config.getMaxPages() + " pages; narrow the request");
            }
            pageQuery = new LinkedHashMap<>(query);
            pageQuery.put("after", after);
        }

        ObjectNode combined = objectMapper.createObjectNode();
        combined.set("data", elements);
        return combined;
    }

    private static String nextCursor(JsonNode page) {
        JsonNode paging = page.path("paging");
        if (!paging.hasNonNull("next")) {
            return null;
        }
        String after = paging.path("cursors").path("after").asText("");
        if (after.isEmpty()) {
            throw new MalformedResponseException("Next page announced without an 'after' cursor");
        }
        return after;
    }

    /**
     * Blocks until the limiter admits the call, at most {@code maxAdmissionWaits} times.
     * Callers waiting on the flight get their deadline pushed back by every granted wait.
     */
    private void awaitAdmission(String credentialId, String fingerprint) throws InterruptedException {
        for (int waits = 0; ; waits++) {
            Admission admission = rateLimiter.admit(credentialId);
            if (admission.isAdmitted()) {
                return;
            }
            if (admission.getDecision() == Admission.Decision.REJECTED) {
                throw new GatewayException(ErrorKind.RATE_LIMIT_EXCEEDED,
                        "Local quota exhausted; next slot in " + admission.getRetryAfter().toSeconds() + "s");
            }
            if (waits >= config.getMaxAdmissionWaits()) {
                throw new GatewayException(ErrorKind.RATE_LIMIT_EXCEEDED,
                        "Local quota still exhausted after " + waits + " waits");
            }
            Duration wait = admission.getRetryAfter();
            if (fingerprint != null) {
                inFlight.extendDeadline(fingerprint, wait);
            }
            log.info("Waiting {}ms for quota on credential {}", wait.toMillis(), credentialId);
            sleeper.sleep(wait);
        }
    }

    private JsonNode awaitFlight(String fingerprint, Callable<JsonNode> loader) {
        InFlightRegistry<JsonNode>.Ticket ticket = inFlight.join(fingerprint, loader);
        try {
            return ticket.await(config.getInvocationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException) {
                throw (GatewayException) cause;
            }
            if (cause instanceof InterruptedException || cause instanceof CancellationException) {
                throw new GatewayException(ErrorKind.TRANSIENT, "Remote call was cancelled", cause);
            }
            throw new GatewayException(ErrorKind.PERMANENT_FAILURE, "Remote call failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new GatewayException(ErrorKind.TRANSIENT,
                    "No result within " + config.getInvocationTimeout().toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new GatewayException(ErrorKind.TRANSIENT, "Remote call was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorKind.TRANSIENT, "Invocation interrupted", e);
        } finally {
            ticket.release();
        }
    }

    private List<NormalizedEntity> normalize(JsonNode payload, ApiRequest request, String fingerprint) {
        try {
            return normalizer.normalize(payload, request.getEntityKind());
        } catch (MalformedResponseException e) {
            if (config.isCacheEnabled()) {
                cache.invalidate(fingerprint);
            }
            throw e;
        }
    }

    /**
     * Insight spend can only be scaled with the account currency, so an explicit field
     * list always asks for it.
     */
    private static ApiRequest withCurrencyField(ApiRequest request) {
        if (request.getEntityKind() != EntityKind.INSIGHT) {
            return request;
        }
        Object fields = request.getParameters().get("fields");
        if (fields instanceof List) {
            List<?> requested = (List<?>) fields;
            if (requested.contains("account_currency")) {
                return request;
            }
            List<Object> extended = new ArrayList<>(requested);
            extended.add("account_currency");
            return request.toBuilder().parameter("fields", extended).build();
        }
        if (fields instanceof String) {
            String requested = (String) fields;
            if (List.of(requested.split(",")).contains("account_currency")) {
                return request;
            }
            return request.toBuilder().parameter("fields", requested + ",account_currency").build();
        }
        return request;
    }

    private void dropCachedReads(String identity) {
        if (identity == null) {
            return;
        }
        writeEpoch(identity).advanceAndRun(() -> {
            if (config.isCacheEnabled()) {
                int dropped = cache.invalidateOwner(identity);
                log.debug("Write by credential {} dropped {} cached reads", identity, dropped);
            }
        });
    }

    private WriteEpoch writeEpoch(String identity) {
        return writeEpochs.computeIfAbsent(identity, k -> new WriteEpoch());
    }

    /**
     * Drops the stored credential unless it has already been replaced by a newer one.
     */
    private void invalidateCredential(ValidatedCredential rejected) {
        Optional<Credential> current = credentialStore.get(rejected.getSessionId());
        if (current.isPresent() && current.get().identity().equals(rejected.identity())) {
            credentialStore.invalidate(rejected.getSessionId());
            log.warn("Credential {} invalidated for session {} after remote rejection",
                    rejected.identity(), rejected.getSessionId());
        }
    }

    private InvocationStage transition(InvocationStage from, InvocationStage to, String subject) {
        log.trace("{} -> {} [{}]", from, to, subject);
        return to;
    }

    private ApiResult fail(InvocationStage stage, GatewayException e) {
        meterRegistry.counter("gateway.invocations.failed", "kind", e.getKind().name()).increment();
        transition(stage, InvocationStage.FAILED, e.getKind().name());
        log.debug("Invocation failed at {} with {}: {}", stage, e.getKind(), e.getMessage());
        return ApiResult.failure(e);
    }

    public void clearCache() {
        cache.clear();
    }

    public void resetRateLimit(String credentialId) {
        rateLimiter.reset(credentialId);
    }

    public long availablePermits(String credentialId) {
        return rateLimiter.getAvailablePermits(credentialId);
    }

    @Override
    public void close() {
        flightExecutor.shutdownNow();
        log.info("Gateway flight executor stopped");
    }

    /**
     * Counts writes per credential. A read that started before a write must not
     * cache what it fetched, since the write may have changed it.
     */
    private static final class WriteEpoch {
        private long value;

        private synchronized long current() {
            return value;
        }

        private synchronized void advanceAndRun(Runnable action) {
            value++;
            action.run();
        }

        private synchronized boolean runIfUnchanged(long seen, Runnable action) {
            if (value != seen) {
                return false;
            }
            action.run();
            return true;
        }
    }
}
