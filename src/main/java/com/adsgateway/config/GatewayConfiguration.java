package com.adsgateway.config;

import com.adsgateway.auth.CredentialRefresher;
import com.adsgateway.auth.CredentialStore;
import com.adsgateway.auth.InMemoryCredentialStore;
import com.adsgateway.auth.RedisCredentialStore;
import com.adsgateway.auth.TokenValidator;
import com.adsgateway.cache.LruRequestCache;
import com.adsgateway.cache.RequestCache;
import com.adsgateway.core.GatewayConfig;
import com.adsgateway.core.RateLimiter;
import com.adsgateway.core.Sleeper;
import com.adsgateway.gateway.ApiGateway;
import com.adsgateway.normalize.ResponseNormalizer;
import com.adsgateway.ratelimit.SlidingWindowRateLimiter;
import com.adsgateway.remote.RemoteAdsClient;
import com.adsgateway.remote.RestTemplateAdsClient;
import com.adsgateway.retry.RetryExecutor;
import com.adsgateway.retry.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;

/**
 * Spring configuration for the gateway components
 */
@Slf4j
@Configuration
public class GatewayConfiguration {

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${gateway.credential-store:redis}")
    private String credentialStoreType;

    @Value("${gateway.credential-cache-ttl:5s}")
    private Duration credentialCacheTtl;

    @Value("${gateway.remote.base-url:https://graph.facebook.com/v22.0}")
    private String remoteBaseUrl;

    @Value("${gateway.remote.connect-timeout:15s}")
    private Duration connectTimeout;

    @Value("${gateway.remote.read-timeout:180s}")
    private Duration readTimeout;

    @Value("${gateway.rate-limit.quota:200}")
    private long quota;

    @Value("${gateway.rate-limit.window:1h}")
    private Duration window;

    @Value("${gateway.rate-limit.max-wait:1h}")
    private Duration maxWait;

    @Value("${gateway.rate-limit.max-admission-waits:3}")
    private int maxAdmissionWaits;

    @Value("${gateway.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${gateway.cache.ttl:300s}")
    private Duration cacheTtl;

    @Value("${gateway.cache.capacity:1000}")
    private int cacheCapacity;

    @Value("${gateway.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${gateway.retry.base-backoff:1s}")
    private Duration baseBackoff;

    @Value("${gateway.retry.max-backoff:30s}")
    private Duration maxBackoff;

    @Value("${gateway.retry.jitter:0.2}")
    private double jitter;

    @Value("${gateway.invocation-timeout:180s}")
    private Duration invocationTimeout;

    @Value("${gateway.auth.refresh-window:10d}")
    private Duration refreshWindow;

    @Value("${gateway.default-scopes:ads_read}")
    private String[] defaultScopes;

    @Value("${gateway.write-scopes:ads_management}")
    private String[] writeScopes;

    @Value("${gateway.pagination.max-pages:50}")
    private int maxPages;

    @Value("${gateway.auth.app-id:}")
    private String appId;

    @Value("${gateway.auth.app-secret:}")
    private String appSecret;

    @Bean
    public GatewayConfig gatewayConfig() {
        GatewayConfig config = GatewayConfig.builder()
                .quota(quota)
                .window(window)
                .maxWait(maxWait)
                .maxAdmissionWaits(maxAdmissionWaits)
                .cacheEnabled(cacheEnabled)
                .cacheTtl(cacheTtl)
                .cacheCapacity(cacheCapacity)
                .maxAttempts(maxAttempts)
                .baseBackoff(baseBackoff)
                .maxBackoff(maxBackoff)
                .jitter(jitter)
                .invocationTimeout(invocationTimeout)
                .refreshWindow(refreshWindow)
                .defaultScopes(Arrays.asList(defaultScopes))
                .writeScopes(Set.copyOf(Arrays.asList(writeScopes)))
                .maxPages(maxPages)
                .build();
        config.validate();
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public CredentialStore credentialStore(ObjectMapper objectMapper, Clock clock) {
        if ("memory".equalsIgnoreCase(credentialStoreType)) {
            log.info("Using in-memory credential store; credentials will not survive a restart");
            return new InMemoryCredentialStore(clock);
        }
        log.info("Initializing Redis credential store at {}:{}", redisHost, redisPort);
        return new RedisCredentialStore(redisHost, redisPort, objectMapper, clock, credentialCacheTtl);
    }

    @Bean
    public RateLimiter rateLimiter(GatewayConfig config, Clock clock, MeterRegistry meterRegistry) {
        return new SlidingWindowRateLimiter(config, clock, meterRegistry);
    }

    @Bean
    public RequestCache requestCache(GatewayConfig config, Clock clock, MeterRegistry meterRegistry) {
        return new LruRequestCache(config.getCacheCapacity(), clock, meterRegistry);
    }

    @Bean
    public RetryExecutor retryExecutor(GatewayConfig config, MeterRegistry meterRegistry) {
        return new RetryExecutor(new RetryPolicy(config), Sleeper.SYSTEM, meterRegistry);
    }

    @Bean
    public RestTemplate remoteRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public RemoteAdsClient remoteAdsClient(RestTemplate remoteRestTemplate, ObjectMapper objectMapper) {
        log.info("Remote ads API at {}", remoteBaseUrl);
        return new RestTemplateAdsClient(remoteRestTemplate, objectMapper, remoteBaseUrl);
    }

    @Bean
    public TokenValidator tokenValidator(GatewayConfig config, Clock clock) {
        return new TokenValidator(clock, config.getRefreshWindow());
    }

    @Bean
    public CredentialRefresher credentialRefresher(CredentialStore credentialStore,
                                                   TokenValidator tokenValidator,
                                                   RemoteAdsClient remoteAdsClient,
                                                   Clock clock,
                                                   MeterRegistry meterRegistry) {
        CredentialRefresher refresher = new CredentialRefresher(credentialStore, tokenValidator, remoteAdsClient,
                appId, appSecret, clock, meterRegistry);
        if (!refresher.isConfigured()) {
            log.info("gateway.auth.app-id/app-secret not set; expiring tokens will not be refreshed");
        }
        return refresher;
    }

    @Bean
    public ApiGateway apiGateway(GatewayConfig config,
                                 CredentialStore credentialStore,
                                 TokenValidator tokenValidator,
                                 RateLimiter rateLimiter,
                                 RequestCache requestCache,
                                 RetryExecutor retryExecutor,
                                 RemoteAdsClient remoteAdsClient,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry) {

        return new ApiGateway(config, credentialStore, tokenValidator, rateLimiter, requestCache,
                retryExecutor, remoteAdsClient, new ResponseNormalizer(), objectMapper,
                Sleeper.SYSTEM, meterRegistry);
    }
}
