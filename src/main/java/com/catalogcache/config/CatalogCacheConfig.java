package com.catalogcache.config;

import com.catalogcache.algorithms.TokenBucketRateLimiter;
import com.catalogcache.cache.CatalogCache;
import com.catalogcache.core.CacheConfig;
import com.catalogcache.core.RateLimitConfig;
import com.catalogcache.core.RateLimiter;
import com.catalogcache.metrics.MetricsAggregator;
import com.catalogcache.service.CatalogQueryService;
import com.catalogcache.service.Sleeper;
import com.catalogcache.storage.RedisStateStore;
import com.catalogcache.storage.StateStore;
import com.catalogcache.upstream.CatalogApi;
import com.catalogcache.upstream.GraphQlCatalogClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the catalog read path.
 *
 * Every component is built once here, in dependency order, and shared.
 */
@Slf4j
@Configuration
public class CatalogCacheConfig {

    private static final int UPSTREAM_TIMEOUT_MS = 10_000;
    private static final int BACKGROUND_QUEUE_CAPACITY = 1_000;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.username:}")
    private String redisUsername;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${catalog.upstream.shop-domain:}")
    private String shopDomain;

    @Value("${catalog.upstream.access-token:}")
    private String accessToken;

    @Value("${catalog.upstream.api-version:2024-01}")
    private String apiVersion;

    @Value("${catalog.rate-limit.max-points:1000}")
    private double maxPoints;

    @Value("${catalog.rate-limit.refill-rate:50}")
    private double refillRate;

    @Value("${catalog.rate-limit.estimated-query-cost:10}")
    private int estimatedQueryCost;

    @Value("${catalog.rate-limit.max-wait-ms:20000}")
    private long maxWaitMs;

    @Value("${catalog.cache.ttl-seconds:300}")
    private long cacheTtlSeconds;

    @Value("${catalog.cache.local.enabled:true}")
    private boolean localCacheEnabled;

    @Value("${catalog.cache.local.ttl-ms:100}")
    private long localCacheTtlMs;

    @Value("${catalog.metrics.retention-seconds:3600}")
    private long metricsRetentionSeconds;

    @Value("${catalog.metrics.max-samples:10000}")
    private int metricsMaxSamples;

    @Value("${catalog.background.threads:4}")
    private int backgroundThreads;

    @Bean(destroyMethod = "close")
    public RedisStateStore stateStore() {
        log.info("Initializing Redis state store at {}:{}", redisHost, redisPort);
        return new RedisStateStore(redisHost, redisPort, redisUsername, redisPassword);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the fire-and-forget writes: cache population, metric samples, budget debits.
     * A full queue rejects new work, which the components log and drop.
     */
    @Bean(name = "backgroundExecutor", destroyMethod = "shutdown")
    public ExecutorService backgroundExecutor() {
        return new ThreadPoolExecutor(
                backgroundThreads,
                backgroundThreads,
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(BACKGROUND_QUEUE_CAPACITY),
                new CustomizableThreadFactory("catalog-bg-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public RateLimitConfig rateLimitConfig() {
        return RateLimitConfig.builder()
                .maxPoints(maxPoints)
                .refillRate(refillRate)
                .estimatedQueryCost(estimatedQueryCost)
                .maxWait(Duration.ofMillis(maxWaitMs))
                .build();
    }

    @Bean
    public RateLimiter rateLimiter(
            StateStore stateStore,
            RateLimitConfig rateLimitConfig,
            ObjectMapper objectMapper,
            Clock clock,
            @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor,
            MeterRegistry meterRegistry) {

        return new TokenBucketRateLimiter(stateStore, rateLimitConfig, objectMapper, clock,
                backgroundExecutor, meterRegistry);
    }

    @Bean
    public CatalogCache catalogCache(
            StateStore stateStore,
            ObjectMapper objectMapper,
            @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor,
            MeterRegistry meterRegistry) {

        CacheConfig config = CacheConfig.builder()
                .ttl(Duration.ofSeconds(cacheTtlSeconds))
                .enableLocalCache(localCacheEnabled)
                .localCacheTtl(Duration.ofMillis(localCacheTtlMs))
                .build();

        return new CatalogCache(stateStore, config, objectMapper, backgroundExecutor, meterRegistry);
    }

    @Bean
    public MetricsAggregator metricsAggregator(
            StateStore stateStore,
            ObjectMapper objectMapper,
            Clock clock,
            @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor) {

        return new MetricsAggregator(stateStore, objectMapper, clock, backgroundExecutor,
                Duration.ofSeconds(metricsRetentionSeconds), metricsMaxSamples);
    }

    @Bean
    public CatalogApi catalogApi(RestClient.Builder restClientBuilder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(UPSTREAM_TIMEOUT_MS);
        requestFactory.setReadTimeout(UPSTREAM_TIMEOUT_MS);

        return new GraphQlCatalogClient(restClientBuilder.requestFactory(requestFactory),
                shopDomain, apiVersion, accessToken);
    }

    @Bean
    public CatalogQueryService catalogQueryService(
            CatalogApi catalogApi,
            CatalogCache catalogCache,
            RateLimiter rateLimiter,
            MetricsAggregator metricsAggregator,
            RateLimitConfig rateLimitConfig,
            Clock clock,
            MeterRegistry meterRegistry) {

        return new CatalogQueryService(catalogApi, catalogCache, rateLimiter, metricsAggregator,
                rateLimitConfig, clock, Sleeper.THREAD, meterRegistry);
    }
}
