package com.catalogcache.cache;

import com.catalogcache.core.CacheConfig;
import com.catalogcache.model.Product;
import com.catalogcache.model.ProductPage;
import com.catalogcache.storage.StateStore;
import com.catalogcache.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Read-through cache for single products and product list pages.
 *
 * Entries expire after the configured TTL and are never invalidated actively,
 * so a cached value can be at most one TTL behind the upstream.
 *
 * The cache never fails its caller: storage or decoding errors on read are
 * reported as a miss, and writes run in the background where failures are
 * only logged.
 */
@Slf4j
public class CatalogCache {

    static final String PRODUCT_PREFIX = "product:";
    static final String LIST_PREFIX = "products:list:";
    static final String FIRST_PAGE = "start";

    private final StateStore storage;
    private final CacheConfig config;
    private final ObjectMapper objectMapper;
    private final Executor backgroundExecutor;
    private final Cache<String, Object> localCache;
    private final MeterRegistry meterRegistry;

    public CatalogCache(
            StateStore storage,
            CacheConfig config,
            ObjectMapper objectMapper,
            Executor backgroundExecutor,
            MeterRegistry meterRegistry) {

        config.validate();
        this.storage = storage;
        this.config = config;
        this.objectMapper = objectMapper;
        this.backgroundExecutor = backgroundExecutor;
        this.meterRegistry = meterRegistry;

        if (config.isEnableLocalCache()) {
            this.localCache = Caffeine.newBuilder()
                    .expireAfterWrite(config.getLocalCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
                    .maximumSize(config.getLocalCacheMaxSize())
                    .build();
        } else {
            this.localCache = null;
        }
    }

    public Optional<Product> getProduct(String productId) {
        Optional<Product> product = read(productKey(productId), Product.class);
        record("product", product.isPresent());
        return product;
    }

    public void putProduct(String productId, Product product) {
        write(productKey(productId), product);
    }

    /**
     * A cached page only counts as a hit when it holds at least {@code requestedLimit}
     * edges: a shorter page cannot answer a larger request even if it has not expired.
     */
    public Optional<ProductPage> getPage(String cursor, int requestedLimit) {
        Optional<ProductPage> page = read(pageKey(cursor), ProductPage.class)
                .filter(p -> {
                    if (p.edges().size() < requestedLimit) {
                        log.debug("Cached page for cursor={} has {} edges, {} requested; ignoring it",
                                cursor, p.edges().size(), requestedLimit);
                        return false;
                    }
                    return true;
                });
        record("page", page.isPresent());
        return page;
    }

    public void putPage(String cursor, ProductPage page) {
        write(pageKey(cursor), page);
    }

    static String productKey(String productId) {
        return PRODUCT_PREFIX + productId;
    }

    static String pageKey(String cursor) {
        return LIST_PREFIX + (cursor == null || cursor.isEmpty() ? FIRST_PAGE : cursor);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        if (localCache != null) {
            Object local = localCache.getIfPresent(key);
            if (type.isInstance(local)) {
                return Optional.of(type.cast(local));
            }
        }

        try {
            String data = storage.get(key);
            if (data == null) {
                return Optional.empty();
            }
            T value = objectMapper.readValue(data, type);
            if (localCache != null) {
                localCache.put(key, value);
            }
            return Optional.of(value);
        } catch (StorageException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry {}, treating as miss", key, e);
            return Optional.empty();
        }
    }

    private void write(String key, Object value) {
        final String data;
        try {
            data = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize cache entry {}", key, e);
            return;
        }

        if (localCache != null) {
            localCache.put(key, value);
        }

        try {
            backgroundExecutor.execute(() -> {
                try {
                    storage.setWithTtl(key, data, config.getTtl());
                    log.debug("Cached {} for {}", key, config.getTtl());
                } catch (StorageException e) {
                    log.warn("Failed to cache {}: {}", key, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Background executor rejected cache write for {}", key);
        }
    }

    private void record(String kind, boolean hit) {
        meterRegistry.counter(hit ? "catalog.cache.hits" : "catalog.cache.misses", "kind", kind).increment();
    }
}
