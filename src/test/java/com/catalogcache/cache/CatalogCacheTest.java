package com.catalogcache.cache;

import com.catalogcache.core.CacheConfig;
import com.catalogcache.model.Product;
import com.catalogcache.model.ProductEdge;
import com.catalogcache.model.ProductPage;
import com.catalogcache.support.InMemoryStateStore;
import com.catalogcache.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class CatalogCacheTest {

    private MutableClock clock;
    private InMemoryStateStore storage;
    private SimpleMeterRegistry meterRegistry;
    private CatalogCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        storage = new InMemoryStateStore(clock);
        meterRegistry = new SimpleMeterRegistry();

        CacheConfig config = CacheConfig.builder()
                .enableLocalCache(false) // Shared store only, for predictable testing
                .build();
        cache = new CatalogCache(storage, config, new ObjectMapper(), Runnable::run, meterRegistry);
    }

    @Test
    @DisplayName("Should round-trip a product under its id key with a 300s TTL")
    void shouldCacheProduct() {
        Product product = product(1);

        cache.putProduct(product.id(), product);

        assertEquals(Optional.of(product), cache.getProduct(product.id()));
        assertEquals(Duration.ofSeconds(300), storage.ttl("product:" + product.id()));
    }

    @Test
    @DisplayName("Should miss once the TTL has passed")
    void shouldExpire() {
        Product product = product(1);
        cache.putProduct(product.id(), product);

        clock.advance(Duration.ofSeconds(301));

        assertTrue(cache.getProduct(product.id()).isEmpty());
    }

    @Test
    @DisplayName("Should key the first page as 'start'")
    void shouldKeyFirstPage() {
        cache.putPage(null, page(3, true));

        assertTrue(storage.contains("products:list:start"));
        assertTrue(cache.getPage("", 3).isPresent());
    }

    @Test
    @DisplayName("Should treat a page shorter than the request as a miss")
    void shouldRejectShortPage() {
        cache.putPage("abc", page(5, true));

        assertTrue(cache.getPage("abc", 10).isEmpty());
        assertTrue(cache.getPage("abc", 5).isPresent());
        assertTrue(cache.getPage("abc", 3).isPresent());
        assertEquals(1.0, meterRegistry.counter("catalog.cache.misses", "kind", "page").count());
    }

    @Test
    @DisplayName("Should report a miss when the store is down")
    void shouldMissWhenStoreDown() {
        cache.putProduct("gid://shopify/Product/1", product(1));
        storage.setAvailable(false);

        assertTrue(cache.getProduct("gid://shopify/Product/1").isEmpty());
        assertTrue(cache.getPage(null, 1).isEmpty());
    }

    @Test
    @DisplayName("Should swallow write failures")
    void shouldSwallowWriteFailures() {
        storage.setAvailable(false);

        assertDoesNotThrow(() -> cache.putProduct("gid://shopify/Product/1", product(1)));
        assertDoesNotThrow(() -> cache.putPage(null, page(2, false)));
    }

    @Test
    @DisplayName("Should treat a corrupt entry as a miss")
    void shouldMissOnCorruptEntry() {
        storage.seed("product:gid://shopify/Product/9", "{not json");

        assertTrue(cache.getProduct("gid://shopify/Product/9").isEmpty());
    }

    @Test
    @DisplayName("Should serve from the local cache without touching the store")
    void shouldServeFromLocalCache() {
        CacheConfig config = CacheConfig.builder()
                .enableLocalCache(true)
                .localCacheTtl(Duration.ofMinutes(1))
                .build();
        CatalogCache nearCache = new CatalogCache(storage, config, new ObjectMapper(), Runnable::run, meterRegistry);

        Product product = product(7);
        nearCache.putProduct(product.id(), product);
        storage.setAvailable(false);

        assertEquals(Optional.of(product), nearCache.getProduct(product.id()));
        assertTrue(nearCache.getPage(null, 1).isEmpty());
    }

    @Test
    @DisplayName("Should not wait for the shared store write")
    void shouldWriteInBackground() {
        List<Runnable> pending = new ArrayList<>();
        Executor deferred = pending::add;
        CatalogCache deferredCache = new CatalogCache(
                storage, CacheConfig.builder().enableLocalCache(false).build(),
                new ObjectMapper(), deferred, meterRegistry);

        deferredCache.putProduct("gid://shopify/Product/1", product(1));
        assertFalse(storage.contains("product:gid://shopify/Product/1"));

        pending.forEach(Runnable::run);
        assertTrue(storage.contains("product:gid://shopify/Product/1"));
    }

    static Product product(int n) {
        return new Product("gid://shopify/Product/" + n, "Product " + n, n + ".00", n * 10, "2024-01-0" + (n % 9 + 1) + "T00:00:00Z");
    }

    static ProductPage page(int size, boolean hasNextPage) {
        List<ProductEdge> edges = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            edges.add(new ProductEdge("cursor-" + i, product(i)));
        }
        return new ProductPage(edges, hasNextPage);
    }
}
