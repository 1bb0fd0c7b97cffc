package com.catalogcache.service;

import com.catalogcache.cache.CatalogCache;
import com.catalogcache.core.RateLimitConfig;
import com.catalogcache.core.RateLimiter;
import com.catalogcache.metrics.MetricsAggregator;
import com.catalogcache.metrics.MetricsSnapshot;
import com.catalogcache.model.Product;
import com.catalogcache.model.ProductEdge;
import com.catalogcache.model.ProductPage;
import com.catalogcache.upstream.CatalogApi;
import com.catalogcache.upstream.CatalogQueries;
import com.catalogcache.upstream.UpstreamException;
import com.catalogcache.upstream.UpstreamResponse;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Read path for catalog products: cache first, then the upstream, inside the shared budget.
 *
 * <p>Budget handling is two-phase. Before a call the limiter is asked about a fixed
 * estimated cost and, if the bucket is short, the request waits for the refill.
 * The check is advisory: after the wait the call goes out regardless. Once the
 * response arrives the limiter is debited with the cost the upstream actually
 * charged, which can differ from the estimate in either direction.
 *
 * <p>Products that do not exist come back as an empty result. Upstream failures
 * (transport, non-2xx, GraphQL errors) surface as {@link UpstreamException}.
 */
@Slf4j
public class CatalogQueryService {

    static final String PRODUCT_ID_PREFIX = "gid://shopify/Product/";
    static final int MAX_PAGE_SIZE = 250;
    static final String SORT_KEY = "TITLE";

    private final CatalogApi catalogApi;
    private final CatalogCache cache;
    private final RateLimiter rateLimiter;
    private final MetricsAggregator metrics;
    private final RateLimitConfig rateLimitConfig;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Timer upstreamLatency;
    private final Counter upstreamErrors;
    private final Counter rateLimitWaits;

    public CatalogQueryService(
            CatalogApi catalogApi,
            CatalogCache cache,
            RateLimiter rateLimiter,
            MetricsAggregator metrics,
            RateLimitConfig rateLimitConfig,
            Clock clock,
            Sleeper sleeper,
            MeterRegistry meterRegistry) {

        this.catalogApi = catalogApi;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.rateLimitConfig = rateLimitConfig;
        this.clock = clock;
        this.sleeper = sleeper;

        this.upstreamLatency = Timer.builder("catalog.upstream.latency")
                .description("Upstream GraphQL call duration")
                .register(meterRegistry);

        this.upstreamErrors = Counter.builder("catalog.upstream.errors")
                .description("Upstream calls that failed")
                .register(meterRegistry);

        this.rateLimitWaits = Counter.builder("catalog.ratelimit.waits")
                .description("Requests delayed waiting for budget")
                .register(meterRegistry);
    }

    /**
     * Single product by id. Accepts both the bare numeric id and the canonical gid form.
     *
     * @return the product, or empty if the upstream does not know it
     * @throws UpstreamException if the upstream call fails
     */
    public Optional<Product> getProductById(String id) {
        String productId = normalizeId(id);
        log.info("Fetching product by ID: {}", productId);

        Optional<Product> cached = cache.getProduct(productId);
        if (cached.isPresent()) {
            log.debug("Returning product {} from cache", productId);
            return cached;
        }

        log.debug("Product {} not in cache, querying upstream", productId);
        JsonNode data = executeQuery(CatalogQueries.PRODUCT_BY_ID, Map.of("id", productId));

        JsonNode node = data.path("product");
        if (node.isMissingNode() || node.isNull()) {
            log.info("Product {} not found upstream", productId);
            return Optional.empty();
        }

        Product product = toProduct(node);
        cache.putProduct(productId, product);
        return Optional.of(product);
    }

    /**
     * One page of products sorted by title.
     *
     * @param limit  requested page size, clamped to [1, 250]
     * @param cursor cursor of the last edge already seen, null for the first page
     * @throws UpstreamException if the upstream call fails
     */
    public ProductPage listProducts(int limit, String cursor) {
        int first = Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
        String after = cursor == null || cursor.isBlank() ? null : cursor;

        Optional<ProductPage> cached = cache.getPage(after, first);
        if (cached.isPresent()) {
            log.debug("Returning products page from cache (cursor={})", after);
            return cached.get().limitTo(first);
        }

        Map<String, Object> variables = new HashMap<>();
        variables.put("first", first);
        variables.put("after", after);
        variables.put("sortKey", SORT_KEY);

        JsonNode products = executeQuery(CatalogQueries.PRODUCTS_PAGE, variables).path("products");
        if (!products.isObject()) {
            throw new UpstreamException("Upstream response has no products connection");
        }

        List<ProductEdge> edges = new ArrayList<>();
        for (JsonNode edge : products.path("edges")) {
            edges.add(new ProductEdge(edge.path("cursor").asText(), toProduct(edge.path("node"))));
        }
        ProductPage page = new ProductPage(edges, products.path("pageInfo").path("hasNextPage").asBoolean(false));

        cache.putPage(after, page);
        return page;
    }

    public MetricsSnapshot getMetricsSnapshot() {
        return metrics.getSnapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    public void recordEndpointCall(long responseTimeMs) {
        metrics.recordEndpointCall(responseTimeMs);
    }

    static String normalizeId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("product id must not be blank");
        }
        String trimmed = id.trim();
        return trimmed.startsWith("gid://") ? trimmed : PRODUCT_ID_PREFIX + trimmed;
    }

    /**
     * Run a query inside the budget and return its {@code data} member.
     * The elapsed time is recorded whatever the outcome.
     */
    private JsonNode executeQuery(String query, Map<String, Object> variables) {
        awaitBudget();

        log.debug("Sending GraphQL request upstream");
        long startTime = clock.millis();
        try {
            UpstreamResponse response = catalogApi.execute(query, variables);
            rateLimiter.consume(response.costOr(rateLimitConfig.getEstimatedQueryCost()));

            if (response.hasErrors()) {
                throw new UpstreamException("GraphQL Error: " + String.join("; ", response.errors()));
            }
            return response.data();
        } catch (UpstreamException e) {
            upstreamErrors.increment();
            throw e;
        } finally {
            long elapsed = clock.millis() - startTime;
            metrics.recordUpstreamCall(elapsed);
            upstreamLatency.record(elapsed, TimeUnit.MILLISECONDS);
        }
    }

    private void awaitBudget() {
        int estimatedCost = rateLimitConfig.getEstimatedQueryCost();
        if (rateLimiter.canExecute(estimatedCost)) {
            return;
        }

        long waitMs = Math.min(rateLimiter.getWaitTimeMs(estimatedCost), rateLimitConfig.getMaxWait().toMillis());
        if (waitMs <= 0) {
            return;
        }

        rateLimitWaits.increment();
        log.warn("Rate limit: waiting {}ms", waitMs);
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while waiting for rate limit budget", e);
        }
    }

    private static Product toProduct(JsonNode node) {
        JsonNode amount = node.path("priceRange").path("minVariantPrice").path("amount");
        return new Product(
                text(node.path("id")),
                text(node.path("title")),
                amount.isValueNode() && !amount.isNull() ? amount.asText() : "0",
                node.path("totalInventory").asInt(0),
                text(node.path("createdAt"))
        );
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
