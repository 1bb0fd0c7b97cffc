package com.catalogcache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the product cache.
 */
@Value
@Builder
public class CacheConfig {

    /**
     * Lifetime of cached products and pages in the shared store
     */
    @Builder.Default
    Duration ttl = Duration.ofMinutes(5);

    /**
     * Keep a small in-process copy in front of the shared store.
     * Trades a little extra staleness for fewer Redis round trips.
     */
    @Builder.Default
    boolean enableLocalCache = true;

    @Builder.Default
    Duration localCacheTtl = Duration.ofMillis(100);

    @Builder.Default
    long localCacheMaxSize = 10_000;

    public void validate() {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        if (enableLocalCache && (localCacheTtl == null || localCacheTtl.isNegative() || localCacheTtl.isZero())) {
            throw new IllegalArgumentException("localCacheTtl must be a positive duration");
        }
    }
}
