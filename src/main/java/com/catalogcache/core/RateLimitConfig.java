package com.catalogcache.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the shared upstream query budget.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class RateLimitConfig {

    /**
     * Bucket capacity in cost points
     */
    @Builder.Default
    double maxPoints = 1000;

    /**
     * Points restored per second
     */
    @Builder.Default
    double refillRate = 50;

    /**
     * Cost assumed for a query before the upstream reports the real one
     */
    @Builder.Default
    int estimatedQueryCost = 10;

    /**
     * Upper bound on a single advisory wait before an upstream call
     */
    @Builder.Default
    Duration maxWait = Duration.ofSeconds(20);

    /**
     * How many times a read-modify-write of the bucket is retried after losing a race
     */
    @Builder.Default
    int maxUpdateAttempts = 5;

    public void validate() {
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive");
        }
        if (estimatedQueryCost <= 0 || estimatedQueryCost > maxPoints) {
            throw new IllegalArgumentException("estimatedQueryCost must be in (0, maxPoints]");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be negative");
        }
        if (maxUpdateAttempts <= 0) {
            throw new IllegalArgumentException("maxUpdateAttempts must be positive");
        }
    }

    /**
     * Standard budget of the upstream admin API: 1000 points, 50 points/sec
     */
    public static RateLimitConfig standard() {
        return RateLimitConfig.builder().build();
    }
}
