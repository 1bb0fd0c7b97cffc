package com.catalogcache.core;

/**
 * Persisted bucket: available points and when they were last topped up (epoch millis).
 */
public record RateLimitState(double points, long lastRefillTime) {

    public static RateLimitState full(double maxPoints, long nowMs) {
        return new RateLimitState(maxPoints, nowMs);
    }

    public RateLimitState withPoints(double newPoints) {
        return new RateLimitState(newPoints, lastRefillTime);
    }
}
