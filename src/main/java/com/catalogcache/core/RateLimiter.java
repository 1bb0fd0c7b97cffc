package com.catalogcache.core;

/**
 * Gate for expensive upstream operations against a budget shared by all instances.
 *
 * <p>The protocol is two-phase: callers check (and maybe wait) with an estimated
 * cost before the call, then settle with the actual cost once it is known.
 */
public interface RateLimiter {

    /**
     * Refill the bucket and check whether {@code cost} points are available.
     * Returns immediately without blocking.
     *
     * @param cost estimated cost in points
     * @return true if the budget currently covers the cost
     */
    boolean canExecute(int cost);

    /**
     * Debit points after a call completed.
     * Fire-and-forget: the caller does not wait for the write to land.
     *
     * @param cost actual cost reported by the upstream
     */
    void consume(double cost);

    /**
     * Milliseconds until {@code cost} points will be available, 0 if they already are.
     */
    long getWaitTimeMs(int cost);

    /**
     * Drop the persisted bucket so the next read starts full.
     * Use carefully - mainly for testing or admin overrides.
     */
    void reset();
}
