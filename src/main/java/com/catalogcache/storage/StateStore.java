package com.catalogcache.storage;

import java.time.Duration;
import java.util.List;

/**
 * Abstraction over the shared key-value store (Redis today).
 * The cache, the rate limiter and the metrics aggregator only depend on this
 * minimal operation set, so the backend can be swapped without touching them.
 *
 * <p>Every operation may throw {@link StorageException} when the backend is
 * unreachable. Callers decide whether to absorb it.
 */
public interface StateStore {

    /**
     * Get the raw value stored under a key.
     *
     * @return stored value, or null if the key is absent or expired
     */
    String get(String key);

    /**
     * Set a value that expires after the given TTL
     */
    void setWithTtl(String key, String value, Duration ttl);

    /**
     * Atomic compare-and-set on the raw value.
     * A null {@code expect} means "only if the key is absent".
     *
     * @return true if the value was updated, false if another writer got there first
     */
    boolean compareAndSet(String key, String expect, String update);

    /**
     * Increment a counter and (re)arm its TTL in one round trip.
     *
     * @return new value after increment
     */
    long incrementAndExpire(String key, Duration ttl);

    /**
     * Push a value onto the head of a list, keeping only the newest {@code maxLength} entries.
     */
    void listPush(String key, String value, int maxLength);

    /**
     * Full contents of a list, head first. Empty if the key is absent.
     */
    List<String> listRange(String key);

    /**
     * Set a TTL on an existing key
     */
    void expire(String key, Duration ttl);

    /**
     * Delete one or more keys
     */
    void delete(String... keys);

    /**
     * Health check
     */
    boolean isAvailable();
}
