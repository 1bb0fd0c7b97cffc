package com.catalogcache.metrics;

/**
 * One timed call: how long it took and when it finished (epoch millis).
 */
public record MetricSample(long responseTimeMs, long timestamp) {}
