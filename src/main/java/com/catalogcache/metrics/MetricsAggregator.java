package com.catalogcache.metrics;

import com.catalogcache.storage.StateStore;
import com.catalogcache.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Rolling latency and call-count tracker kept in the shared state store.
 *
 * Each window is a list of samples plus a call counter. Both keys get the same
 * TTL, re-armed on every write, so a window that sees no traffic for a whole
 * retention period disappears on its own. Under steady traffic the TTL never
 * fires, so the sample list is capped at the newest {@code maxSamples} entries.
 * Latency stats cover those samples while the call counter stays exact.
 *
 * Recording is fire-and-forget and at-most-once. Reads fail open with a zeroed snapshot.
 */
@Slf4j
public class MetricsAggregator {

    public static final int DEFAULT_MAX_SAMPLES = 10_000;

    private final StateStore storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor backgroundExecutor;
    private final Duration retention;
    private final int maxSamples;

    public MetricsAggregator(
            StateStore storage,
            ObjectMapper objectMapper,
            Clock clock,
            Executor backgroundExecutor,
            Duration retention) {
        this(storage, objectMapper, clock, backgroundExecutor, retention, DEFAULT_MAX_SAMPLES);
    }

    public MetricsAggregator(
            StateStore storage,
            ObjectMapper objectMapper,
            Clock clock,
            Executor backgroundExecutor,
            Duration retention,
            int maxSamples) {

        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be a positive duration");
        }
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.backgroundExecutor = backgroundExecutor;
        this.retention = retention;
        this.maxSamples = maxSamples;
    }

    /**
     * Record the wall time of one inbound request.
     */
    public void recordEndpointCall(long responseTimeMs) {
        submit(Window.ENDPOINT, responseTimeMs);
    }

    /**
     * Record the wall time of one upstream query, successful or not.
     */
    public void recordUpstreamCall(long responseTimeMs) {
        submit(Window.UPSTREAM, responseTimeMs);
    }

    public MetricsSnapshot getSnapshot() {
        try {
            return new MetricsSnapshot(read(Window.ENDPOINT), read(Window.UPSTREAM));
        } catch (StorageException e) {
            log.warn("Failed to get metrics: {}", e.getMessage());
            return MetricsSnapshot.empty();
        } catch (JsonProcessingException | NumberFormatException e) {
            log.warn("Corrupt metrics data, reporting zeros", e);
            return MetricsSnapshot.empty();
        }
    }

    public void reset() {
        try {
            storage.delete(
                    Window.ENDPOINT.timesKey(), Window.ENDPOINT.callsKey(),
                    Window.UPSTREAM.timesKey(), Window.UPSTREAM.callsKey());
            log.info("Metrics reset");
        } catch (StorageException e) {
            log.warn("Failed to reset metrics: {}", e.getMessage());
        }
    }

    private void submit(Window window, long responseTimeMs) {
        MetricSample sample = new MetricSample(responseTimeMs, clock.millis());
        try {
            backgroundExecutor.execute(() -> append(window, sample));
        } catch (RejectedExecutionException e) {
            log.warn("Background executor rejected {} metric sample", window.label);
        }
    }

    private void append(Window window, MetricSample sample) {
        try {
            storage.listPush(window.timesKey(), objectMapper.writeValueAsString(sample), maxSamples);
            storage.expire(window.timesKey(), retention);
            storage.incrementAndExpire(window.callsKey(), retention);
        } catch (StorageException | JsonProcessingException e) {
            log.warn("Failed to record {} metric: {}", window.label, e.getMessage());
        }
    }

    private MetricsSnapshot.WindowStats read(Window window) throws JsonProcessingException {
        List<String> raw = storage.listRange(window.timesKey());
        List<Long> times = new ArrayList<>(raw.size());
        for (String entry : raw) {
            times.add(objectMapper.readValue(entry, MetricSample.class).responseTimeMs());
        }

        String calls = storage.get(window.callsKey());
        long totalCalls = calls == null ? 0 : Long.parseLong(calls);

        return MetricsSnapshot.WindowStats.of(times, totalCalls);
    }

    private enum Window {
        ENDPOINT("endpoint"),
        UPSTREAM("upstream");

        private final String label;

        Window(String label) {
            this.label = label;
        }

        String timesKey() {
            return "metrics:" + label + ":times";
        }

        String callsKey() {
            return "metrics:" + label + ":calls";
        }
    }
}
