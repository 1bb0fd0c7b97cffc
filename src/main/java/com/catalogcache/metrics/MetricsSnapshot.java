package com.catalogcache.metrics;

import java.util.List;

/**
 * Point-in-time view of both rolling windows. Derived on every read, never stored.
 */
public record MetricsSnapshot(WindowStats endpoint, WindowStats upstream) {

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(WindowStats.EMPTY, WindowStats.EMPTY);
    }

    /**
     * Aggregates over the samples still retained in one window.
     * {@code totalCalls} comes from the window's counter, not from the sample count.
     */
    public record WindowStats(long average, long max, long min, long totalCalls) {

        public static final WindowStats EMPTY = new WindowStats(0, 0, 0, 0);

        static WindowStats of(List<Long> responseTimes, long totalCalls) {
            if (responseTimes.isEmpty()) {
                return new WindowStats(0, 0, 0, totalCalls);
            }
            var stats = responseTimes.stream().mapToLong(Long::longValue).summaryStatistics();
            return new WindowStats(Math.round(stats.getAverage()), stats.getMax(), stats.getMin(), totalCalls);
        }
    }
}
