package com.catalogcache.metrics;

import com.catalogcache.support.InMemoryStateStore;
import com.catalogcache.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsAggregatorTest {

    private MutableClock clock;
    private InMemoryStateStore storage;
    private MetricsAggregator metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        storage = new InMemoryStateStore(clock);
        metrics = new MetricsAggregator(storage, new ObjectMapper(), clock, Runnable::run, Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should aggregate endpoint samples")
    void shouldAggregateEndpointSamples() {
        metrics.recordEndpointCall(100);
        metrics.recordEndpointCall(200);
        metrics.recordEndpointCall(300);

        MetricsSnapshot.WindowStats endpoint = metrics.getSnapshot().endpoint();
        assertEquals(200, endpoint.average());
        assertEquals(300, endpoint.max());
        assertEquals(100, endpoint.min());
        assertEquals(3, endpoint.totalCalls());
    }

    @Test
    @DisplayName("Should keep the two windows apart")
    void shouldSeparateWindows() {
        metrics.recordEndpointCall(50);
        metrics.recordUpstreamCall(401);
        metrics.recordUpstreamCall(400);

        MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(1, snapshot.endpoint().totalCalls());
        assertEquals(2, snapshot.upstream().totalCalls());
        assertEquals(401, snapshot.upstream().average()); // 400.5 rounds half up
    }

    @Test
    @DisplayName("Should report zeros for an empty window")
    void shouldReportZerosWhenEmpty() {
        assertEquals(MetricsSnapshot.empty(), metrics.getSnapshot());
    }

    @Test
    @DisplayName("Should clear both windows on reset")
    void shouldReset() {
        metrics.recordEndpointCall(100);
        metrics.recordUpstreamCall(100);

        metrics.reset();

        assertEquals(MetricsSnapshot.empty(), metrics.getSnapshot());
    }

    @Test
    @DisplayName("Should let an idle window expire as a whole")
    void shouldExpireIdleWindow() {
        metrics.recordEndpointCall(100);
        clock.advance(Duration.ofMinutes(59));
        metrics.recordEndpointCall(300);

        // second write re-armed the TTL for samples and counter together
        clock.advance(Duration.ofMinutes(59));
        assertEquals(2, metrics.getSnapshot().endpoint().totalCalls());
        assertEquals(200, metrics.getSnapshot().endpoint().average());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(MetricsSnapshot.empty(), metrics.getSnapshot());
    }

    @Test
    @DisplayName("Should fail open when the store is down")
    void shouldFailOpen() {
        metrics.recordEndpointCall(100);
        storage.setAvailable(false);

        assertDoesNotThrow(() -> metrics.recordEndpointCall(100));
        assertDoesNotThrow(() -> metrics.reset());
        assertEquals(MetricsSnapshot.empty(), metrics.getSnapshot());
    }

    @Test
    @DisplayName("Should report zeros when stored samples are corrupt")
    void shouldFailOpenOnCorruptSamples() {
        storage.listPush("metrics:endpoint:times", "garbage", 10);

        assertEquals(MetricsSnapshot.empty(), metrics.getSnapshot());
    }

    @Test
    @DisplayName("Should keep only the newest samples while counting every call")
    void shouldCapSampleList() {
        MetricsAggregator capped = new MetricsAggregator(storage, new ObjectMapper(), clock, Runnable::run,
                Duration.ofHours(1), 3);

        capped.recordEndpointCall(1000);
        capped.recordEndpointCall(2000);
        capped.recordEndpointCall(100);
        capped.recordEndpointCall(200);
        capped.recordEndpointCall(300);

        MetricsSnapshot.WindowStats endpoint = capped.getSnapshot().endpoint();
        assertEquals(3, storage.listRange("metrics:endpoint:times").size());
        assertEquals(200, endpoint.average());
        assertEquals(300, endpoint.max());
        assertEquals(100, endpoint.min());
        assertEquals(5, endpoint.totalCalls());
    }

    @Test
    @DisplayName("Should reject a non-positive sample cap")
    void shouldRejectInvalidSampleCap() {
        assertThrows(IllegalArgumentException.class, () -> new MetricsAggregator(
                storage, new ObjectMapper(), clock, Runnable::run, Duration.ofHours(1), 0));
    }
}
