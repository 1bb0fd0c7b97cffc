package com.catalogcache.algorithms;

import com.catalogcache.core.RateLimitConfig;
import com.catalogcache.core.RateLimitState;
import com.catalogcache.storage.StateStore;
import com.catalogcache.support.InMemoryStateStore;
import com.catalogcache.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for TokenBucketRateLimiter
 * Covers lazy refill, wait times, settlement and fail-open behaviour
 */
class TokenBucketRateLimiterTest {

    private static final long T0 = 1_700_000_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private InMemoryStateStore storage;
    private SimpleMeterRegistry meterRegistry;
    private TokenBucketRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        storage = new InMemoryStateStore(clock);
        meterRegistry = new SimpleMeterRegistry();

        // Runnable::run keeps fire-and-forget debits synchronous for assertions
        rateLimiter = new TokenBucketRateLimiter(
                storage, RateLimitConfig.standard(), objectMapper, clock, Runnable::run, meterRegistry);
    }

    @Test
    @DisplayName("Should start with a full bucket")
    void shouldStartFull() throws Exception {
        assertTrue(rateLimiter.canExecute(1));
        assertTrue(rateLimiter.canExecute(1000));

        RateLimitState state = storedState();
        assertEquals(1000.0, state.points());
        assertEquals(T0, state.lastRefillTime());
    }

    @Test
    @DisplayName("Should refill at 50 points/sec and cap at capacity")
    void shouldRefillAndCap() throws Exception {
        seed(new RateLimitState(0, T0));

        clock.advance(Duration.ofSeconds(2));
        assertEquals(100.0, rateLimiter.refillBucket(), 1e-9);

        clock.advance(Duration.ofSeconds(18));
        assertEquals(1000.0, rateLimiter.refillBucket(), 1e-9);

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1000.0, rateLimiter.refillBucket(), 1e-9);
        assertEquals(T0 + 50_000, storedState().lastRefillTime());
    }

    @Test
    @DisplayName("Should compute wait time from the missing points")
    void shouldComputeWaitTime() throws Exception {
        seed(new RateLimitState(100, T0));

        assertEquals(1000, rateLimiter.getWaitTimeMs(150));
        assertEquals(0, rateLimiter.getWaitTimeMs(100));
        assertEquals(0, rateLimiter.getWaitTimeMs(50));
    }

    @Test
    @DisplayName("Should round partial milliseconds of wait up")
    void shouldRoundWaitUp() throws Exception {
        seed(new RateLimitState(99.99, T0));

        assertEquals(1, rateLimiter.getWaitTimeMs(100));
    }

    @Test
    @DisplayName("Should defer when the bucket is short")
    void shouldDeferWhenShort() throws Exception {
        seed(new RateLimitState(5, T0));

        assertFalse(rateLimiter.canExecute(10));

        clock.advance(Duration.ofMillis(100));
        assertTrue(rateLimiter.canExecute(10));
    }

    @Test
    @DisplayName("Should debit actual cost and keep the refill timestamp")
    void shouldConsume() throws Exception {
        assertTrue(rateLimiter.canExecute(10));

        rateLimiter.consume(152.5);

        RateLimitState state = storedState();
        assertEquals(847.5, state.points(), 1e-9);
        assertEquals(T0, state.lastRefillTime());
    }

    @Test
    @DisplayName("Should never debit below zero")
    void shouldClampAtZero() throws Exception {
        seed(new RateLimitState(20, T0));

        rateLimiter.consume(50);

        assertEquals(0.0, storedState().points());
    }

    @Test
    @DisplayName("Should fail open when the store is down")
    void shouldFailOpen() {
        storage.setAvailable(false);

        assertTrue(rateLimiter.canExecute(1000));
        assertEquals(0, rateLimiter.getWaitTimeMs(1000));
        assertDoesNotThrow(() -> rateLimiter.consume(10));
        assertDoesNotThrow(() -> rateLimiter.reset());
        assertTrue(meterRegistry.counter("catalog.ratelimit.fail_open").count() >= 3);
    }

    @Test
    @DisplayName("Should retry the refill when another writer wins the race")
    void shouldRetryOnConflict() {
        StateStore contended = mock(StateStore.class);
        when(contended.get(anyString())).thenReturn(null);
        when(contended.compareAndSet(anyString(), isNull(), anyString())).thenReturn(false, true);

        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(
                contended, RateLimitConfig.standard(), objectMapper, clock, Runnable::run, meterRegistry);

        assertTrue(limiter.canExecute(10));
        verify(contended, times(2)).compareAndSet(eq(TokenBucketRateLimiter.STATE_KEY), isNull(), anyString());
    }

    @Test
    @DisplayName("Should give up after the configured attempts without blocking")
    void shouldGiveUpAfterAttempts() {
        StateStore contended = mock(StateStore.class);
        when(contended.get(anyString())).thenReturn(null);
        when(contended.compareAndSet(anyString(), any(), anyString())).thenReturn(false);

        RateLimitConfig config = RateLimitConfig.builder().maxUpdateAttempts(3).build();
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(
                contended, config, objectMapper, clock, Runnable::run, meterRegistry);

        assertTrue(limiter.canExecute(10));
        verify(contended, times(3)).compareAndSet(anyString(), any(), anyString());
        assertEquals(1.0, meterRegistry.counter("catalog.ratelimit.dropped_updates").count());
    }

    @Test
    @DisplayName("Should not move the refill time backwards on clock skew")
    void shouldTolerateClockSkew() throws Exception {
        seed(new RateLimitState(500, T0 + 5_000));

        assertEquals(500.0, rateLimiter.refillBucket(), 1e-9);
        assertEquals(T0 + 5_000, storedState().lastRefillTime());
    }

    @Test
    @DisplayName("Should start over from a full bucket after reset")
    void shouldReset() throws Exception {
        seed(new RateLimitState(0, T0));

        rateLimiter.reset();

        assertNull(storage.get(TokenBucketRateLimiter.STATE_KEY));
        assertTrue(rateLimiter.canExecute(1000));
    }

    @Test
    @DisplayName("Should reject invalid costs")
    void shouldRejectInvalidCosts() {
        assertThrows(IllegalArgumentException.class, () -> rateLimiter.canExecute(0));
        assertThrows(IllegalArgumentException.class, () -> rateLimiter.getWaitTimeMs(-1));
        assertThrows(IllegalArgumentException.class, () -> rateLimiter.consume(-5));
    }

    @Test
    @DisplayName("Should validate configuration")
    void shouldValidateConfiguration() {
        assertThrows(IllegalArgumentException.class, () ->
                RateLimitConfig.builder().refillRate(0).build().validate());

        assertThrows(IllegalArgumentException.class, () ->
                RateLimitConfig.builder().maxPoints(5).estimatedQueryCost(10).build().validate());
    }

    private void seed(RateLimitState state) throws Exception {
        storage.seed(TokenBucketRateLimiter.STATE_KEY, objectMapper.writeValueAsString(state));
    }

    private RateLimitState storedState() throws Exception {
        return objectMapper.readValue(storage.get(TokenBucketRateLimiter.STATE_KEY), RateLimitState.class);
    }
}
