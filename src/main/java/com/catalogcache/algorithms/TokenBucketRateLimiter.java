package com.catalogcache.algorithms;

import com.catalogcache.core.RateLimitConfig;
import com.catalogcache.core.RateLimitState;
import com.catalogcache.core.RateLimiter;
import com.catalogcache.storage.StateStore;
import com.catalogcache.storage.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Token Bucket over the upstream's query-cost budget.
 *
 * Points refill continuously at {@code refillRate} up to {@code maxPoints}.
 * There is no background timer: every read computes the refill lazily from the
 * time elapsed since the persisted {@code lastRefillTime} and writes the result back.
 *
 * The bucket lives in the shared state store so every service instance draws
 * from the same budget. Each read-modify-write is committed with
 * {@link StateStore#compareAndSet}, and a writer that loses the race re-reads
 * and retries. Once the attempts run out the update is dropped.
 *
 * Storage failures never block callers: the limiter fails open and reports
 * a full bucket.
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    static final String STATE_KEY = "ratelimiter:state";

    private final StateStore storage;
    private final RateLimitConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor backgroundExecutor;

    private final Counter allowedChecks;
    private final Counter deferredChecks;
    private final Counter failOpen;
    private final Counter droppedUpdates;

    public TokenBucketRateLimiter(
            StateStore storage,
            RateLimitConfig config,
            ObjectMapper objectMapper,
            Clock clock,
            Executor backgroundExecutor,
            MeterRegistry meterRegistry) {

        config.validate();

        this.storage = storage;
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.backgroundExecutor = backgroundExecutor;

        this.allowedChecks = Counter.builder("catalog.ratelimit.checks")
                .description("Budget checks that found enough points")
                .tag("outcome", "allowed")
                .register(meterRegistry);

        this.deferredChecks = Counter.builder("catalog.ratelimit.checks")
                .description("Budget checks that found too few points")
                .tag("outcome", "deferred")
                .register(meterRegistry);

        this.failOpen = Counter.builder("catalog.ratelimit.fail_open")
                .description("Budget operations answered without the state store")
                .register(meterRegistry);

        this.droppedUpdates = Counter.builder("catalog.ratelimit.dropped_updates")
                .description("Bucket writes abandoned after losing every compare-and-set")
                .register(meterRegistry);

        log.info("TokenBucket initialized: capacity={}, refillRate={}/sec",
                config.getMaxPoints(), config.getRefillRate());
    }

    @Override
    public boolean canExecute(int cost) {
        requirePositive(cost);

        double available = refillBucket();
        log.debug("Budget check: cost={}, available={}", cost, available);

        boolean allowed = available >= cost;
        if (allowed) {
            allowedChecks.increment();
        } else {
            deferredChecks.increment();
        }
        return allowed;
    }

    @Override
    public void consume(double cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost cannot be negative");
        }
        if (cost == 0) {
            return;
        }

        try {
            backgroundExecutor.execute(() -> debit(cost));
        } catch (RejectedExecutionException e) {
            droppedUpdates.increment();
            log.warn("Background executor rejected debit of {} points; dropping it", cost);
        }
    }

    @Override
    public long getWaitTimeMs(int cost) {
        requirePositive(cost);

        double available = refillBucket();
        if (available >= cost) {
            return 0;
        }

        double pointsNeeded = cost - available;
        double secondsToWait = pointsNeeded / config.getRefillRate();
        return (long) Math.ceil(secondsToWait * 1000);
    }

    @Override
    public void reset() {
        try {
            storage.delete(STATE_KEY);
            log.debug("Reset token bucket");
        } catch (StorageException e) {
            log.warn("Failed to reset token bucket", e);
        }
    }

    /**
     * Bring the persisted bucket up to date and return the points available now.
     */
    double refillBucket() {
        double available = config.getMaxPoints();
        try {
            for (int attempt = 1; attempt <= config.getMaxUpdateAttempts(); attempt++) {
                long now = clock.millis();
                String raw = storage.get(STATE_KEY);
                RateLimitState state = readState(raw, now);

                // Instances with skewed clocks must not move lastRefillTime backwards
                long refillTime = Math.max(now, state.lastRefillTime());
                double elapsedSeconds = (refillTime - state.lastRefillTime()) / 1000.0;
                double pointsToAdd = elapsedSeconds * config.getRefillRate();
                available = Math.min(config.getMaxPoints(), state.points() + pointsToAdd);

                log.trace("Refill: stored={}, elapsed={}s, available={}", state.points(), elapsedSeconds, available);

                if (storage.compareAndSet(STATE_KEY, raw, writeState(new RateLimitState(available, refillTime)))) {
                    return available;
                }
                log.debug("Bucket refill lost a race (attempt {}/{})", attempt, config.getMaxUpdateAttempts());
            }
        } catch (StorageException e) {
            failOpen.increment();
            log.warn("Rate limit state unavailable, failing open: {}", e.getMessage());
            return config.getMaxPoints();
        }

        droppedUpdates.increment();
        log.warn("Bucket refill not persisted after {} attempts", config.getMaxUpdateAttempts());
        return available;
    }

    private void debit(double cost) {
        try {
            for (int attempt = 1; attempt <= config.getMaxUpdateAttempts(); attempt++) {
                String raw = storage.get(STATE_KEY);
                RateLimitState state = readState(raw, clock.millis());
                RateLimitState updated = state.withPoints(Math.max(0, state.points() - cost));

                if (storage.compareAndSet(STATE_KEY, raw, writeState(updated))) {
                    log.debug("Consumed {} points, {} left", cost, updated.points());
                    return;
                }
            }
            droppedUpdates.increment();
            log.warn("Debit of {} points not persisted after {} attempts", cost, config.getMaxUpdateAttempts());
        } catch (StorageException e) {
            failOpen.increment();
            log.warn("Rate limit state unavailable, debit of {} points dropped: {}", cost, e.getMessage());
        }
    }

    private RateLimitState readState(String raw, long nowMs) {
        if (raw == null) {
            return RateLimitState.full(config.getMaxPoints(), nowMs);
        }
        try {
            RateLimitState state = objectMapper.readValue(raw, RateLimitState.class);
            double points = Math.max(0, Math.min(config.getMaxPoints(), state.points()));
            return state.withPoints(points);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable rate limit state '{}', starting from a full bucket", raw);
            return RateLimitState.full(config.getMaxPoints(), nowMs);
        }
    }

    private String writeState(RateLimitState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rate limit state", e);
        }
    }

    private static void requirePositive(int cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive");
        }
    }
}
