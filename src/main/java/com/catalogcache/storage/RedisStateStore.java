package com.catalogcache.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Redis-backed state store shared by every service instance.
 * Handles connection pooling and retries for transient failures.
 */
@Slf4j
public class RedisStateStore implements StateStore {

    private final JedisPool jedisPool;
    private static final int MAX_RETRIES = 3;
    private static final long RETRY_DELAY_MS = 10;

    public RedisStateStore(String host, int port) {
        this(host, port, null, null);
    }

    public RedisStateStore(String host, int port, String username, String password) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(64);
        poolConfig.setMaxIdle(16);
        poolConfig.setMinIdle(4);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(2000));

        this.jedisPool = new JedisPool(poolConfig, host, port, Protocol.DEFAULT_TIMEOUT,
                blankToNull(username), blankToNull(password));
        log.info("Redis state store initialized: {}:{}", host, port);
    }

    @Override
    public String get(String key) {
        return executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                return jedis.get(key);
            }
        });
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.set(key, value, new SetParams().px(ttl.toMillis()));
                return null;
            }
        });
    }

    @Override
    public boolean compareAndSet(String key, String expect, String update) {
        return executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                // EXEC is discarded if anyone touches the key after WATCH
                jedis.watch(key);
                String current = jedis.get(key);

                if (!Objects.equals(current, expect)) {
                    jedis.unwatch();
                    return false;
                }

                var trans = jedis.multi();
                trans.set(key, update);
                var result = trans.exec();
                return result != null && !result.isEmpty();
            }
        });
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        return executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                var pipe = jedis.pipelined();
                var incrResp = pipe.incr(key);
                pipe.pexpire(key, ttl.toMillis());
                pipe.sync();

                return incrResp.get();
            }
        });
    }

    @Override
    public void listPush(String key, String value, int maxLength) {
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                var pipe = jedis.pipelined();
                pipe.lpush(key, value);
                pipe.ltrim(key, 0, maxLength - 1);
                pipe.sync();
                return null;
            }
        });
    }

    @Override
    public List<String> listRange(String key) {
        return executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                return jedis.lrange(key, 0, -1);
            }
        });
    }

    @Override
    public void expire(String key, Duration ttl) {
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.pexpire(key, ttl.toMillis());
                return null;
            }
        });
    }

    @Override
    public void delete(String... keys) {
        if (keys.length == 0) {
            return;
        }
        executeWithRetry(() -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.del(keys);
                return null;
            }
        });
    }

    @Override
    public boolean isAvailable() {
        try (var jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    /**
     * Simple retry wrapper for transient failures
     */
    private <T> T executeWithRetry(StorageOperation<T> operation) {
        Exception lastException = null;

        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return operation.execute();
            } catch (Exception e) {
                lastException = e;
                log.warn("Storage operation failed (attempt {}/{}): {}",
                        i + 1, MAX_RETRIES, e.getMessage());

                if (i < MAX_RETRIES - 1) {
                    try {
                        Thread.sleep(RETRY_DELAY_MS * (i + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }

        throw new StorageException("Operation failed after " + MAX_RETRIES + " retries", lastException);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @FunctionalInterface
    private interface StorageOperation<T> {
        T execute() throws Exception;
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
