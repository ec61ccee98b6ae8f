package com.sitelens.crawl.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Redis-backed {@link CrawlCache} shared across processes.
 *
 * Keys are stored under "{prefix}{key}". {@link #update} is an optimistic
 * WATCH / MULTI / EXEC loop, so concurrent writers of one key retry instead of overwriting
 * each other.
 */
public class RedisCrawlCache implements CrawlCache {
    private static final Logger log = LoggerFactory.getLogger(RedisCrawlCache.class);
    private static final int MAX_UPDATE_ATTEMPTS = 50;

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    public RedisCrawlCache(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redis = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(redisKey(key)));
        } catch (DataAccessException e) {
            throw new CrawlCacheException("redis get failed key=" + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redis.opsForValue().set(redisKey(key), value);
            } else {
                redis.opsForValue().set(redisKey(key), value, ttl);
            }
        } catch (DataAccessException e) {
            throw new CrawlCacheException("redis set failed key=" + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redis.delete(redisKey(key)));
        } catch (DataAccessException e) {
            throw new CrawlCacheException("redis delete failed key=" + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redis.hasKey(redisKey(key)));
        } catch (DataAccessException e) {
            throw new CrawlCacheException("redis exists failed key=" + key, e);
        }
    }

    @Override
    public String update(String key, Duration ttl, UnaryOperator<String> updater) {
        String redisKey = redisKey(key);
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            AtomicReference<String> written = new AtomicReference<>();
            List<Object> committed;
            try {
                committed = redis.execute(new SessionCallback<List<Object>>() {
                    @Override
                    public <K, V> List<Object> execute(RedisOperations<K, V> session) throws DataAccessException {
                        // the session belongs to a StringRedisTemplate
                        @SuppressWarnings("unchecked")
                        RedisOperations<String, String> operations = (RedisOperations<String, String>) session;
                        operations.watch(redisKey);
                        String current = operations.opsForValue().get(redisKey);
                        String next = updater.apply(current);
                        written.set(next);
                        operations.multi();
                        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                            operations.opsForValue().set(redisKey, next);
                        } else {
                            operations.opsForValue().set(redisKey, next, ttl);
                        }
                        return operations.exec();
                    }
                });
            } catch (DataAccessException e) {
                throw new CrawlCacheException("redis update failed key=" + key, e);
            }
            if (committed != null && !committed.isEmpty()) {
                return written.get();
            }
            log.debug("redis update conflict key={} attempt={}", key, attempt);
        }
        throw new CrawlCacheException("redis update gave up after " + MAX_UPDATE_ATTEMPTS + " conflicts key=" + key);
    }

    @Override
    public boolean isAvailable() {
        if (redis.getConnectionFactory() == null) {
            return false;
        }
        try (RedisConnection connection = redis.getConnectionFactory().getConnection()) {
            return connection.ping() != null;
        } catch (Exception e) {
            log.warn("redis ping failed error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public String type() {
        return "redis";
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }
}
