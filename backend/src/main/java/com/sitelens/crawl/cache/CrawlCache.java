package com.sitelens.crawl.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * TTL key-value store shared by every crawl task, and by every process when backed by Redis.
 *
 * Values are opaque strings; callers serialize their own state. Implementations throw
 * {@link CrawlCacheException} when the backing store cannot be reached.
 */
public interface CrawlCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Atomically replaces the value stored under {@code key}.
     *
     * The updater receives the current value, or {@code null} when the key is absent or expired,
     * and returns the value to store with a fresh {@code ttl}. Concurrent updates of the same key
     * are applied one after the other; updates of different keys do not wait on each other. The
     * updater may run more than once and must not have side effects.
     *
     * @return the value that was stored
     */
    String update(String key, Duration ttl, UnaryOperator<String> updater);

    boolean isAvailable();

    String type();
}
