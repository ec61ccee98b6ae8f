package com.sitelens.crawl.cache;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link CrawlCache}. Expired entries are dropped lazily on access and swept
 * whenever the map grows past {@link #SWEEP_THRESHOLD} entries.
 */
public class InMemoryCrawlCache implements CrawlCache {
    private static final int SWEEP_THRESHOLD = 10_000;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(System.currentTimeMillis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiryFor(ttl)));
        sweepIfNeeded();
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(System.currentTimeMillis());
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public String update(String key, Duration ttl, UnaryOperator<String> updater) {
        Entry updated = entries.compute(key, (ignored, existing) -> {
            String current = existing == null || existing.isExpired(System.currentTimeMillis())
                ? null
                : existing.value();
            return new Entry(updater.apply(current), expiryFor(ttl));
        });
        sweepIfNeeded();
        return updated.value();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String type() {
        return "in-memory";
    }

    int size() {
        return entries.size();
    }

    private long expiryFor(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Long.MAX_VALUE;
        }
        return System.currentTimeMillis() + ttl.toMillis();
    }

    private void sweepIfNeeded() {
        if (entries.size() <= SWEEP_THRESHOLD) {
            return;
        }
        long now = System.currentTimeMillis();
        Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now)) {
                iterator.remove();
            }
        }
    }

    private record Entry(String value, long expiresAtMillis) {
        boolean isExpired(long now) {
            return expiresAtMillis <= now;
        }
    }
}
