package com.sitelens.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.cache.CacheKeys;
import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.CrawlCacheException;
import com.sitelens.crawl.model.DomainRateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Spaces request starts per domain.
 *
 * Each {@link #acquire} reserves the next free start slot with one atomic cache update and
 * then sleeps until that slot, so callers racing on one domain receive successive slots while
 * other domains are never held up. State lives in the shared {@link CrawlCache} under
 * {@code rate_limit:<domain>} and expires when the domain has been idle for the state TTL.
 */
@Service
public class DomainRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(DomainRateLimiter.class);

    private final CrawlerProperties properties;
    private final CrawlCache cache;
    private final ObjectMapper objectMapper;

    public DomainRateLimiter(CrawlerProperties properties, CrawlCache cache, ObjectMapper objectMapper) {
        this.properties = properties;
        this.cache = cache;
        this.objectMapper = objectMapper;
    }

    /**
     * Blocks until {@code domain} may be requested again and records the request start.
     *
     * @param requestedDelaySeconds desired spacing; the configured default applies when null or not positive.
     *                              A larger stored delay for the domain wins.
     * @return milliseconds spent waiting
     */
    public long acquire(String domain, Double requestedDelaySeconds) throws InterruptedException {
        if (!properties.getRateLimit().isEnabled() || domain == null || domain.isBlank()) {
            return 0L;
        }
        String normalized = normalizeDomain(domain);
        double requested = requestedDelaySeconds == null || requestedDelaySeconds <= 0
            ? properties.getDefaultCrawlDelaySeconds()
            : requestedDelaySeconds;

        AtomicReference<DomainRateState> reserved = new AtomicReference<>();
        long now = System.currentTimeMillis();
        try {
            cache.update(CacheKeys.rateLimit(normalized), stateTtl(), current -> {
                DomainRateState state = decode(current);
                double effective = state == null ? requested : Math.max(state.crawlDelay(), requested);
                long previousStart = state == null ? 0L : state.lastRequestTime();
                long count = state == null ? 0L : state.requestCount();
                long slot = previousStart <= 0
                    ? now
                    : Math.max(now, previousStart + Math.round(effective * 1000.0));
                DomainRateState next = new DomainRateState(normalized, slot, count + 1, effective);
                reserved.set(next);
                return encode(next);
            });
        } catch (CrawlCacheException | UncheckedIOException e) {
            log.warn("rate limit state unavailable domain={} decision=proceed error={}", normalized, e.getMessage());
            return 0L;
        }

        DomainRateState state = reserved.get();
        long waitMs = state.lastRequestTime() - now;
        if (waitMs > 0) {
            log.info("rate limit wait domain={} waitMs={} crawlDelay={}", normalized, waitMs, state.crawlDelay());
            Thread.sleep(waitMs);
        }
        log.debug("rate limit updated domain={} requestCount={} crawlDelay={}",
            normalized, state.requestCount(), state.crawlDelay());
        return Math.max(0L, waitMs);
    }

    public DomainRateState getStats(String domain) {
        String normalized = normalizeDomain(domain);
        return readState(normalized)
            .orElseGet(() -> DomainRateState.empty(normalized, properties.getDefaultCrawlDelaySeconds()));
    }

    /**
     * Stores {@code crawlDelaySeconds} for the domain. Later requests are spaced by at least this delay.
     */
    public DomainRateState setCrawlDelay(String domain, double crawlDelaySeconds) {
        if (crawlDelaySeconds < 0 || !Double.isFinite(crawlDelaySeconds)) {
            throw new IllegalArgumentException("crawl delay must be a non-negative number");
        }
        String normalized = normalizeDomain(domain);
        AtomicReference<DomainRateState> updated = new AtomicReference<>();
        cache.update(CacheKeys.rateLimit(normalized), stateTtl(), current -> {
            DomainRateState state = decode(current);
            DomainRateState next = state == null
                ? DomainRateState.empty(normalized, crawlDelaySeconds)
                : new DomainRateState(normalized, state.lastRequestTime(), state.requestCount(), crawlDelaySeconds);
            updated.set(next);
            return encode(next);
        });
        log.info("domain crawl delay updated domain={} crawlDelay={}", normalized, crawlDelaySeconds);
        return updated.get();
    }

    public boolean isRateLimited(String domain) {
        return readState(normalizeDomain(domain))
            .map(state -> System.currentTimeMillis() < state.nextAllowedAt())
            .orElse(false);
    }

    public boolean resetStats(String domain) {
        String normalized = normalizeDomain(domain);
        boolean removed = cache.delete(CacheKeys.rateLimit(normalized));
        log.info("domain rate limit stats reset domain={} removed={}", normalized, removed);
        return removed;
    }

    private Optional<DomainRateState> readState(String domain) {
        try {
            return cache.get(CacheKeys.rateLimit(domain)).map(this::decode);
        } catch (CrawlCacheException e) {
            log.warn("rate limit state read failed domain={} error={}", domain, e.getMessage());
            return Optional.empty();
        }
    }

    private DomainRateState decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, DomainRateState.class);
        } catch (JsonProcessingException e) {
            log.warn("discarding unreadable rate limit state error={}", e.getOriginalMessage());
            return null;
        }
    }

    private String encode(DomainRateState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Duration stateTtl() {
        return Duration.ofSeconds(properties.getRateLimit().getStateTtlSeconds());
    }

    private String normalizeDomain(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
