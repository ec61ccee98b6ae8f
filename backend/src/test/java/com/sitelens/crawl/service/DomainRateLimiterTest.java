package com.sitelens.crawl.service;

import com.sitelens.config.CrawlConfig;
import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.CrawlCacheException;
import com.sitelens.crawl.cache.InMemoryCrawlCache;
import com.sitelens.crawl.model.DomainRateState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DomainRateLimiterTest {

    @Test
    void secondRequestStartsAfterDefaultDelay() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setDefaultCrawlDelaySeconds(2.0);
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());

        assertThat(limiter.acquire("example.com", null)).isZero();
        long firstStart = limiter.getStats("example.com").lastRequestTime();
        Thread.sleep(100);
        long waited = limiter.acquire("example.com", null);
        long secondStart = System.currentTimeMillis();

        assertThat(waited).isGreaterThan(1500L);
        assertThat(secondStart - firstStart).isGreaterThanOrEqualTo(2000L);
        DomainRateState stats = limiter.getStats("example.com");
        assertThat(stats.requestCount()).isEqualTo(2L);
        assertThat(stats.crawlDelay()).isEqualTo(2.0);
    }

    @Test
    void racingCallersReceiveSuccessiveSlots() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());
        ExecutorService executor = Executors.newFixedThreadPool(3);
        List<Long> starts = new ArrayList<>();
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(executor.submit(() -> {
                    limiter.acquire("race.example", 0.3);
                    return System.currentTimeMillis();
                }));
            }
            for (Future<Long> future : futures) {
                starts.add(future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        starts.sort(Long::compare);
        assertThat(starts.get(2) - starts.get(0)).isGreaterThanOrEqualTo(550L);
        assertThat(limiter.getStats("race.example").requestCount()).isEqualTo(3L);
    }

    @Test
    void otherDomainsAreNotHeldUp() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());

        limiter.acquire("slow.example", 5.0);
        long startedAt = System.nanoTime();
        assertThat(limiter.acquire("fast.example", 5.0)).isZero();
        assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(1));
        assertThat(limiter.isRateLimited("slow.example")).isTrue();
        assertThat(limiter.isRateLimited("idle.example")).isFalse();
    }

    @Test
    void storedDelayOverridesSmallerRequests() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());

        limiter.setCrawlDelay("Slow.Example", 4.0);
        limiter.acquire("slow.example", 0.5);

        assertThat(limiter.getStats("slow.example").crawlDelay()).isEqualTo(4.0);
        assertThatThrownBy(() -> limiter.setCrawlDelay("slow.example", -1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetForgetsDomainState() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setDefaultCrawlDelaySeconds(1.5);
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());

        limiter.acquire("example.com", null);
        assertThat(limiter.resetStats("example.com")).isTrue();

        DomainRateState stats = limiter.getStats("example.com");
        assertThat(stats.requestCount()).isZero();
        assertThat(stats.crawlDelay()).isEqualTo(1.5);
    }

    @Test
    void cacheFailureLetsRequestProceed() throws Exception {
        CrawlCache cache = mock(CrawlCache.class);
        when(cache.update(anyString(), any(), any())).thenThrow(new CrawlCacheException("connection refused"));
        DomainRateLimiter limiter = newLimiter(new CrawlerProperties(), cache);

        assertThat(limiter.acquire("example.com", 10.0)).isZero();
    }

    @Test
    void disabledLimiterNeverWaits() throws Exception {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getRateLimit().setEnabled(false);
        DomainRateLimiter limiter = newLimiter(properties, new InMemoryCrawlCache());

        limiter.acquire("example.com", 10.0);
        assertThat(limiter.acquire("example.com", 10.0)).isZero();
    }

    private static DomainRateLimiter newLimiter(CrawlerProperties properties, CrawlCache cache) {
        return new DomainRateLimiter(properties, cache, new CrawlConfig().objectMapper());
    }
}
