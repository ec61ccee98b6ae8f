package com.sitelens.config;

import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.InMemoryCrawlCache;
import com.sitelens.crawl.cache.RedisCrawlCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CrawlConfigTest {

    @Test
    @SuppressWarnings("unchecked")
    void inMemoryCacheIsTheDefault() {
        ObjectProvider<StringRedisTemplate> provider = mock(ObjectProvider.class);

        CrawlCache cache = new CrawlConfig().crawlCache(provider, new CrawlerProperties());

        assertThat(cache).isInstanceOf(InMemoryCrawlCache.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void redisCacheIsUsedWhenConfiguredAndAvailable() {
        ObjectProvider<StringRedisTemplate> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(mock(StringRedisTemplate.class));
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCache().setType("Redis");

        CrawlCache cache = new CrawlConfig().crawlCache(provider, properties);

        assertThat(cache).isInstanceOf(RedisCrawlCache.class);
        assertThat(cache.type()).isEqualTo("redis");
    }

    @Test
    @SuppressWarnings("unchecked")
    void redisFallsBackToInMemoryWithoutTemplate() {
        ObjectProvider<StringRedisTemplate> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCache().setType("redis");

        assertThat(new CrawlConfig().crawlCache(provider, properties)).isInstanceOf(InMemoryCrawlCache.class);
    }
}
