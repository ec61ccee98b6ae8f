package com.sitelens.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.InMemoryCrawlCache;
import com.sitelens.crawl.cache.RedisCrawlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean(name = "crawlExecutor", destroyMethod = "shutdownNow")
    public ExecutorService crawlExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrentRequests());
    }

    @Bean(name = "batchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService batchExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Selects the cache backend from {@code crawler.cache.type}: "in-memory" (default) or
     * "redis". Redis falls back to the in-memory cache when no {@link StringRedisTemplate}
     * is configured.
     */
    @Bean
    public CrawlCache crawlCache(ObjectProvider<StringRedisTemplate> redisProvider,
                                CrawlerProperties properties) {
        String kind = properties.getCache().getType().toLowerCase(Locale.ROOT);
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                log.info("crawl cache backend=redis keyPrefix={}", properties.getCache().getKeyPrefix());
                return new RedisCrawlCache(template, properties.getCache().getKeyPrefix());
            }
            log.warn("crawl cache type=redis but no redis template is configured; using in-memory");
        }
        return new InMemoryCrawlCache();
    }
}
