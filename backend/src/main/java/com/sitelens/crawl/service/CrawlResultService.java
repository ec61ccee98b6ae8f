package com.sitelens.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.cache.CacheKeys;
import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.CrawlCacheException;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlResult;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.model.HealthResponse;
import com.sitelens.crawl.model.PageMetadata;
import com.sitelens.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CrawlResultService {
    private static final Logger log = LoggerFactory.getLogger(CrawlResultService.class);

    private final CrawlJdbcRepository repository;
    private final CrawlCache cache;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    public CrawlResultService(
        CrawlJdbcRepository repository,
        CrawlCache cache,
        ObjectMapper objectMapper,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Cached completed result first, then the store. In-progress records come back without metadata.
     */
    public Optional<CrawlResult> getResult(String crawlId) {
        Optional<CrawlResult> cached = readCached(crawlId);
        if (cached.isPresent()) {
            return cached;
        }
        CrawlRecord record = repository.findCrawlRecord(crawlId);
        if (record == null) {
            return Optional.empty();
        }
        PageMetadata metadata = record.status() == CrawlStatus.COMPLETED ? repository.findPageMetadata(crawlId) : null;
        CrawlResult result = new CrawlResult(record, metadata);
        if (record.status() == CrawlStatus.COMPLETED) {
            cacheResult(result);
        }
        return Optional.of(result);
    }

    public List<CrawlRecord> listResults(String domain, CrawlStatus status, int limit, int offset) {
        return repository.findCrawlRecords(domain, status, limit, offset);
    }

    public long countResults(String domain, CrawlStatus status) {
        return repository.countCrawlRecords(domain, status);
    }

    public boolean deleteResult(String crawlId) {
        boolean deleted = repository.deleteCrawlRecord(crawlId);
        try {
            cache.delete(CacheKeys.crawlResult(crawlId));
        } catch (CrawlCacheException e) {
            log.warn("result cache evict failed crawlId={} error={}", crawlId, e.getMessage());
        }
        if (deleted) {
            log.info("crawl result deleted crawlId={}", crawlId);
        }
        return deleted;
    }

    public void cacheResult(CrawlResult result) {
        if (result == null || result.record() == null) {
            return;
        }
        String key = CacheKeys.crawlResult(result.record().crawlId());
        try {
            cache.set(key, objectMapper.writeValueAsString(result), Duration.ofSeconds(properties.getResultCacheTtlSeconds()));
        } catch (CrawlCacheException | JsonProcessingException e) {
            log.warn("result cache write failed crawlId={} error={}", result.record().crawlId(), e.getMessage());
        }
    }

    /**
     * Ready to serve once the database answers.
     */
    public boolean isReady() {
        boolean ready = isDbReachable();
        if (!ready) {
            log.error("readiness check failed reason=database_unreachable");
        }
        return ready;
    }

    public HealthResponse health() {
        boolean dbConnected = isDbReachable();
        boolean cacheConnected = cache.isAvailable();
        Map<String, Long> counts = new LinkedHashMap<>();
        if (dbConnected) {
            counts.putAll(repository.tableCounts());
            for (CrawlStatus status : CrawlStatus.values()) {
                counts.put("status_" + status.dbValue(), repository.countCrawlRecords(null, status));
            }
        }
        String status;
        if (dbConnected && cacheConnected) {
            status = "healthy";
        } else if (dbConnected) {
            status = "degraded";
        } else {
            status = "unhealthy";
        }
        return new HealthResponse(status, dbConnected, cacheConnected, cache.type(), counts);
    }

    private boolean isDbReachable() {
        try {
            return repository.isDbReachable();
        } catch (Exception e) {
            log.warn("database health check failed error={}", e.getMessage());
            return false;
        }
    }

    private Optional<CrawlResult> readCached(String crawlId) {
        try {
            Optional<String> json = cache.get(CacheKeys.crawlResult(crawlId));
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), CrawlResult.class));
        } catch (CrawlCacheException | JsonProcessingException e) {
            log.warn("result cache read failed crawlId={} error={}", crawlId, e.getMessage());
            return Optional.empty();
        }
    }
}
