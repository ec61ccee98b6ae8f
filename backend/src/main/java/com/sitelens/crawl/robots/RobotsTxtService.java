package com.sitelens.crawl.robots;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.cache.CacheKeys;
import com.sitelens.crawl.cache.CrawlCache;
import com.sitelens.crawl.cache.CrawlCacheException;
import com.sitelens.crawl.http.PageFetcher;
import com.sitelens.crawl.model.HttpFetchResult;
import com.sitelens.crawl.model.RobotsPolicy;
import com.sitelens.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final CrawlCache cache;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> domainLocks = new ConcurrentHashMap<>();

    public RobotsTxtService(
        CrawlerProperties properties,
        PageFetcher fetcher,
        CrawlCache cache,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.cache = cache;
        this.objectMapper = objectMapper;
    }

    public boolean canCrawl(String url, String userAgent) {
        if (!properties.getRobots().isRespect()) {
            return true;
        }
        URI uri = UrlUtils.toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        boolean allowed = rulesFor(uri).isAllowed(UrlUtils.pathAndQuery(uri), effectiveAgent(userAgent));
        if (!allowed) {
            log.info("robots disallowed url={} userAgent={}", url, effectiveAgent(userAgent));
        }
        return allowed;
    }

    public Optional<Double> getCrawlDelay(String url, String userAgent) {
        URI uri = UrlUtils.toUri(url);
        if (uri == null || uri.getHost() == null) {
            return Optional.empty();
        }
        return rulesFor(uri).getCrawlDelay(effectiveAgent(userAgent));
    }

    public List<String> getSitemaps(String url) {
        URI uri = UrlUtils.toUri(url);
        if (uri == null || uri.getHost() == null) {
            return List.of();
        }
        return rulesFor(uri).getSitemapUrls();
    }

    public boolean clearCache(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        try {
            return cache.delete(CacheKeys.robotsTxt(domain));
        } catch (CrawlCacheException e) {
            log.warn("robots cache clear failed domain={} error={}", domain, e.getMessage());
            return false;
        }
    }

    RobotsPolicy getPolicy(URI uri) {
        String domain = UrlUtils.domainOf(uri.toString());
        String key = CacheKeys.robotsTxt(domain);
        Optional<RobotsPolicy> cached = readCached(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        Object lock = domainLocks.computeIfAbsent(domain, ignored -> new Object());
        synchronized (lock) {
            cached = readCached(key);
            if (cached.isPresent()) {
                return cached.get();
            }
            RobotsPolicy policy = fetchPolicy(uri.getScheme(), domain);
            if (!Thread.currentThread().isInterrupted()) {
                writeCached(key, policy);
            }
            return policy;
        }
    }

    private RobotsRules rulesFor(URI uri) {
        RobotsPolicy policy = getPolicy(uri);
        if (policy.outcome() != RobotsPolicy.Outcome.FOUND) {
            return RobotsRules.allowAll();
        }
        try {
            return RobotsRules.parse(policy.content());
        } catch (RuntimeException e) {
            log.warn("robots parse failed domain={} decision=allow_all error={}", policy.domain(), e.getMessage());
            return RobotsRules.allowAll();
        }
    }

    private RobotsPolicy fetchPolicy(String scheme, String domain) {
        String robotsUrl = scheme.toLowerCase(Locale.ROOT) + "://" + domain + "/robots.txt";
        HttpFetchResult fetch = fetcher.get(
            robotsUrl,
            Map.of("User-Agent", properties.getUserAgent(), "Accept", ROBOTS_ACCEPT),
            Duration.ofSeconds(properties.getRobots().getFetchTimeoutSeconds()),
            properties.getRobots().getMaxBytes()
        );
        if (fetch.errorCode() == null && fetch.statusCode() == 200) {
            log.debug("Loaded robots for domain {} bytes={}", domain, fetch.bodyBytes() == null ? 0 : fetch.bodyBytes().length);
            return RobotsPolicy.found(domain, fetch.body());
        }
        if (fetch.errorCode() == null && fetch.statusCode() == 404) {
            log.debug("No robots file for domain {}", domain);
            return RobotsPolicy.notFound(domain);
        }
        log.warn(
            "robots fetch failed domain={} robots_unavailable=true status={} errorCode={} errorMessage={} decision=allow_all",
            domain,
            fetch.statusCode(),
            fetch.errorCode(),
            fetch.errorMessage()
        );
        return RobotsPolicy.unavailable(domain);
    }

    private Optional<RobotsPolicy> readCached(String key) {
        try {
            Optional<String> json = cache.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), RobotsPolicy.class));
        } catch (CrawlCacheException | JsonProcessingException e) {
            log.warn("robots cache read failed key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCached(String key, RobotsPolicy policy) {
        Duration ttl = policy.outcome() == RobotsPolicy.Outcome.UNAVAILABLE
            ? Duration.ofSeconds(properties.getRobots().getUnavailableCacheTtlSeconds())
            : Duration.ofSeconds(properties.getRobots().getCacheTtlSeconds());
        try {
            cache.set(key, objectMapper.writeValueAsString(policy), ttl);
        } catch (CrawlCacheException | JsonProcessingException e) {
            log.warn("robots cache write failed key={} error={}", key, e.getMessage());
        }
    }

    private String effectiveAgent(String userAgent) {
        return userAgent == null || userAgent.isBlank() ? properties.getUserAgent() : userAgent;
    }
}
