package com.sitelens.crawl.api;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.BatchCrawlRequest;
import com.sitelens.crawl.model.BatchSubmission;
import com.sitelens.crawl.model.CrawlPriority;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlRequest;
import com.sitelens.crawl.model.CrawlResult;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.model.CrawlSubmission;
import com.sitelens.crawl.model.DomainRateState;
import com.sitelens.crawl.model.HealthResponse;
import com.sitelens.crawl.service.CrawlNotFoundException;
import com.sitelens.crawl.service.CrawlOrchestratorService;
import com.sitelens.crawl.service.CrawlResultService;
import com.sitelens.crawl.service.DomainRateLimiter;
import com.sitelens.crawl.util.UrlUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1")
public class CrawlController {
    static final int MAX_BATCH_URLS = 1000;
    static final int MAX_RETRIES_LIMIT = 10;
    static final double MIN_CRAWL_DELAY = 0.1;
    static final double MAX_CRAWL_DELAY = 60.0;
    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 1000;

    private final CrawlOrchestratorService orchestratorService;
    private final CrawlResultService resultService;
    private final DomainRateLimiter rateLimiter;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        CrawlOrchestratorService orchestratorService,
        CrawlResultService resultService,
        DomainRateLimiter rateLimiter,
        CrawlerProperties crawlerProperties
    ) {
        this.orchestratorService = orchestratorService;
        this.resultService = resultService;
        this.rateLimiter = rateLimiter;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping("/crawl")
    public CrawlSubmission submitCrawl(@RequestBody(required = false) CrawlApiRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        requireHttpUrl(request.url());
        return orchestratorService.submitSingle(new CrawlRequest(
            request.url().trim(),
            parsePriority(request.priority()),
            maxRetries(request.maxRetries()),
            crawlDelay(request.crawlDelay()),
            request.respectRobotsTxt() == null || request.respectRobotsTxt(),
            request.userAgent(),
            requireHeaders(request.headers())
        ));
    }

    @PostMapping("/crawl/batch")
    public BatchSubmission submitBatch(@RequestBody(required = false) BatchCrawlApiRequest request) {
        if (request == null || request.urls() == null || request.urls().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "urls must contain at least one url");
        }
        if (request.urls().size() > MAX_BATCH_URLS) {
            throw new ResponseStatusException(BAD_REQUEST, "urls must contain at most " + MAX_BATCH_URLS + " urls");
        }
        List<String> urls = request.urls().stream().map(url -> requireHttpUrl(url).trim()).toList();
        return orchestratorService.submitBatch(new BatchCrawlRequest(
            urls,
            parsePriority(request.priority()),
            maxRetries(request.maxRetries()),
            crawlDelay(request.crawlDelay()),
            request.respectRobotsTxt() == null || request.respectRobotsTxt(),
            request.userAgent(),
            requireHeaders(request.headers())
        ));
    }

    @GetMapping("/results/{crawlId}")
    public CrawlResult getResult(@PathVariable("crawlId") String crawlId) {
        return resultService.getResult(crawlId).orElseThrow(() -> new CrawlNotFoundException(crawlId));
    }

    @GetMapping("/results")
    public Map<String, Object> listResults(
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Integer offset,
        @RequestParam(name = "domain", required = false) String domain,
        @RequestParam(name = "status", required = false) String status
    ) {
        int safeLimit = limit == null ? DEFAULT_PAGE_SIZE : Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        int safeOffset = offset == null ? 0 : Math.max(0, offset);
        String safeDomain = domain == null || domain.isBlank() ? null : domain.trim().toLowerCase(Locale.ROOT);
        CrawlStatus crawlStatus = parseStatus(status);

        List<CrawlRecord> results = resultService.listResults(safeDomain, crawlStatus, safeLimit, safeOffset);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("results", results);
        response.put("total", resultService.countResults(safeDomain, crawlStatus));
        response.put("limit", safeLimit);
        response.put("offset", safeOffset);
        return response;
    }

    @DeleteMapping("/results/{crawlId}")
    public Map<String, String> deleteResult(@PathVariable("crawlId") String crawlId) {
        if (!resultService.deleteResult(crawlId)) {
            throw new CrawlNotFoundException(crawlId);
        }
        return Map.of("message", "Crawl result deleted", "crawlId", crawlId);
    }

    @PostMapping("/results/{crawlId}/retry")
    public CrawlSubmission retry(@PathVariable("crawlId") String crawlId) {
        return orchestratorService.retry(crawlId);
    }

    @PostMapping("/results/{crawlId}/cancel")
    public Map<String, Object> cancel(@PathVariable("crawlId") String crawlId) {
        return Map.of("crawlId", crawlId, "cancelled", orchestratorService.cancel(crawlId));
    }

    @GetMapping("/domains/{domain}/rate-limit")
    public DomainRateState getRateLimit(@PathVariable("domain") String domain) {
        return rateLimiter.getStats(domain);
    }

    @PutMapping("/domains/{domain}/rate-limit")
    public DomainRateState setRateLimit(
        @PathVariable("domain") String domain,
        @RequestParam(name = "crawlDelay") Double crawlDelay
    ) {
        if (crawlDelay == null || crawlDelay < MIN_CRAWL_DELAY || crawlDelay > MAX_CRAWL_DELAY) {
            throw new ResponseStatusException(BAD_REQUEST, "crawlDelay must be between 0.1 and 60 seconds");
        }
        return rateLimiter.setCrawlDelay(domain, crawlDelay);
    }

    @DeleteMapping("/domains/{domain}/rate-limit")
    public Map<String, Object> resetRateLimit(@PathVariable("domain") String domain) {
        return Map.of("domain", domain.toLowerCase(Locale.ROOT), "reset", rateLimiter.resetStats(domain));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse health = resultService.health();
        HttpStatus status = "unhealthy".equals(health.status()) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/liveness")
    public Map<String, String> liveness() {
        return Map.of("status", "alive");
    }

    @GetMapping("/readiness")
    public ResponseEntity<Map<String, String>> readiness() {
        if (!resultService.isReady()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "not_ready"));
        }
        return ResponseEntity.ok(Map.of("status", "ready"));
    }

    private static Map<String, String> requireHeaders(Map<String, String> headers) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() == null || header.getKey().isBlank() || header.getValue() == null) {
                throw new ResponseStatusException(BAD_REQUEST, "headers must map names to non-null values: " + header.getKey());
            }
        }
        return headers;
    }

    private static String requireHttpUrl(String url) {
        if (url == null || url.isBlank() || !UrlUtils.isHttpUrl(url.trim())) {
            throw new ResponseStatusException(BAD_REQUEST, "url must be an absolute http(s) URL: " + url);
        }
        return url;
    }

    private int maxRetries(Integer value) {
        if (value == null) {
            return crawlerProperties.getMaxRetryAttempts();
        }
        if (value < 0 || value > MAX_RETRIES_LIMIT) {
            throw new ResponseStatusException(BAD_REQUEST, "maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        return value;
    }

    private static Double crawlDelay(Double value) {
        if (value == null) {
            return null;
        }
        if (value < MIN_CRAWL_DELAY || value > MAX_CRAWL_DELAY) {
            throw new ResponseStatusException(BAD_REQUEST, "crawlDelay must be between 0.1 and 60 seconds");
        }
        return value;
    }

    private static CrawlPriority parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return CrawlPriority.NORMAL;
        }
        try {
            return CrawlPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid priority: " + value);
        }
    }

    private static CrawlStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return CrawlStatus.fromDbValue(value);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid status: " + value);
        }
    }
}
