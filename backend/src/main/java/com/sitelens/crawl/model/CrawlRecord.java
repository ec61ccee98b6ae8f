package com.sitelens.crawl.model;

import java.time.Instant;
import java.util.Map;

public record CrawlRecord(
    String crawlId,
    String url,
    String domain,
    CrawlStatus status,
    String errorCode,
    String errorMessage,
    int retryCount,
    int maxRetries,
    CrawlPriority priority,
    Double crawlDelay,
    boolean respectRobotsTxt,
    String userAgent,
    Map<String, String> headers,
    String batchId,
    String retryOf,
    Instant createdAt,
    Instant processingStartedAt,
    Instant completedAt
) {
    public CrawlRequest toRequest() {
        return new CrawlRequest(url, priority, maxRetries, crawlDelay, respectRobotsTxt, userAgent, headers);
    }

    public boolean isRetryable() {
        return status == CrawlStatus.FAILED && retryCount < maxRetries;
    }
}
