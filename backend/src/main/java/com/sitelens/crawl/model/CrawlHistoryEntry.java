package com.sitelens.crawl.model;

import java.time.Instant;

public record CrawlHistoryEntry(
    String crawlId,
    String url,
    String domain,
    String status,
    Integer statusCode,
    Long responseTimeMs,
    String errorMessage,
    Instant crawlTimestamp
) {
}
