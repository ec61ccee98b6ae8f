package com.sitelens.crawl.model;

import java.util.Map;

public record CrawlRequest(
    String url,
    CrawlPriority priority,
    int maxRetries,
    Double crawlDelay,
    boolean respectRobotsTxt,
    String userAgent,
    Map<String, String> headers
) {
    public CrawlRequest {
        priority = priority == null ? CrawlPriority.NORMAL : priority;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static CrawlRequest of(String url) {
        return new CrawlRequest(url, CrawlPriority.NORMAL, 3, null, true, null, Map.of());
    }
}
