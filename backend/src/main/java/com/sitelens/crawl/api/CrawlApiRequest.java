package com.sitelens.crawl.api;

import java.util.Map;

public record CrawlApiRequest(
    String url,
    String priority,
    Integer maxRetries,
    Double crawlDelay,
    Boolean respectRobotsTxt,
    String userAgent,
    Map<String, String> headers
) {
}
