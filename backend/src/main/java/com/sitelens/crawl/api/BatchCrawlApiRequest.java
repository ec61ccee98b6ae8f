package com.sitelens.crawl.api;

import java.util.List;
import java.util.Map;

public record BatchCrawlApiRequest(
    List<String> urls,
    String priority,
    Integer maxRetries,
    Double crawlDelay,
    Boolean respectRobotsTxt,
    String userAgent,
    Map<String, String> headers
) {
}
