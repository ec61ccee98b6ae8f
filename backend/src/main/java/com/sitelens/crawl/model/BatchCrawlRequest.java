package com.sitelens.crawl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record BatchCrawlRequest(
    List<String> urls,
    CrawlPriority priority,
    int maxRetries,
    Double crawlDelay,
    boolean respectRobotsTxt,
    String userAgent,
    Map<String, String> headers
) {
    public BatchCrawlRequest {
        urls = urls == null ? List.of() : List.copyOf(urls);
        priority = priority == null ? CrawlPriority.NORMAL : priority;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public List<CrawlRequest> toRequests() {
        List<CrawlRequest> requests = new ArrayList<>(urls.size());
        for (String url : urls) {
            requests.add(new CrawlRequest(url, priority, maxRetries, crawlDelay, respectRobotsTxt, userAgent, headers));
        }
        return requests;
    }
}
