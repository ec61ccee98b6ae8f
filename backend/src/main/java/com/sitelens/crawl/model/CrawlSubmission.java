package com.sitelens.crawl.model;

public record CrawlSubmission(
    String crawlId,
    String url,
    CrawlStatus status
) {
}
