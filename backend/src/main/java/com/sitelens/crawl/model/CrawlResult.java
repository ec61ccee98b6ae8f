package com.sitelens.crawl.model;

public record CrawlResult(
    CrawlRecord record,
    PageMetadata metadata
) {
}
