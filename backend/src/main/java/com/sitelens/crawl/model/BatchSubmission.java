package com.sitelens.crawl.model;

import java.util.List;

public record BatchSubmission(
    String batchId,
    int totalUrls,
    List<CrawlSubmission> results
) {
}
