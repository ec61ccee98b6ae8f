package com.sitelens.crawl.model;

import java.util.Map;

public record HealthResponse(
    String status,
    boolean database,
    boolean cache,
    String cacheType,
    Map<String, Long> counts
) {
}
