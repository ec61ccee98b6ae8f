package com.sitelens.crawl.model;

public record DomainRateState(
    String domain,
    long lastRequestTime,
    long requestCount,
    double crawlDelay
) {
    public static DomainRateState empty(String domain, double crawlDelay) {
        return new DomainRateState(domain, 0L, 0L, crawlDelay);
    }

    public long nextAllowedAt() {
        if (lastRequestTime <= 0) {
            return 0L;
        }
        return lastRequestTime + Math.round(crawlDelay * 1000.0);
    }
}
