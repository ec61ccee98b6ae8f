package com.sitelens.crawl.cache;

import java.util.Locale;

public final class CacheKeys {
    private CacheKeys() {
    }

    public static String rateLimit(String domain) {
        return "rate_limit:" + normalize(domain);
    }

    public static String robotsTxt(String domain) {
        return "robots_txt:" + normalize(domain);
    }

    public static String crawlResult(String crawlId) {
        return "crawl_result:" + crawlId;
    }

    private static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
