package com.sitelens.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "SiteLens-Crawler/1.0 (+https://sitelens.dev/bot)";

    private String userAgent;
    private int maxConcurrentRequests = 100;
    private int batchConcurrency = 10;
    private double defaultCrawlDelaySeconds = 1.0;
    private int maxRetryAttempts = 3;
    private int requestTimeoutSeconds = 30;
    private long maxContentSizeBytes = 10L * 1024 * 1024;
    private int resultCacheTtlSeconds = 3600;
    private RateLimit rateLimit = new RateLimit();
    private Classification classification = new Classification();
    private Robots robots = new Robots();
    private Cache cache = new Cache();
    private Recovery recovery = new Recovery();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getMaxConcurrentRequests() {
        return Math.max(1, maxConcurrentRequests);
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
    }

    public int getBatchConcurrency() {
        return Math.max(1, batchConcurrency);
    }

    public void setBatchConcurrency(int batchConcurrency) {
        this.batchConcurrency = Math.max(1, batchConcurrency);
    }

    public double getDefaultCrawlDelaySeconds() {
        return Math.max(0.0, defaultCrawlDelaySeconds);
    }

    public void setDefaultCrawlDelaySeconds(double defaultCrawlDelaySeconds) {
        this.defaultCrawlDelaySeconds = Math.max(0.0, defaultCrawlDelaySeconds);
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public void setMaxRetryAttempts(int maxRetryAttempts) {
        this.maxRetryAttempts = Math.max(0, Math.min(maxRetryAttempts, 10));
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public long getMaxContentSizeBytes() {
        return Math.max(1L, maxContentSizeBytes);
    }

    public void setMaxContentSizeBytes(long maxContentSizeBytes) {
        this.maxContentSizeBytes = Math.max(1L, maxContentSizeBytes);
    }

    public int getResultCacheTtlSeconds() {
        return Math.max(1, resultCacheTtlSeconds);
    }

    public void setResultCacheTtlSeconds(int resultCacheTtlSeconds) {
        this.resultCacheTtlSeconds = Math.max(1, resultCacheTtlSeconds);
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Classification getClassification() {
        return classification;
    }

    public void setClassification(Classification classification) {
        this.classification = classification;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class RateLimit {
        private boolean enabled = true;
        // Declared thresholds; spacing is driven by crawl delay only.
        private int requestsPerMinute = 100;
        private int burstSize = 10;
        private int stateTtlSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = Math.max(1, requestsPerMinute);
        }

        public int getBurstSize() {
            return burstSize;
        }

        public void setBurstSize(int burstSize) {
            this.burstSize = Math.max(1, burstSize);
        }

        public int getStateTtlSeconds() {
            return Math.max(1, stateTtlSeconds);
        }

        public void setStateTtlSeconds(int stateTtlSeconds) {
            this.stateTtlSeconds = Math.max(1, stateTtlSeconds);
        }
    }

    public static class Classification {
        private boolean enabled = true;
        private double minConfidence = 0.5;
        private int maxTopics = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = Math.max(0.0, Math.min(minConfidence, 1.0));
        }

        public int getMaxTopics() {
            return Math.max(1, maxTopics);
        }

        public void setMaxTopics(int maxTopics) {
            this.maxTopics = Math.max(1, maxTopics);
        }
    }

    public static class Robots {
        private boolean respect = true;
        private int cacheTtlSeconds = 86400;
        private int unavailableCacheTtlSeconds = 21600;
        private int fetchTimeoutSeconds = 10;
        private long maxBytes = 512 * 1024;

        public boolean isRespect() {
            return respect;
        }

        public void setRespect(boolean respect) {
            this.respect = respect;
        }

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }

        public int getUnavailableCacheTtlSeconds() {
            return Math.max(1, unavailableCacheTtlSeconds);
        }

        public void setUnavailableCacheTtlSeconds(int unavailableCacheTtlSeconds) {
            this.unavailableCacheTtlSeconds = Math.max(1, unavailableCacheTtlSeconds);
        }

        public int getFetchTimeoutSeconds() {
            return Math.max(1, fetchTimeoutSeconds);
        }

        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
            this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
        }

        public long getMaxBytes() {
            return Math.max(1L, maxBytes);
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = Math.max(1L, maxBytes);
        }
    }

    public static class Cache {
        private String type = "in-memory";
        private String keyPrefix = "";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type == null || type.isBlank() ? "in-memory" : type.trim();
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix == null ? "" : keyPrefix.trim();
        }
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
