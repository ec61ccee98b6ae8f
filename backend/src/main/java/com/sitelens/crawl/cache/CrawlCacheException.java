package com.sitelens.crawl.cache;

public class CrawlCacheException extends RuntimeException {
    public CrawlCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    public CrawlCacheException(String message) {
        super(message);
    }
}
