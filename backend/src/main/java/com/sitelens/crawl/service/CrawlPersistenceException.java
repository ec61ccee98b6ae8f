package com.sitelens.crawl.service;

public class CrawlPersistenceException extends RuntimeException {
    private final String crawlId;

    public CrawlPersistenceException(String crawlId, String message, Throwable cause) {
        super(message, cause);
        this.crawlId = crawlId;
    }

    public String crawlId() {
        return crawlId;
    }
}
