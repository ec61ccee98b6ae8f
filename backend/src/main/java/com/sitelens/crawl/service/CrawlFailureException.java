package com.sitelens.crawl.service;

import com.sitelens.crawl.model.CrawlFailureReason;

/**
 * A crawl that ended for a known reason. Resolved into a FAILED record inside the orchestrator.
 */
public class CrawlFailureException extends RuntimeException {
    private final CrawlFailureReason reason;
    private final Integer statusCode;
    private final Long responseTimeMs;

    public CrawlFailureException(CrawlFailureReason reason, String message) {
        this(reason, message, null, null);
    }

    public CrawlFailureException(CrawlFailureReason reason, String message, Integer statusCode, Long responseTimeMs) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
        this.responseTimeMs = responseTimeMs;
    }

    public CrawlFailureReason reason() {
        return reason;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public Long responseTimeMs() {
        return responseTimeMs;
    }
}
