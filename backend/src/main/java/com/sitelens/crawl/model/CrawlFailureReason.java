package com.sitelens.crawl.model;

import java.util.Locale;

public enum CrawlFailureReason {
    NETWORK_ERROR,
    TIMEOUT,
    HTTP_STATUS,
    UNSUPPORTED_CONTENT_TYPE,
    CONTENT_TOO_LARGE,
    ROBOTS_DISALLOWED,
    CANCELLED,
    INTERRUPTED,
    PERSISTENCE_ERROR,
    UNEXPECTED_ERROR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
