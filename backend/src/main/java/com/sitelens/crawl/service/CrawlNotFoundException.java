package com.sitelens.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CrawlNotFoundException extends RuntimeException {
    public CrawlNotFoundException(String crawlId) {
        super("Crawl result not found: " + crawlId);
    }
}
