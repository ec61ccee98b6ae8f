package com.sitelens.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CrawlNotRetryableException extends RuntimeException {
    public CrawlNotRetryableException(String message) {
        super(message);
    }
}
