package com.sitelens.crawl.http;

import com.sitelens.crawl.model.HttpFetchResult;

import java.time.Duration;
import java.util.Map;

/**
 * Retrieves one URL. Failures are reported through {@link HttpFetchResult#errorCode()}, never thrown.
 */
public interface PageFetcher {

    HttpFetchResult get(String url, Map<String, String> headers, Duration timeout, long maxBytes);
}
