package com.sitelens.crawl.model;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    Map<String, String> headers,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INVALID_URL = "invalid_url";
    public static final String BODY_TOO_LARGE = "body_too_large";
    public static final String INTERRUPTED = "interrupted";

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isNetworkError() {
        return errorCode != null && !BODY_TOO_LARGE.equals(errorCode);
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
