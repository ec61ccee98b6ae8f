package com.sitelens.crawl.http;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

    private final HttpClient client;

    public HttpPageFetcher(CrawlerProperties properties) {
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public HttpFetchResult get(String url, Map<String, String> headers, Duration timeout, long maxBytes) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, HttpFetchResult.INVALID_URL, "URL missing host or malformed");
        }

        // one deadline covers headers and body
        Duration deadline = timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : null;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).GET();
        if (deadline != null) {
            builder.timeout(deadline);
        }
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getKey() == null || header.getValue() == null) {
                    continue;
                }
                try {
                    builder.setHeader(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    log.debug("skipping request header name={} reason={}", header.getKey(), e.getMessage());
                }
            }
        }

        CompletableFuture<HttpResponse<byte[]>> exchange;
        try {
            exchange = client.sendAsync(builder.build(), cappedBody(maxBytes));
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, HttpFetchResult.INVALID_URL, e.getMessage());
        }

        HttpResponse<byte[]> response;
        try {
            if (deadline == null) {
                response = exchange.get();
            } else {
                long remainingMs = deadline.minus(Duration.between(startedAt, Instant.now())).toMillis();
                response = exchange.get(Math.max(1L, remainingMs), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            exchange.cancel(true);
            return errorResult(url, startedAt, HttpFetchResult.TIMEOUT,
                "Request timed out after " + deadline.toMillis() + "ms");
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, HttpFetchResult.INTERRUPTED, e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, HttpFetchResult.TIMEOUT, cause.getMessage());
            }
            if (cause instanceof IllegalArgumentException) {
                return errorResult(url, startedAt, HttpFetchResult.INVALID_URL, cause.getMessage());
            }
            return errorResult(url, startedAt, HttpFetchResult.IO_ERROR, String.valueOf(cause.getMessage()));
        }

        Map<String, String> responseHeaders = flattenHeaders(response.headers().map());
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        if (response.body() == null) {
            long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            return tooLarge(url, response, contentType, responseHeaders, startedAt,
                declaredLength > maxBytes ? declaredLength : -1, maxBytes);
        }
        return new HttpFetchResult(
            url,
            response.uri(),
            response.statusCode(),
            response.body(),
            contentType,
            responseHeaders,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            null,
            null
        );
    }

    /**
     * Body handler that keeps at most {@code maxBytes}. The body completes as null, and the
     * stream is cancelled, once the declared or received length goes over the cap.
     */
    private HttpResponse.BodyHandler<byte[]> cappedBody(long maxBytes) {
        return responseInfo -> {
            OptionalLong declaredLength = responseInfo.headers().firstValueAsLong("Content-Length");
            if (declaredLength.isPresent() && declaredLength.getAsLong() > maxBytes) {
                return new CappedBodySubscriber(0);
            }
            return new CappedBodySubscriber(maxBytes);
        };
    }

    private HttpFetchResult tooLarge(
        String url,
        HttpResponse<?> response,
        String contentType,
        Map<String, String> headers,
        Instant startedAt,
        long declaredLength,
        long maxBytes
    ) {
        String message = declaredLength >= 0
            ? "Content too large: " + declaredLength + " bytes exceeds limit of " + maxBytes
            : "Content too large: body exceeds limit of " + maxBytes + " bytes";
        return new HttpFetchResult(
            url,
            response.uri(),
            response.statusCode(),
            null,
            contentType,
            headers,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            HttpFetchResult.BODY_TOO_LARGE,
            message
        );
    }

    private Map<String, String> flattenHeaders(Map<String, List<String>> raw) {
        Map<String, String> flattened = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getKey().startsWith(":") || entry.getValue().isEmpty()) {
                continue;
            }
            flattened.put(entry.getKey().toLowerCase(Locale.ROOT), String.join(", ", entry.getValue()));
        }
        return flattened;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Map.of(),
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {
        private final long maxBytes;
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private Flow.Subscription subscription;
        private long received;

        CappedBodySubscriber(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> buffers) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer buffer : buffers) {
                int length = buffer.remaining();
                received += length;
                if (received > maxBytes) {
                    subscription.cancel();
                    body.complete(null);
                    return;
                }
                byte[] chunk = new byte[length];
                buffer.get(chunk);
                out.write(chunk, 0, length);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(out.toByteArray());
        }
    }
}
