package com.sitelens.crawl.service;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.classify.TopicClassifier;
import com.sitelens.crawl.extract.PageMetadataExtractor;
import com.sitelens.crawl.http.PageFetcher;
import com.sitelens.crawl.model.BatchCrawlRequest;
import com.sitelens.crawl.model.BatchSubmission;
import com.sitelens.crawl.model.CrawlFailureReason;
import com.sitelens.crawl.model.CrawlHistoryEntry;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlRequest;
import com.sitelens.crawl.model.CrawlResult;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.model.CrawlSubmission;
import com.sitelens.crawl.model.HttpFetchResult;
import com.sitelens.crawl.model.PageMetadata;
import com.sitelens.crawl.model.TopicClassification;
import com.sitelens.crawl.persistence.CrawlJdbcRepository;
import com.sitelens.crawl.robots.RobotsTxtService;
import com.sitelens.crawl.util.HashUtils;
import com.sitelens.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs crawls: robots check, domain spacing, fetch, validation, extraction, classification
 * and persistence, for single submissions and gated batches.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final String DEFAULT_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String DEFAULT_ACCEPT_LANGUAGE = "en-US,en;q=0.5";
    private static final long AWAIT_POLL_MILLIS = 50L;
    private static final Pattern CHARSET = Pattern.compile("charset=\"?([^;\"\\s]+)", Pattern.CASE_INSENSITIVE);

    private final CrawlJdbcRepository repository;
    private final CrawlResultService resultService;
    private final RobotsTxtService robotsTxtService;
    private final DomainRateLimiter rateLimiter;
    private final PageFetcher fetcher;
    private final PageMetadataExtractor extractor;
    private final TopicClassifier classifier;
    private final CrawlerProperties properties;
    private final ExecutorService crawlExecutor;
    private final ExecutorService batchExecutor;
    private final Map<String, TrackedCrawl> inFlight = new ConcurrentHashMap<>();

    public CrawlOrchestratorService(
        CrawlJdbcRepository repository,
        CrawlResultService resultService,
        RobotsTxtService robotsTxtService,
        DomainRateLimiter rateLimiter,
        PageFetcher fetcher,
        PageMetadataExtractor extractor,
        TopicClassifier classifier,
        CrawlerProperties properties,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        @Qualifier("batchExecutor") ExecutorService batchExecutor
    ) {
        this.repository = repository;
        this.resultService = resultService;
        this.robotsTxtService = robotsTxtService;
        this.rateLimiter = rateLimiter;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.classifier = classifier;
        this.properties = properties;
        this.crawlExecutor = crawlExecutor;
        this.batchExecutor = batchExecutor;
    }

    public CrawlSubmission submitSingle(CrawlRequest request) {
        CrawlRecord record = newRecord(request, null, 0, null);
        repository.insertCrawlRecord(record);
        schedule(record, null);
        log.info("crawl submitted crawlId={} url={} priority={}", record.crawlId(), record.url(), record.priority());
        return new CrawlSubmission(record.crawlId(), record.url(), record.status());
    }

    public BatchSubmission submitBatch(BatchCrawlRequest batchRequest) {
        String batchId = UUID.randomUUID().toString();
        List<CrawlRecord> records = createBatchRecords(batchId, batchRequest.toRequests());
        batchExecutor.submit(() -> runBatch(batchId, records));
        log.info("batch submitted batchId={} urls={}", batchId, records.size());
        return new BatchSubmission(batchId, records.size(), toSubmissions(records));
    }

    /**
     * Creates one PENDING record per request and runs them all through the batch gate. Returns
     * once every record is terminal.
     */
    public BatchSubmission processBatch(String batchId, List<CrawlRequest> requests) {
        List<CrawlRecord> records = createBatchRecords(batchId, requests);
        runBatch(batchId, records);
        List<CrawlSubmission> results = new ArrayList<>(records.size());
        for (CrawlRecord record : records) {
            CrawlRecord current = repository.findCrawlRecord(record.crawlId());
            results.add(new CrawlSubmission(
                record.crawlId(),
                record.url(),
                current == null ? record.status() : current.status()
            ));
        }
        return new BatchSubmission(batchId, records.size(), results);
    }

    public CrawlSubmission retry(String crawlId) {
        CrawlRecord previous = repository.findCrawlRecord(crawlId);
        if (previous == null) {
            throw new CrawlNotFoundException(crawlId);
        }
        if (previous.status() != CrawlStatus.FAILED) {
            throw new CrawlNotRetryableException("Only failed crawls can be retried; status is " + previous.status());
        }
        if (!previous.isRetryable()) {
            throw new CrawlNotRetryableException(
                "Retry limit reached (" + previous.retryCount() + "/" + previous.maxRetries() + ")"
            );
        }
        CrawlRecord record = newRecord(previous.toRequest(), previous.batchId(), previous.retryCount() + 1, previous.crawlId());
        repository.insertCrawlRecord(record);
        schedule(record, null);
        log.info("crawl retry submitted crawlId={} retryOf={} retryCount={}", record.crawlId(), crawlId, record.retryCount());
        return new CrawlSubmission(record.crawlId(), record.url(), record.status());
    }

    /**
     * Cancels a scheduled or running crawl. Returns false when no task is tracked for {@code crawlId}.
     */
    public boolean cancel(String crawlId) {
        TrackedCrawl task = inFlight.get(crawlId);
        if (task == null) {
            return false;
        }
        boolean cancelled = task.cancel(true);
        if (cancelled) {
            failCancelled(crawlId, task.url, task.domain);
        }
        log.info("crawl cancel requested crawlId={} cancelled={}", crawlId, cancelled);
        return cancelled;
    }

    /**
     * Waits until the record of {@code crawlId} is terminal, following its task handle while one
     * is tracked. Batch members that have not passed the gate yet are polled.
     *
     * @return the stored record, empty when no record exists
     * @throws TimeoutException when the record is still not terminal after {@code timeout}
     */
    public Optional<CrawlRecord> awaitCompletion(String crawlId, Duration timeout)
        throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            TrackedCrawl task = inFlight.get(crawlId);
            if (task != null) {
                try {
                    task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (CancellationException e) {
                    log.debug("awaited crawl was cancelled crawlId={}", crawlId);
                } catch (ExecutionException e) {
                    log.warn("awaited crawl failed crawlId={} error={}", crawlId,
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }
            }
            CrawlRecord record = repository.findCrawlRecord(crawlId);
            if (record == null || record.status().isTerminal()) {
                return Optional.ofNullable(record);
            }
            if (System.nanoTime() >= deadline) {
                throw new TimeoutException("crawl " + crawlId + " not finished after " + timeout);
            }
            Thread.sleep(AWAIT_POLL_MILLIS);
        }
    }

    public boolean isTracked(String crawlId) {
        return inFlight.containsKey(crawlId);
    }

    /**
     * Schedules an existing PENDING record, used when resuming work left by a previous process.
     */
    public void resume(CrawlRecord record) {
        schedule(record, null);
    }

    /**
     * Runs one crawl to a terminal state.
     *
     * Fetch, validation, extraction and classification problems end as a FAILED record. Only a
     * failure to store a successful result escapes, as {@link CrawlPersistenceException}.
     *
     * @return the status the record ended in, or null when the record was not PENDING
     */
    public CrawlStatus processSingle(String crawlId, CrawlRequest request) {
        String url = request.url();
        String domain = UrlUtils.domainOf(url);
        if (!repository.markProcessing(crawlId, Instant.now())) {
            log.info("crawl skipped crawlId={} reason=not_pending", crawlId);
            return null;
        }
        try {
            PageMetadata metadata = crawl(domain, request);
            return persistCompleted(crawlId, url, domain, metadata);
        } catch (CrawlFailureException e) {
            log.info("crawl failed crawlId={} url={} reason={} message={}", crawlId, url, e.reason().code(), e.getMessage());
            fail(crawlId, url, domain, e.reason(), e.getMessage(), e.statusCode(), e.responseTimeMs());
            return CrawlStatus.FAILED;
        } catch (InterruptedException e) {
            log.info("crawl cancelled crawlId={} url={}", crawlId, url);
            failInterrupted(crawlId, url, domain);
            return CrawlStatus.FAILED;
        } catch (CrawlPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("crawl failed unexpectedly crawlId={} url={}", crawlId, url, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            fail(crawlId, url, domain, CrawlFailureReason.UNEXPECTED_ERROR, message, null, null);
            return CrawlStatus.FAILED;
        }
    }

    private PageMetadata crawl(String domain, CrawlRequest request) throws InterruptedException {
        String url = request.url();
        if (domain == null || !UrlUtils.isHttpUrl(url)) {
            throw new CrawlFailureException(CrawlFailureReason.NETWORK_ERROR, "Invalid URL: " + url);
        }
        String userAgent = effectiveUserAgent(request);
        boolean respectRobots = request.respectRobotsTxt() && properties.getRobots().isRespect();
        if (respectRobots && !robotsTxtService.canCrawl(url, userAgent)) {
            throw new CrawlFailureException(CrawlFailureReason.ROBOTS_DISALLOWED, "Blocked by robots.txt");
        }
        checkInterrupted();

        double requestedDelay = request.crawlDelay() != null && request.crawlDelay() > 0
            ? request.crawlDelay()
            : properties.getDefaultCrawlDelaySeconds();
        if (respectRobots) {
            requestedDelay = Math.max(requestedDelay, robotsTxtService.getCrawlDelay(url, userAgent).orElse(0.0));
        }
        rateLimiter.acquire(domain, requestedDelay);
        checkInterrupted();

        HttpFetchResult fetch = fetcher.get(
            url,
            requestHeaders(request, userAgent),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            properties.getMaxContentSizeBytes()
        );
        if (HttpFetchResult.INTERRUPTED.equals(fetch.errorCode())) {
            throw new InterruptedException("fetch interrupted");
        }
        checkInterrupted();
        validate(fetch);

        String baseUrl = fetch.finalUrlOrRequested();
        Document document = parse(fetch, baseUrl);
        PageMetadata metadata = extractor.extract(document, baseUrl);
        if (properties.getClassification().isEnabled()) {
            List<TopicClassification> topics = classifier.classify(document, metadata);
            metadata = metadata.withTopics(classifier.enhance(topics, url));
        }
        checkInterrupted();
        return metadata.withFetchDetails(
            fetch.fetchedAt(),
            fetch.duration() == null ? 0L : fetch.duration().toMillis(),
            fetch.statusCode(),
            HashUtils.sha256Hex(fetch.bodyBytes()),
            fetch.headers()
        );
    }

    private void validate(HttpFetchResult fetch) {
        Long elapsed = fetch.duration() == null ? null : fetch.duration().toMillis();
        Integer status = fetch.statusCode() > 0 ? fetch.statusCode() : null;
        String errorCode = fetch.errorCode();
        if (errorCode != null && !HttpFetchResult.BODY_TOO_LARGE.equals(errorCode)) {
            CrawlFailureReason reason = HttpFetchResult.TIMEOUT.equals(errorCode)
                ? CrawlFailureReason.TIMEOUT
                : CrawlFailureReason.NETWORK_ERROR;
            String message = fetch.errorMessage() == null ? errorCode : errorCode + ": " + fetch.errorMessage();
            throw new CrawlFailureException(reason, message, status, elapsed);
        }
        if (fetch.statusCode() != 200) {
            throw new CrawlFailureException(CrawlFailureReason.HTTP_STATUS, "HTTP " + fetch.statusCode(), status, elapsed);
        }
        if (!isHtml(fetch.contentType())) {
            throw new CrawlFailureException(
                CrawlFailureReason.UNSUPPORTED_CONTENT_TYPE,
                "Unsupported content type: " + fetch.contentType(),
                status,
                elapsed
            );
        }
        if (HttpFetchResult.BODY_TOO_LARGE.equals(errorCode)
            || (fetch.bodyBytes() != null && fetch.bodyBytes().length > properties.getMaxContentSizeBytes())) {
            String message = fetch.errorMessage() == null
                ? "Content too large: limit is " + properties.getMaxContentSizeBytes() + " bytes"
                : fetch.errorMessage();
            throw new CrawlFailureException(CrawlFailureReason.CONTENT_TOO_LARGE, message, status, elapsed);
        }
    }

    static boolean isHtml(String contentType) {
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return normalized.contains("text/html") || normalized.contains("application/xhtml+xml");
    }

    private Document parse(HttpFetchResult fetch, String baseUrl) {
        byte[] body = fetch.bodyBytes() == null ? new byte[0] : fetch.bodyBytes();
        try {
            return Jsoup.parse(new ByteArrayInputStream(body), charsetOf(fetch.contentType()), baseUrl);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to parse document", e);
        }
    }

    private String charsetOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1);
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private CrawlStatus persistCompleted(String crawlId, String url, String domain, PageMetadata metadata) {
        Instant completedAt = Instant.now();
        boolean completed;
        try {
            completed = repository.completeCrawl(crawlId, domain, metadata, completedAt);
        } catch (DataAccessException e) {
            log.error("crawl result save failed crawlId={} url={}", crawlId, url, e);
            fail(crawlId, url, domain, CrawlFailureReason.PERSISTENCE_ERROR, "Failed to save crawl result: " + e.getMessage(), null, null);
            throw new CrawlPersistenceException(crawlId, "Failed to save crawl result for " + crawlId, e);
        }
        if (!completed) {
            log.info("crawl result discarded crawlId={} reason=no_longer_processing", crawlId);
            CrawlRecord current = repository.findCrawlRecord(crawlId);
            return current == null ? null : current.status();
        }

        CrawlRecord record = repository.findCrawlRecord(crawlId);
        if (record != null) {
            resultService.cacheResult(new CrawlResult(record, metadata));
        }
        recordHistory(new CrawlHistoryEntry(
            crawlId,
            url,
            domain,
            CrawlStatus.COMPLETED.dbValue(),
            metadata.statusCode(),
            metadata.responseTimeMs(),
            null,
            completedAt
        ));
        log.info(
            "crawl completed crawlId={} url={} status={} words={} topics={} responseMs={}",
            crawlId,
            url,
            metadata.statusCode(),
            metadata.wordCount(),
            metadata.topics().size(),
            metadata.responseTimeMs()
        );
        return CrawlStatus.COMPLETED;
    }

    private void failInterrupted(String crawlId, String url, String domain) {
        boolean interrupted = Thread.interrupted();
        try {
            fail(crawlId, url, domain, CrawlFailureReason.CANCELLED, "Crawl cancelled", null, null);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * A task cancelled before it ran still holds a PENDING record; it passes through PROCESSING
     * so FAILED is only ever reached from PROCESSING. Both writes are guarded, so nothing changes
     * when the worker already recorded an outcome.
     */
    private void failCancelled(String crawlId, String url, String domain) {
        try {
            repository.markProcessing(crawlId, Instant.now());
        } catch (DataAccessException e) {
            log.error("failed to record crawl cancellation crawlId={}", crawlId, e);
            return;
        }
        fail(crawlId, url, domain, CrawlFailureReason.CANCELLED, "Crawl cancelled", null, null);
    }

    private void fail(
        String crawlId,
        String url,
        String domain,
        CrawlFailureReason reason,
        String message,
        Integer statusCode,
        Long responseTimeMs
    ) {
        Instant now = Instant.now();
        try {
            if (!repository.markFailed(crawlId, reason.code(), message, now)) {
                return;
            }
        } catch (DataAccessException e) {
            log.error("failed to record crawl failure crawlId={} reason={}", crawlId, reason.code(), e);
            return;
        }
        recordHistory(new CrawlHistoryEntry(
            crawlId,
            url,
            domain == null ? "" : domain,
            reason.code(),
            statusCode,
            responseTimeMs,
            message,
            now
        ));
    }

    private void recordHistory(CrawlHistoryEntry entry) {
        try {
            repository.insertHistory(entry);
        } catch (DataAccessException e) {
            log.warn("crawl history write failed crawlId={} error={}", entry.crawlId(), e.getMessage());
        }
    }

    private List<CrawlRecord> createBatchRecords(String batchId, List<CrawlRequest> requests) {
        List<CrawlRecord> records = new ArrayList<>(requests.size());
        for (CrawlRequest request : requests) {
            records.add(newRecord(request, batchId, 0, null));
        }
        repository.insertCrawlRecords(records);
        return records;
    }

    private void runBatch(String batchId, List<CrawlRecord> records) {
        Semaphore gate = new Semaphore(properties.getBatchConcurrency());
        List<TrackedCrawl> tasks = new ArrayList<>(records.size());
        try {
            for (CrawlRecord record : records) {
                gate.acquire();
                tasks.add(schedule(record, gate::release));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("batch interrupted batchId={} scheduled={} total={}", batchId, tasks.size(), records.size());
            return;
        }

        int failedTasks = 0;
        for (TrackedCrawl task : tasks) {
            try {
                task.get();
            } catch (CancellationException e) {
                log.debug("batch member cancelled batchId={} crawlId={}", batchId, task.crawlId);
            } catch (ExecutionException e) {
                failedTasks++;
                log.warn("batch member failed batchId={} crawlId={} error={}", batchId, task.crawlId,
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("batch wait interrupted batchId={}", batchId);
                return;
            }
        }
        log.info("batch finished batchId={} total={} taskErrors={}", batchId, records.size(), failedTasks);
    }

    private TrackedCrawl schedule(CrawlRecord record, Runnable onDone) {
        TrackedCrawl task = new TrackedCrawl(record, onDone);
        inFlight.put(record.crawlId(), task);
        crawlExecutor.execute(task);
        return task;
    }

    private CrawlRecord newRecord(CrawlRequest request, String batchId, int retryCount, String retryOf) {
        String domain = UrlUtils.domainOf(request.url());
        return new CrawlRecord(
            UUID.randomUUID().toString(),
            request.url(),
            domain == null ? "" : domain,
            CrawlStatus.PENDING,
            null,
            null,
            retryCount,
            request.maxRetries(),
            request.priority(),
            request.crawlDelay(),
            request.respectRobotsTxt(),
            request.userAgent(),
            request.headers(),
            batchId,
            retryOf,
            Instant.now(),
            null,
            null
        );
    }

    private List<CrawlSubmission> toSubmissions(List<CrawlRecord> records) {
        List<CrawlSubmission> submissions = new ArrayList<>(records.size());
        for (CrawlRecord record : records) {
            submissions.add(new CrawlSubmission(record.crawlId(), record.url(), record.status()));
        }
        return submissions;
    }

    private Map<String, String> requestHeaders(CrawlRequest request, String userAgent) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("User-Agent", userAgent);
        headers.put("Accept", DEFAULT_ACCEPT);
        headers.put("Accept-Language", DEFAULT_ACCEPT_LANGUAGE);
        headers.putAll(request.headers());
        if (request.userAgent() != null && !request.userAgent().isBlank()) {
            headers.put("User-Agent", request.userAgent().trim());
        }
        return headers;
    }

    private String effectiveUserAgent(CrawlRequest request) {
        if (request.userAgent() != null && !request.userAgent().isBlank()) {
            return request.userAgent().trim();
        }
        String fromHeaders = null;
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if ("user-agent".equalsIgnoreCase(header.getKey())) {
                fromHeaders = header.getValue();
            }
        }
        return fromHeaders == null || fromHeaders.isBlank() ? properties.getUserAgent() : fromHeaders.trim();
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("crawl cancelled");
        }
    }

    private final class TrackedCrawl extends FutureTask<CrawlStatus> {
        private final String crawlId;
        private final String url;
        private final String domain;
        private final Runnable onDone;

        private TrackedCrawl(CrawlRecord record, Runnable onDone) {
            super(() -> processSingle(record.crawlId(), record.toRequest()));
            this.crawlId = record.crawlId();
            this.url = record.url();
            this.domain = record.domain();
            this.onDone = onDone;
        }

        @Override
        protected void done() {
            inFlight.remove(crawlId, this);
            if (onDone != null) {
                onDone.run();
            }
        }
    }
}
