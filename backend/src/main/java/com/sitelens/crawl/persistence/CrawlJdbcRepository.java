package com.sitelens.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitelens.crawl.model.CrawlHistoryEntry;
import com.sitelens.crawl.model.CrawlPriority;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.model.ImageMetadata;
import com.sitelens.crawl.model.LinkMetadata;
import com.sitelens.crawl.model.PageMetadata;
import com.sitelens.crawl.model.TopicClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final TypeReference<Map<String, String>> MAP_STRING = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_STRING = new TypeReference<>() {};
    private static final TypeReference<List<ImageMetadata>> LIST_IMAGES = new TypeReference<>() {};
    private static final TypeReference<List<LinkMetadata>> LIST_LINKS = new TypeReference<>() {};
    private static final TypeReference<List<TopicClassification>> LIST_TOPICS = new TypeReference<>() {};

    private static final String RECORD_COLUMNS = """
        crawl_id,
        url,
        domain,
        status,
        error_code,
        error_message,
        retry_count,
        max_retries,
        priority,
        crawl_delay,
        respect_robots_txt,
        user_agent,
        headers,
        batch_id,
        retry_of,
        created_at,
        processing_started_at,
        completed_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<CrawlRecord> recordMapper = this::mapRecord;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("crawl_queue", countTable("crawl_queue"));
        counts.put("page_metadata", countTable("page_metadata"));
        counts.put("crawl_history", countTable("crawl_history"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    public void insertCrawlRecord(CrawlRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlId", record.crawlId())
            .addValue("url", record.url())
            .addValue("domain", record.domain())
            .addValue("status", record.status().dbValue())
            .addValue("errorCode", record.errorCode())
            .addValue("errorMessage", record.errorMessage())
            .addValue("retryCount", record.retryCount())
            .addValue("maxRetries", record.maxRetries())
            .addValue("priority", record.priority().value())
            .addValue("crawlDelay", record.crawlDelay())
            .addValue("respectRobotsTxt", record.respectRobotsTxt())
            .addValue("userAgent", record.userAgent())
            .addValue("headers", writeJson(record.headers()))
            .addValue("batchId", record.batchId())
            .addValue("retryOf", record.retryOf())
            .addValue("createdAt", toTimestamp(record.createdAt() == null ? Instant.now() : record.createdAt()))
            .addValue("processingStartedAt", toTimestamp(record.processingStartedAt()))
            .addValue("completedAt", toTimestamp(record.completedAt()));
        jdbc.update(
            """
                INSERT INTO crawl_queue (
                    crawl_id,
                    url,
                    domain,
                    status,
                    error_code,
                    error_message,
                    retry_count,
                    max_retries,
                    priority,
                    crawl_delay,
                    respect_robots_txt,
                    user_agent,
                    headers,
                    batch_id,
                    retry_of,
                    created_at,
                    processing_started_at,
                    completed_at
                )
                VALUES (
                    :crawlId,
                    :url,
                    :domain,
                    :status,
                    :errorCode,
                    :errorMessage,
                    :retryCount,
                    :maxRetries,
                    :priority,
                    :crawlDelay,
                    :respectRobotsTxt,
                    :userAgent,
                    :headers,
                    :batchId,
                    :retryOf,
                    :createdAt,
                    :processingStartedAt,
                    :completedAt
                )
                """,
            params
        );
    }

    @Transactional
    public void insertCrawlRecords(List<CrawlRecord> records) {
        for (CrawlRecord record : records) {
            insertCrawlRecord(record);
        }
    }

    public CrawlRecord findCrawlRecord(String crawlId) {
        if (crawlId == null || crawlId.isBlank()) {
            return null;
        }
        List<CrawlRecord> rows = jdbc.query(
            "SELECT " + RECORD_COLUMNS + " FROM crawl_queue WHERE crawl_id = :crawlId",
            new MapSqlParameterSource("crawlId", crawlId),
            recordMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CrawlRecord> findCrawlRecords(String domain, CrawlStatus status, int limit, int offset) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, Math.min(limit, 1000)))
            .addValue("offset", Math.max(0, offset));
        String where = filterClause(domain, status, params);
        return jdbc.query(
            "SELECT " + RECORD_COLUMNS + " FROM crawl_queue" + where
                + " ORDER BY created_at DESC, crawl_id LIMIT :limit OFFSET :offset",
            params,
            recordMapper
        );
    }

    public long countCrawlRecords(String domain, CrawlStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = filterClause(domain, status, params);
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM crawl_queue" + where, params, Long.class);
        return count == null ? 0L : count;
    }

    public List<CrawlRecord> findCrawlRecordsByStatus(CrawlStatus status) {
        return jdbc.query(
            "SELECT " + RECORD_COLUMNS + " FROM crawl_queue WHERE status = :status ORDER BY priority DESC, created_at",
            new MapSqlParameterSource("status", status.dbValue()),
            recordMapper
        );
    }

    public List<CrawlRecord> findCrawlRecordsByBatch(String batchId) {
        return jdbc.query(
            "SELECT " + RECORD_COLUMNS + " FROM crawl_queue WHERE batch_id = :batchId ORDER BY created_at, crawl_id",
            new MapSqlParameterSource("batchId", batchId),
            recordMapper
        );
    }

    /**
     * PENDING to PROCESSING. Returns false when the record was not PENDING.
     */
    public boolean markProcessing(String crawlId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlId", crawlId)
            .addValue("status", CrawlStatus.PROCESSING.dbValue())
            .addValue("allowed", dbValues(CrawlStatus.PROCESSING.predecessors()))
            .addValue("startedAt", toTimestamp(startedAt));
        int updated = jdbc.update(
            """
                UPDATE crawl_queue
                SET status = :status,
                    processing_started_at = :startedAt
                WHERE crawl_id = :crawlId
                  AND status IN (:allowed)
                """,
            params
        );
        return updated > 0;
    }

    public boolean markCompleted(String crawlId, Instant completedAt) {
        return markTerminal(crawlId, CrawlStatus.COMPLETED, null, null, completedAt);
    }

    public boolean markFailed(String crawlId, String errorCode, String errorMessage, Instant completedAt) {
        return markTerminal(crawlId, CrawlStatus.FAILED, errorCode, errorMessage, completedAt);
    }

    private boolean markTerminal(
        String crawlId,
        CrawlStatus target,
        String errorCode,
        String errorMessage,
        Instant completedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlId", crawlId)
            .addValue("status", target.dbValue())
            .addValue("allowed", dbValues(target.predecessors()))
            .addValue("errorCode", errorCode)
            .addValue("errorMessage", errorMessage)
            .addValue("completedAt", toTimestamp(completedAt));
        int updated = jdbc.update(
            """
                UPDATE crawl_queue
                SET status = :status,
                    error_code = :errorCode,
                    error_message = :errorMessage,
                    completed_at = :completedAt
                WHERE crawl_id = :crawlId
                  AND status IN (:allowed)
                """,
            params
        );
        if (updated == 0) {
            log.debug("status transition skipped crawlId={} target={}", crawlId, target);
        }
        return updated > 0;
    }

    /**
     * Stores page metadata and moves the record to COMPLETED in one transaction. Returns false,
     * writing nothing, when the record is no longer PROCESSING.
     */
    @Transactional
    public boolean completeCrawl(String crawlId, String domain, PageMetadata metadata, Instant completedAt) {
        if (!markCompleted(crawlId, completedAt)) {
            return false;
        }
        insertPageMetadata(crawlId, domain, metadata);
        return true;
    }

    public void insertPageMetadata(String crawlId, String domain, PageMetadata metadata) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlId", crawlId)
            .addValue("url", metadata.url())
            .addValue("domain", domain)
            .addValue("title", metadata.title())
            .addValue("description", metadata.description())
            .addValue("keywords", writeJson(metadata.keywords()))
            .addValue("author", metadata.author())
            .addValue("publishedDate", metadata.publishedDate() == null ? null : toTimestamp(metadata.publishedDate().toInstant()))
            .addValue("canonicalUrl", metadata.canonicalUrl())
            .addValue("language", metadata.language())
            .addValue("contentType", metadata.contentType())
            .addValue("wordCount", metadata.wordCount())
            .addValue("images", writeJson(metadata.images()))
            .addValue("links", writeJson(metadata.links()))
            .addValue("topics", writeJson(metadata.topics()))
            .addValue("crawlTimestamp", toTimestamp(metadata.crawlTimestamp()))
            .addValue("responseTimeMs", metadata.responseTimeMs())
            .addValue("statusCode", metadata.statusCode())
            .addValue("contentHash", metadata.contentHash())
            .addValue("headers", writeJson(metadata.headers()))
            .addValue("createdAt", toTimestamp(Instant.now()));
        jdbc.update(
            """
                INSERT INTO page_metadata (
                    crawl_id,
                    url,
                    domain,
                    title,
                    description,
                    keywords,
                    author,
                    published_date,
                    canonical_url,
                    language,
                    content_type,
                    word_count,
                    images,
                    links,
                    topics,
                    crawl_timestamp,
                    response_time_ms,
                    status_code,
                    content_hash,
                    headers,
                    created_at
                )
                VALUES (
                    :crawlId,
                    :url,
                    :domain,
                    :title,
                    :description,
                    :keywords,
                    :author,
                    :publishedDate,
                    :canonicalUrl,
                    :language,
                    :contentType,
                    :wordCount,
                    :images,
                    :links,
                    :topics,
                    :crawlTimestamp,
                    :responseTimeMs,
                    :statusCode,
                    :contentHash,
                    :headers,
                    :createdAt
                )
                """,
            params
        );
    }

    public PageMetadata findPageMetadata(String crawlId) {
        List<PageMetadata> rows = jdbc.query(
            """
                SELECT url,
                       title,
                       description,
                       keywords,
                       author,
                       published_date,
                       canonical_url,
                       language,
                       content_type,
                       word_count,
                       images,
                       links,
                       topics,
                       crawl_timestamp,
                       response_time_ms,
                       status_code,
                       content_hash,
                       headers
                FROM page_metadata
                WHERE crawl_id = :crawlId
                """,
            new MapSqlParameterSource("crawlId", crawlId),
            (rs, rowNum) -> new PageMetadata(
                rs.getString("url"),
                rs.getString("title"),
                rs.getString("description"),
                readJson(rs.getString("keywords"), LIST_STRING),
                rs.getString("author"),
                toOffsetDateTime(rs.getTimestamp("published_date")),
                rs.getString("canonical_url"),
                rs.getString("language"),
                rs.getString("content_type"),
                rs.getInt("word_count"),
                readJson(rs.getString("images"), LIST_IMAGES),
                readJson(rs.getString("links"), LIST_LINKS),
                readJson(rs.getString("topics"), LIST_TOPICS),
                toInstant(rs.getTimestamp("crawl_timestamp")),
                rs.getLong("response_time_ms"),
                rs.getInt("status_code"),
                rs.getString("content_hash"),
                readJson(rs.getString("headers"), MAP_STRING)
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Removes the record and its page metadata. Crawl history is kept.
     */
    @Transactional
    public boolean deleteCrawlRecord(String crawlId) {
        MapSqlParameterSource params = new MapSqlParameterSource("crawlId", crawlId);
        jdbc.update("DELETE FROM page_metadata WHERE crawl_id = :crawlId", params);
        return jdbc.update("DELETE FROM crawl_queue WHERE crawl_id = :crawlId", params) > 0;
    }

    public void insertHistory(CrawlHistoryEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlId", entry.crawlId())
            .addValue("url", entry.url())
            .addValue("domain", entry.domain())
            .addValue("status", entry.status())
            .addValue("statusCode", entry.statusCode())
            .addValue("responseTimeMs", entry.responseTimeMs())
            .addValue("errorMessage", entry.errorMessage())
            .addValue("crawlTimestamp", toTimestamp(entry.crawlTimestamp() == null ? Instant.now() : entry.crawlTimestamp()));
        jdbc.update(
            """
                INSERT INTO crawl_history (
                    crawl_id,
                    url,
                    domain,
                    status,
                    status_code,
                    response_time_ms,
                    error_message,
                    crawl_timestamp
                )
                VALUES (
                    :crawlId,
                    :url,
                    :domain,
                    :status,
                    :statusCode,
                    :responseTimeMs,
                    :errorMessage,
                    :crawlTimestamp
                )
                """,
            params
        );
    }

    public List<CrawlHistoryEntry> findHistory(String crawlId) {
        return jdbc.query(
            """
                SELECT crawl_id,
                       url,
                       domain,
                       status,
                       status_code,
                       response_time_ms,
                       error_message,
                       crawl_timestamp
                FROM crawl_history
                WHERE crawl_id = :crawlId
                ORDER BY crawl_timestamp, id
                """,
            new MapSqlParameterSource("crawlId", crawlId),
            (rs, rowNum) -> new CrawlHistoryEntry(
                rs.getString("crawl_id"),
                rs.getString("url"),
                rs.getString("domain"),
                rs.getString("status"),
                rs.getObject("status_code", Integer.class),
                rs.getObject("response_time_ms", Long.class),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("crawl_timestamp"))
            )
        );
    }

    private String filterClause(String domain, CrawlStatus status, MapSqlParameterSource params) {
        StringBuilder where = new StringBuilder();
        if (domain != null && !domain.isBlank()) {
            where.append(" WHERE domain = :domain");
            params.addValue("domain", domain.trim().toLowerCase(Locale.ROOT));
        }
        if (status != null) {
            where.append(where.length() == 0 ? " WHERE " : " AND ").append("status = :status");
            params.addValue("status", status.dbValue());
        }
        return where.toString();
    }

    private CrawlRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        Double crawlDelay = rs.getObject("crawl_delay", Double.class);
        return new CrawlRecord(
            rs.getString("crawl_id"),
            rs.getString("url"),
            rs.getString("domain"),
            CrawlStatus.fromDbValue(rs.getString("status")),
            rs.getString("error_code"),
            rs.getString("error_message"),
            rs.getInt("retry_count"),
            rs.getInt("max_retries"),
            CrawlPriority.fromValue(rs.getInt("priority")),
            crawlDelay,
            rs.getBoolean("respect_robots_txt"),
            rs.getString("user_agent"),
            readJson(rs.getString("headers"), MAP_STRING),
            rs.getString("batch_id"),
            rs.getString("retry_of"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("processing_started_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private List<String> dbValues(Collection<CrawlStatus> statuses) {
        return statuses.stream().map(CrawlStatus::dbValue).collect(Collectors.toList());
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("unreadable json column type={} error={}", type.getType(), e.getOriginalMessage());
            return null;
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable to json", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private OffsetDateTime toOffsetDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant().atOffset(ZoneOffset.UTC);
    }
}
