package com.sitelens.crawl.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public record PageMetadata(
    String url,
    String title,
    String description,
    List<String> keywords,
    String author,
    OffsetDateTime publishedDate,
    String canonicalUrl,
    String language,
    String contentType,
    int wordCount,
    List<ImageMetadata> images,
    List<LinkMetadata> links,
    List<TopicClassification> topics,
    Instant crawlTimestamp,
    long responseTimeMs,
    int statusCode,
    String contentHash,
    Map<String, String> headers
) {
    public PageMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        images = images == null ? List.of() : List.copyOf(images);
        links = links == null ? List.of() : List.copyOf(links);
        topics = topics == null ? List.of() : List.copyOf(topics);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public PageMetadata withTopics(List<TopicClassification> newTopics) {
        return new PageMetadata(
            url,
            title,
            description,
            keywords,
            author,
            publishedDate,
            canonicalUrl,
            language,
            contentType,
            wordCount,
            images,
            links,
            newTopics,
            crawlTimestamp,
            responseTimeMs,
            statusCode,
            contentHash,
            headers
        );
    }

    public PageMetadata withFetchDetails(
        Instant fetchedAt,
        long responseTimeMillis,
        int httpStatus,
        String hash,
        Map<String, String> responseHeaders
    ) {
        return new PageMetadata(
            url,
            title,
            description,
            keywords,
            author,
            publishedDate,
            canonicalUrl,
            language,
            contentType,
            wordCount,
            images,
            links,
            topics,
            fetchedAt,
            responseTimeMillis,
            httpStatus,
            hash,
            responseHeaders
        );
    }
}
