package com.sitelens.crawl.model;

public record ImageMetadata(
    String url,
    String altText,
    String title,
    Integer width,
    Integer height
) {
}
