package com.sitelens.crawl.model;

public record LinkMetadata(
    String url,
    String text,
    String title,
    String rel
) {
}
