package com.sitelens.crawl.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum CrawlStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Statuses a record may be in immediately before moving to this one.
     */
    public Set<CrawlStatus> predecessors() {
        return switch (this) {
            case PENDING -> EnumSet.noneOf(CrawlStatus.class);
            case PROCESSING -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.of(PROCESSING);
            case FAILED -> EnumSet.of(PROCESSING);
        };
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CrawlStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return CrawlStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
