package com.sitelens.crawl.model;

public enum CrawlPriority {
    LOW(1),
    NORMAL(5),
    HIGH(10);

    private final int value;

    CrawlPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static CrawlPriority fromValue(Integer value) {
        if (value == null) {
            return NORMAL;
        }
        if (value >= HIGH.value) {
            return HIGH;
        }
        if (value <= LOW.value) {
            return LOW;
        }
        return NORMAL;
    }
}
