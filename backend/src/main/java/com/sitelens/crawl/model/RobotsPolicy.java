package com.sitelens.crawl.model;

import java.time.Instant;

public record RobotsPolicy(
    String domain,
    Outcome outcome,
    String content,
    Instant fetchedAt
) {
    public enum Outcome {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    public static RobotsPolicy found(String domain, String content) {
        return new RobotsPolicy(domain, Outcome.FOUND, content, Instant.now());
    }

    public static RobotsPolicy notFound(String domain) {
        return new RobotsPolicy(domain, Outcome.NOT_FOUND, null, Instant.now());
    }

    public static RobotsPolicy unavailable(String domain) {
        return new RobotsPolicy(domain, Outcome.UNAVAILABLE, null, Instant.now());
    }
}
