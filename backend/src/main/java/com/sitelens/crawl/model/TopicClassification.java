package com.sitelens.crawl.model;

import java.util.List;

public record TopicClassification(
    String topic,
    double confidence,
    List<String> keywords
) {
    public TopicClassification {
        confidence = clamp(confidence);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public TopicClassification boosted(double amount) {
        return new TopicClassification(topic, confidence + amount, keywords);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
