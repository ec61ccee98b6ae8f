package com.sitelens.crawl.classify;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.TopicClassification;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TopicClassifierTest {

    private final TopicClassifier classifier = new TopicClassifier(new CrawlerProperties());

    @Test
    void fiftyWordEcommerceTextScoresPointEight() {
        String text = fiftyWordsWith("buy", "buy", "buy", "cart", "cart");

        Map<String, Double> scores = classifier.scoreTopics(text);

        assertThat(scores).containsOnlyKeys("ecommerce");
        assertThat(scores.get("ecommerce")).isCloseTo(0.80, within(1e-9));

        List<TopicClassification> topics = classifier.classifyText(text);
        assertThat(topics).hasSize(1);
        assertEquals("ecommerce", topics.get(0).topic());
        assertThat(topics.get(0).confidence()).isCloseTo(0.80, within(1e-9));
        assertEquals(List.of("buy", "cart"), topics.get(0).keywords());
    }

    @Test
    void ecommerceTableHasTwentyTerms() {
        assertEquals(20, TopicClassifier.TOPIC_KEYWORDS.get("ecommerce").size());
        assertEquals(12, classifier.topics().size());
    }

    @Test
    void topicsBelowMinimumConfidenceAreDropped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getClassification().setMinConfidence(0.9);
        TopicClassifier strict = new TopicClassifier(properties);

        assertThat(strict.classifyText(fiftyWordsWith("buy", "buy", "buy", "cart", "cart"))).isEmpty();
    }

    @Test
    void scoresAreClampedToOne() {
        String text = "shop buy purchase product cart checkout payment shipping delivery order price discount";

        List<TopicClassification> topics = classifier.classifyText(text);

        assertEquals("ecommerce", topics.get(0).topic());
        assertEquals(1.0, topics.get(0).confidence());
        assertThat(classifier.scoreTopics(text).get("ecommerce")).isGreaterThan(1.0);
    }

    @Test
    void urlMatchBoostsExistingTopicWithoutExceedingOne() {
        List<TopicClassification> textTopics = List.of(
            new TopicClassification("ecommerce", 0.95, List.of("buy")),
            new TopicClassification("business", 0.6, List.of("company"))
        );

        List<TopicClassification> enhanced = classifier.enhance(textTopics, "https://store.example/shop/item");

        assertEquals("ecommerce", enhanced.get(0).topic());
        assertEquals(1.0, enhanced.get(0).confidence());
        assertEquals(List.of("buy"), enhanced.get(0).keywords());
        assertEquals("business", enhanced.get(1).topic());
    }

    @Test
    void urlOnlyTopicIsAppendedAtUrlConfidence() {
        List<TopicClassification> textTopics = List.of(new TopicClassification("travel", 0.9, List.of("hotel")));

        List<TopicClassification> enhanced = classifier.enhance(textTopics, "https://example.com/recipe/pie");

        assertThat(enhanced).extracting(TopicClassification::topic).containsExactly("travel", "food");
        assertEquals(TopicClassifier.URL_CONFIDENCE, enhanced.get(1).confidence());
        assertEquals(List.of("recipe"), enhanced.get(1).keywords());
    }

    @Test
    void resultIsCappedAtMaxTopics() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getClassification().setMaxTopics(1);
        TopicClassifier capped = new TopicClassifier(properties);
        String text = "shop buy cart checkout football basketball soccer tennis golf";

        List<TopicClassification> topics = capped.classifyText(text);

        assertThat(topics).hasSize(1);
    }

    @Test
    void classificationIsDeterministic() {
        String text = "Latest news report on cloud software and startup investment strategy in the market";

        assertEquals(classifier.classifyText(text), classifier.classifyText(text));
        assertEquals(classifier.scoreTopics(text), classifier.scoreTopics(text));
    }

    @Test
    void blankTextHasNoTopics() {
        assertThat(classifier.classifyText("   ")).isEmpty();
        assertThat(classifier.classifyByUrl(null)).isEmpty();
    }

    private static String fiftyWordsWith(String... keywords) {
        List<String> words = new ArrayList<>(List.of(keywords));
        words.addAll(Collections.nCopies(50 - keywords.length, "lorem"));
        return String.join(" ", words);
    }
}
