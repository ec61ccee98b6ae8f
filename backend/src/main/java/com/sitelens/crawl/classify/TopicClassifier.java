package com.sitelens.crawl.classify;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.extract.DocumentText;
import com.sitelens.crawl.model.PageMetadata;
import com.sitelens.crawl.model.TopicClassification;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-table topic classifier. Scores are a pure function of the page text and URL.
 */
@Component
public class TopicClassifier {
    static final int MAX_BODY_CHARS = 10_000;
    static final double URL_CONFIDENCE = 0.7;
    static final double URL_MATCH_BOOST = 0.2;
    static final int MAX_TOPIC_KEYWORDS = 5;

    static final Map<String, List<String>> TOPIC_KEYWORDS = topicKeywords();
    static final Map<String, List<String>> URL_PATTERNS = urlPatterns();

    private static final Comparator<TopicClassification> BY_CONFIDENCE_DESC =
        Comparator.comparingDouble(TopicClassification::confidence).reversed();

    private final CrawlerProperties properties;
    private final Map<String, Pattern> keywordPatterns;

    public TopicClassifier(CrawlerProperties properties) {
        this.properties = properties;
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : TOPIC_KEYWORDS.entrySet()) {
            String alternation = entry.getValue().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
            patterns.put(
                entry.getKey(),
                Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            );
        }
        this.keywordPatterns = patterns;
    }

    public List<TopicClassification> classify(Document document, PageMetadata metadata) {
        List<String> parts = new ArrayList<>();
        if (metadata != null) {
            addIfPresent(parts, metadata.title());
            addIfPresent(parts, metadata.description());
            addIfPresent(parts, String.join(" ", metadata.keywords()));
        }
        addIfPresent(parts, DocumentText.truncate(DocumentText.visibleText(document), MAX_BODY_CHARS));
        return classifyText(String.join(" ", parts));
    }

    public List<TopicClassification> classifyText(String text) {
        List<TopicClassification> classifications = new ArrayList<>();
        for (Map.Entry<String, Double> score : scoreTopics(text).entrySet()) {
            if (score.getValue() >= properties.getClassification().getMinConfidence()) {
                classifications.add(new TopicClassification(
                    score.getKey(),
                    score.getValue(),
                    extractTopicKeywords(text, score.getKey())
                ));
            }
        }
        return rankAndCap(classifications);
    }

    /**
     * Raw, unclamped score per topic that matched at least one keyword, in table order.
     */
    public Map<String, Double> scoreTopics(String text) {
        Map<String, Double> scores = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return scores;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int wordCount = lower.trim().split("\\s+").length;
        for (Map.Entry<String, Pattern> entry : keywordPatterns.entrySet()) {
            List<String> matches = findAll(entry.getValue(), lower);
            if (matches.isEmpty()) {
                continue;
            }
            int uniqueCount = new LinkedHashSet<>(matches).size();
            double baseScore = (double) uniqueCount / TOPIC_KEYWORDS.get(entry.getKey()).size();
            double frequencyBoost = Math.min((double) matches.size() / wordCount * 100.0, 0.5);
            double diversityBoost = Math.min(uniqueCount / 10.0, 0.3);
            scores.put(entry.getKey(), baseScore + frequencyBoost + diversityBoost);
        }
        return scores;
    }

    public List<TopicClassification> classifyByUrl(String url) {
        if (url == null || url.isBlank()) {
            return List.of();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        List<TopicClassification> classifications = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : URL_PATTERNS.entrySet()) {
            for (String pattern : entry.getValue()) {
                if (lower.contains(pattern)) {
                    classifications.add(new TopicClassification(entry.getKey(), URL_CONFIDENCE, List.of(stripSlashes(pattern))));
                    break;
                }
            }
        }
        return classifications;
    }

    /**
     * Merges URL evidence into text topics: topics found by both get a boost, URL-only topics are appended.
     */
    public List<TopicClassification> enhance(List<TopicClassification> textTopics, String url) {
        Map<String, TopicClassification> merged = new LinkedHashMap<>();
        for (TopicClassification topic : textTopics) {
            merged.put(topic.topic(), topic);
        }
        for (TopicClassification urlTopic : classifyByUrl(url)) {
            TopicClassification existing = merged.get(urlTopic.topic());
            merged.put(urlTopic.topic(), existing == null ? urlTopic : existing.boosted(URL_MATCH_BOOST));
        }
        return rankAndCap(new ArrayList<>(merged.values()));
    }

    /**
     * Up to five keywords of {@code topic} found in {@code text}, most frequent first; ties keep
     * first-occurrence order.
     */
    public List<String> extractTopicKeywords(String text, String topic) {
        Pattern pattern = keywordPatterns.get(topic);
        if (pattern == null || text == null) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String match : findAll(pattern, text.toLowerCase(Locale.ROOT))) {
            counts.merge(match, 1, Integer::sum);
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(MAX_TOPIC_KEYWORDS)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    public Set<String> topics() {
        return TOPIC_KEYWORDS.keySet();
    }

    private List<TopicClassification> rankAndCap(List<TopicClassification> classifications) {
        List<TopicClassification> ranked = new ArrayList<>(classifications);
        ranked.sort(BY_CONFIDENCE_DESC);
        int maxTopics = properties.getClassification().getMaxTopics();
        return ranked.size() > maxTopics ? List.copyOf(ranked.subList(0, maxTopics)) : List.copyOf(ranked);
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }

    private static String stripSlashes(String pattern) {
        int start = 0;
        int end = pattern.length();
        while (start < end && pattern.charAt(start) == '/') {
            start++;
        }
        while (end > start && pattern.charAt(end - 1) == '/') {
            end--;
        }
        return pattern.substring(start, end);
    }

    private static Map<String, List<String>> topicKeywords() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("technology", List.of(
            "software", "technology", "computer", "programming", "code", "development",
            "api", "database", "server", "cloud", "ai", "artificial intelligence",
            "machine learning", "algorithm", "data", "analytics", "digital"));
        table.put("business", List.of(
            "business", "company", "corporate", "enterprise", "startup", "entrepreneur",
            "marketing", "sales", "revenue", "profit", "investment", "finance",
            "strategy", "management", "leadership", "market", "customer"));
        table.put("ecommerce", List.of(
            "shop", "buy", "purchase", "product", "cart", "checkout", "payment",
            "shipping", "delivery", "order", "price", "discount", "sale",
            "retail", "store", "marketplace", "amazon", "ebay", "coupon", "wishlist"));
        table.put("news", List.of(
            "news", "breaking", "report", "journalist", "article", "story",
            "update", "latest", "headline", "media", "press", "newspaper",
            "magazine", "broadcast", "coverage"));
        table.put("health", List.of(
            "health", "medical", "doctor", "hospital", "medicine", "treatment",
            "patient", "disease", "symptoms", "diagnosis", "therapy", "wellness",
            "fitness", "nutrition", "diet", "exercise"));
        table.put("education", List.of(
            "education", "school", "university", "college", "student", "teacher",
            "course", "learning", "study", "academic", "research", "science",
            "knowledge", "training", "tutorial", "lesson"));
        table.put("entertainment", List.of(
            "movie", "film", "music", "game", "entertainment", "celebrity",
            "actor", "actress", "director", "album", "song", "concert",
            "theater", "show", "television", "streaming"));
        table.put("sports", List.of(
            "sports", "football", "basketball", "baseball", "soccer", "tennis",
            "golf", "hockey", "athlete", "team", "game", "match", "championship",
            "league", "tournament", "olympics"));
        table.put("travel", List.of(
            "travel", "vacation", "hotel", "flight", "destination", "tourism",
            "trip", "journey", "adventure", "booking", "resort", "restaurant",
            "attractions", "sightseeing", "guide"));
        table.put("food", List.of(
            "food", "recipe", "cooking", "restaurant", "cuisine", "dish",
            "meal", "ingredients", "chef", "kitchen", "dining", "menu",
            "taste", "flavor", "nutrition", "diet"));
        table.put("lifestyle", List.of(
            "lifestyle", "fashion", "beauty", "home", "family", "relationship",
            "parenting", "wedding", "personal", "advice", "tips", "guide",
            "culture", "society", "community"));
        table.put("finance", List.of(
            "finance", "money", "investment", "stock", "market", "trading",
            "banking", "loan", "credit", "debt", "insurance", "retirement",
            "savings", "budget", "economic", "currency"));
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, List<String>> urlPatterns() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("ecommerce", List.of("/shop", "/buy", "/product", "/cart", "/checkout", "amazon.com", "ebay.com"));
        table.put("news", List.of("/news", "/article", "/story", "cnn.com", "bbc.com", "reuters.com"));
        table.put("technology", List.of("/tech", "/software", "/api", "/docs", "github.com", "stackoverflow.com"));
        table.put("business", List.of("/business", "/company", "/corporate", "/enterprise"));
        table.put("education", List.of("/education", "/course", "/learn", "/tutorial", "edu"));
        table.put("entertainment", List.of("/entertainment", "/movie", "/music", "/game"));
        table.put("sports", List.of("/sports", "/football", "/basketball", "espn.com"));
        table.put("travel", List.of("/travel", "/hotel", "/flight", "/vacation", "booking.com"));
        table.put("food", List.of("/food", "/recipe", "/restaurant", "/cooking"));
        table.put("health", List.of("/health", "/medical", "/doctor", "/hospital"));
        return Collections.unmodifiableMap(table);
    }
}
