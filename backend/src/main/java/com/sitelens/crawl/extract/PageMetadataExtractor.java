package com.sitelens.crawl.extract;

import com.sitelens.crawl.model.ImageMetadata;
import com.sitelens.crawl.model.LinkMetadata;
import com.sitelens.crawl.model.PageMetadata;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link PageMetadata} from a parsed page. Every field walks an ordered chain of
 * selectors and keeps the first non-empty value. Never touches the network and never
 * mutates the document.
 */
@Component
public class PageMetadataExtractor {
    static final int MAX_TITLE_LENGTH = 500;
    static final int MAX_DESCRIPTION_LENGTH = 1000;
    static final int MAX_KEYWORDS = 20;
    static final int MAX_AUTHOR_LENGTH = 200;
    static final int MAX_LANGUAGE_LENGTH = 10;
    static final int MAX_LINK_TEXT_LENGTH = 200;
    static final int MAX_IMAGES = 50;
    static final int MAX_LINKS = 100;
    static final int MIN_IMAGE_DIMENSION = 50;

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<Function<Document, Optional<String>>> titleSelectors = List.of(
        doc -> firstText(doc, "title"),
        doc -> firstText(doc, "h1"),
        doc -> firstContentOrText(doc, "[property=og:title]"),
        doc -> firstContentOrText(doc, "[name=twitter:title]"),
        doc -> firstContentOrText(doc, "[itemprop=name]")
    );

    private final List<Function<Document, Optional<String>>> descriptionSelectors = List.of(
        doc -> firstContentOrText(doc, "meta[name=description]"),
        doc -> firstContentOrText(doc, "[property=og:description]"),
        doc -> firstContentOrText(doc, "[name=twitter:description]"),
        doc -> firstContentOrText(doc, "[itemprop=description]"),
        doc -> firstText(doc, "p")
    );

    private final List<Function<Document, Optional<String>>> authorSelectors = List.of(
        doc -> firstContentOrText(doc, "meta[name=author]"),
        doc -> firstContentOrText(doc, "[property=article:author]"),
        doc -> firstContentOrText(doc, "[name=twitter:creator]"),
        doc -> firstContentOrText(doc, "[itemprop=author]"),
        doc -> firstContentOrText(doc, "[rel=author]")
    );

    private final List<Function<Document, Optional<OffsetDateTime>>> publishedDateSelectors = List.of(
        doc -> firstDate(doc, "[property=article:published_time]"),
        doc -> firstDate(doc, "[name=publication_date]"),
        doc -> firstDate(doc, "[itemprop=datePublished]"),
        doc -> firstDate(doc, "meta[name=date]"),
        doc -> firstDate(doc, "time[datetime]")
    );

    public PageMetadata extract(Document document, String baseUrl) {
        return new PageMetadata(
            baseUrl,
            firstMatch(titleSelectors, document)
                .map(value -> DocumentText.truncate(DocumentText.collapseWhitespace(value), MAX_TITLE_LENGTH))
                .orElse(null),
            firstMatch(descriptionSelectors, document)
                .map(value -> DocumentText.truncate(DocumentText.collapseWhitespace(value), MAX_DESCRIPTION_LENGTH))
                .orElse(null),
            extractKeywords(document),
            firstMatch(authorSelectors, document)
                .map(value -> DocumentText.truncate(value, MAX_AUTHOR_LENGTH))
                .orElse(null),
            firstMatch(publishedDateSelectors, document).orElse(null),
            extractCanonicalUrl(document, baseUrl),
            extractLanguage(document),
            "text/html",
            countWords(document),
            extractImages(document, baseUrl),
            extractLinks(document, baseUrl),
            List.of(),
            null,
            0L,
            0,
            null,
            null
        );
    }

    List<String> extractKeywords(Document document) {
        Set<String> keywords = new LinkedHashSet<>();
        for (Element element : document.select("meta[name=keywords], [property=article:tag], [rel=tag]")) {
            if (element.hasAttr("content")) {
                for (String part : element.attr("content").split("[,;]")) {
                    addKeyword(keywords, part);
                }
            } else {
                addKeyword(keywords, element.text());
            }
        }
        List<String> ordered = new ArrayList<>(keywords);
        return ordered.size() > MAX_KEYWORDS ? ordered.subList(0, MAX_KEYWORDS) : ordered;
    }

    String extractCanonicalUrl(Document document, String baseUrl) {
        Element canonical = document.selectFirst("link[rel=canonical][href]");
        if (canonical != null && !canonical.attr("href").isBlank()) {
            String resolved = resolve(baseUrl, canonical.attr("href").trim());
            if (resolved != null) {
                return resolved;
            }
        }
        Element ogUrl = document.selectFirst("meta[property=og:url][content]");
        if (ogUrl != null && !ogUrl.attr("content").isBlank()) {
            return ogUrl.attr("content").trim();
        }
        return null;
    }

    String extractLanguage(Document document) {
        Element html = document.selectFirst("html[lang]");
        if (html != null && !html.attr("lang").isBlank()) {
            return DocumentText.truncate(html.attr("lang").trim(), MAX_LANGUAGE_LENGTH);
        }
        for (Element meta : document.select("meta[http-equiv][content]")) {
            if ("content-language".equalsIgnoreCase(meta.attr("http-equiv")) && !meta.attr("content").isBlank()) {
                return DocumentText.truncate(meta.attr("content").trim(), MAX_LANGUAGE_LENGTH);
            }
        }
        return null;
    }

    int countWords(Document document) {
        Matcher matcher = WORD.matcher(DocumentText.visibleText(document));
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    List<ImageMetadata> extractImages(Document document, String baseUrl) {
        List<ImageMetadata> images = new ArrayList<>();
        for (Element img : document.select("img[src]")) {
            if (images.size() >= MAX_IMAGES) {
                break;
            }
            String src = img.attr("src").trim();
            if (src.isEmpty() || src.toLowerCase(Locale.ROOT).startsWith("data:")) {
                continue;
            }
            Integer width = intAttr(img, "width");
            Integer height = intAttr(img, "height");
            if (width != null && height != null && (width < MIN_IMAGE_DIMENSION || height < MIN_IMAGE_DIMENSION)) {
                continue;
            }
            String url = resolve(baseUrl, src);
            if (url == null) {
                continue;
            }
            images.add(new ImageMetadata(url, blankToNull(img.attr("alt")), blankToNull(img.attr("title")), width, height));
        }
        return images;
    }

    List<LinkMetadata> extractLinks(Document document, String baseUrl) {
        List<LinkMetadata> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            if (links.size() >= MAX_LINKS) {
                break;
            }
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                continue;
            }
            String url = resolve(baseUrl, href);
            if (url == null) {
                continue;
            }
            String text = blankToNull(DocumentText.truncate(anchor.text().trim(), MAX_LINK_TEXT_LENGTH));
            String rel = anchor.attr("rel").isBlank() ? null : anchor.attr("rel").trim().split("\\s+")[0];
            links.add(new LinkMetadata(url, text, blankToNull(anchor.attr("title")), rel));
        }
        return links;
    }

    private static <T> Optional<T> firstMatch(List<Function<Document, Optional<T>>> selectors, Document document) {
        for (Function<Document, Optional<T>> selector : selectors) {
            Optional<T> value = selector.apply(document);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstText(Document document, String cssQuery) {
        Element element = document.selectFirst(cssQuery);
        return element == null ? Optional.empty() : nonBlank(element.text());
    }

    private static Optional<String> firstContentOrText(Document document, String cssQuery) {
        Element element = document.selectFirst(cssQuery);
        if (element == null) {
            return Optional.empty();
        }
        return nonBlank(element.hasAttr("content") ? element.attr("content") : element.text());
    }

    private static Optional<OffsetDateTime> firstDate(Document document, String cssQuery) {
        Elements elements = document.select(cssQuery);
        for (Element element : elements) {
            String raw;
            if (element.hasAttr("content")) {
                raw = element.attr("content");
            } else if (element.hasAttr("datetime")) {
                raw = element.attr("datetime");
            } else {
                raw = element.text();
            }
            Optional<OffsetDateTime> parsed = PublishedDateParser.parse(raw);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static void addKeyword(Set<String> keywords, String candidate) {
        if (candidate == null) {
            return;
        }
        String trimmed = candidate.trim();
        if (!trimmed.isEmpty()) {
            keywords.add(trimmed);
        }
    }

    private static Optional<String> nonBlank(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer intAttr(Element element, String name) {
        String raw = element.attr(name).trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String resolve(String baseUrl, String href) {
        try {
            if (baseUrl == null || baseUrl.isBlank()) {
                return new URL(href).toExternalForm();
            }
            return new URL(new URL(baseUrl), href).toExternalForm();
        } catch (MalformedURLException e) {
            return null;
        }
    }
}
