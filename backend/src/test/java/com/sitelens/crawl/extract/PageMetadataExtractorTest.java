package com.sitelens.crawl.extract;

import com.sitelens.crawl.model.ImageMetadata;
import com.sitelens.crawl.model.LinkMetadata;
import com.sitelens.crawl.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PageMetadataExtractorTest {
    private static final String BASE = "https://shop.example.com/products/toaster";

    private final PageMetadataExtractor extractor = new PageMetadataExtractor();

    @Test
    void extractsTitleAndKeywords() {
        Document doc = Jsoup.parse("""
            <html><head>
              <title>Toaster</title>
              <meta name="keywords" content="toaster, kitchen">
            </head><body><p>Two slots.</p></body></html>
            """, BASE);

        PageMetadata metadata = extractor.extract(doc, BASE);

        assertEquals("Toaster", metadata.title());
        assertEquals(List.of("toaster", "kitchen"), metadata.keywords());
        assertEquals("text/html", metadata.contentType());
        assertEquals(BASE, metadata.url());
    }

    @Test
    void fallsBackThroughSelectorChains() {
        Document doc = Jsoup.parse("""
            <html lang="en-GB"><head>
              <meta property="og:description" content="Open graph summary">
              <meta property="article:author" content="Sam Writer">
              <meta property="article:published_time" content="2024-03-05T10:15:30Z">
              <link rel="canonical" href="/products/toaster-2000">
            </head><body><h1>  Heading   Title </h1><p>First paragraph.</p></body></html>
            """, BASE);

        PageMetadata metadata = extractor.extract(doc, BASE);

        assertEquals("Heading Title", metadata.title());
        assertEquals("Open graph summary", metadata.description());
        assertEquals("Sam Writer", metadata.author());
        assertEquals(OffsetDateTime.of(2024, 3, 5, 10, 15, 30, 0, ZoneOffset.UTC), metadata.publishedDate());
        assertEquals("https://shop.example.com/products/toaster-2000", metadata.canonicalUrl());
        assertEquals("en-GB", metadata.language());
    }

    @Test
    void descriptionFallsBackToFirstParagraph() {
        Document doc = Jsoup.parse("<html><body><p>Only paragraph here.</p><p>Second.</p></body></html>", BASE);

        assertEquals("Only paragraph here.", extractor.extract(doc, BASE).description());
    }

    @Test
    void missingFieldsAreAbsent() {
        Document doc = Jsoup.parse("<html><body></body></html>", BASE);

        PageMetadata metadata = extractor.extract(doc, BASE);

        assertNull(metadata.title());
        assertNull(metadata.description());
        assertNull(metadata.author());
        assertNull(metadata.publishedDate());
        assertNull(metadata.canonicalUrl());
        assertNull(metadata.language());
        assertThat(metadata.keywords()).isEmpty();
        assertThat(metadata.images()).isEmpty();
        assertThat(metadata.links()).isEmpty();
        assertEquals(0, metadata.wordCount());
    }

    @Test
    void scriptOnlyBodyHasNoWords() {
        Document doc = Jsoup.parse("""
            <html><head><title>Ignored words here</title><style>body { color: red; }</style></head>
            <body><script>var a = 'not words';</script><noscript>enable js</noscript></body></html>
            """, BASE);

        assertEquals(0, extractor.countWords(doc));
        assertThat(doc.select("script")).hasSize(1);
    }

    @Test
    void countsVisibleWords() {
        Document doc = Jsoup.parse("<html><body><p>one two three</p><div>four, five!</div></body></html>", BASE);

        assertEquals(5, extractor.countWords(doc));
    }

    @Test
    void imagesSkipDataUrisAndTinyImagesAndResolveRelativeSources() {
        Document doc = Jsoup.parse("""
            <html><body>
              <img src="/img/hero.jpg" alt="Hero" width="800" height="600">
              <img src="data:image/png;base64,AAAA">
              <img src="pixel.gif" width="1" height="1">
              <img src="photo.png" title="Photo">
            </body></html>
            """, BASE);

        List<ImageMetadata> images = extractor.extract(doc, BASE).images();

        assertThat(images).extracting(ImageMetadata::url).containsExactly(
            "https://shop.example.com/img/hero.jpg",
            "https://shop.example.com/products/photo.png"
        );
        assertEquals("Hero", images.get(0).altText());
        assertEquals(800, images.get(0).width());
        assertEquals("Photo", images.get(1).title());
    }

    @Test
    void linksSkipFragmentsAndScriptsAndKeepRel() {
        Document doc = Jsoup.parse("""
            <html><body>
              <a href="#top">Top</a>
              <a href="javascript:void(0)">Noop</a>
              <a href="../about" rel="nofollow noopener" title="About us">About</a>
              <a href="https://other.example/x">Other</a>
            </body></html>
            """, BASE);

        List<LinkMetadata> links = extractor.extract(doc, BASE).links();

        assertThat(links).hasSize(2);
        assertEquals(new LinkMetadata("https://shop.example.com/about", "About", "About us", "nofollow"), links.get(0));
        assertEquals("https://other.example/x", links.get(1).url());
        assertNull(links.get(1).rel());
    }

    @Test
    void collectionsAreCapped() {
        StringBuilder html = new StringBuilder("<html><head><meta name=\"keywords\" content=\"");
        for (int i = 0; i < 30; i++) {
            html.append("kw").append(i).append(',');
        }
        html.append("\"></head><body>");
        for (int i = 0; i < 120; i++) {
            html.append("<a href=\"/p").append(i).append("\">p</a>");
            html.append("<img src=\"/i").append(i).append(".png\">");
        }
        html.append("</body></html>");

        PageMetadata metadata = extractor.extract(Jsoup.parse(html.toString(), BASE), BASE);

        assertEquals(PageMetadataExtractor.MAX_KEYWORDS, metadata.keywords().size());
        assertEquals("kw0", metadata.keywords().get(0));
        assertEquals(PageMetadataExtractor.MAX_LINKS, metadata.links().size());
        assertEquals(PageMetadataExtractor.MAX_IMAGES, metadata.images().size());
    }

    @Test
    void longTitleIsTruncated() {
        String title = "t".repeat(PageMetadataExtractor.MAX_TITLE_LENGTH + 50);
        Document doc = Jsoup.parse("<html><head><title>" + title + "</title></head></html>", BASE);

        assertEquals(PageMetadataExtractor.MAX_TITLE_LENGTH, extractor.extract(doc, BASE).title().length());
    }

    @Test
    void parsesCommonPublishedDateFormats() {
        assertEquals(
            OffsetDateTime.of(2023, 7, 1, 0, 0, 0, 0, ZoneOffset.UTC),
            PublishedDateParser.parse("2023-07-01").orElseThrow()
        );
        assertEquals(
            OffsetDateTime.of(2023, 7, 1, 0, 0, 0, 0, ZoneOffset.UTC),
            PublishedDateParser.parse("July 1, 2023").orElseThrow()
        );
        assertEquals(
            OffsetDateTime.of(2023, 7, 1, 8, 30, 0, 0, ZoneOffset.ofHours(2)),
            PublishedDateParser.parse("2023-07-01T08:30:00+02:00").orElseThrow()
        );
        assertThat(PublishedDateParser.parse("not a date")).isEmpty();
        assertThat(PublishedDateParser.parse("")).isEmpty();
    }
}
