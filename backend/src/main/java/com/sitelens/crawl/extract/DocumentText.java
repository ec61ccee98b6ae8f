package com.sitelens.crawl.extract;

import org.jsoup.nodes.Document;

public final class DocumentText {
    private static final String NON_CONTENT_SELECTOR = "script, style, head, title, meta, noscript, template";

    private DocumentText() {
    }

    /**
     * Visible text of {@code document} with whitespace collapsed. The document itself is left untouched.
     */
    public static String visibleText(Document document) {
        if (document == null) {
            return "";
        }
        Document copy = document.clone();
        copy.select(NON_CONTENT_SELECTOR).remove();
        return collapseWhitespace(copy.text());
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("\\s+", " ").trim();
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
