package com.sitelens.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Lower-cased authority of an absolute URL ("host" or "host:port"), or null.
     */
    public static String domainOf(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() >= 0 ? host + ":" + uri.getPort() : host;
    }

    public static boolean isHttpUrl(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    /**
     * Raw path plus query of {@code uri}, "/" when the path is empty.
     */
    public static String pathAndQuery(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }
}
