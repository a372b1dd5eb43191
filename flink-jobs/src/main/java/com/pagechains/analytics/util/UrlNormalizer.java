package com.pagechains.analytics.util;

import java.util.Locale;

/**
 * URL helpers shared by request matching and classification.
 *
 * <p>These operate on the raw string rather than {@link java.net.URI}: recorded URLs are not
 * guaranteed to be RFC-compliant and must never fail to normalize.</p>
 */
public final class UrlNormalizer {
    private UrlNormalizer() {}

    public static String withoutFragment(String url) {
        if (url == null) {
            return null;
        }
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }

    /** Lower-cased scheme without the colon, or empty when the URL has none. */
    public static String scheme(String url) {
        if (StringSemantics.isBlank(url)) {
            return "";
        }
        String trimmed = url.trim();
        int colon = trimmed.indexOf(':');
        if (colon <= 0) {
            return "";
        }
        for (int i = 0; i < colon; i++) {
            char c = trimmed.charAt(i);
            boolean allowed = Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.';
            if (!allowed) {
                return "";
            }
        }
        if (!Character.isLetter(trimmed.charAt(0))) {
            return "";
        }
        return trimmed.substring(0, colon).toLowerCase(Locale.ROOT);
    }

    /** Last path segment with query and fragment removed; empty for a bare origin. */
    public static String lastPathComponent(String url) {
        if (StringSemantics.isBlank(url)) {
            return "";
        }
        String path = withoutFragment(url.trim());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int authority = path.indexOf("://");
        if (authority >= 0) {
            int pathStart = path.indexOf('/', authority + 3);
            if (pathStart < 0) {
                return "";
            }
            path = path.substring(pathStart);
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /** {@code scheme://host[:port]}, lower-cased, or empty for URLs without an authority. */
    public static String origin(String url) {
        if (StringSemantics.isBlank(url)) {
            return "";
        }
        String trimmed = url.trim();
        int authority = trimmed.indexOf("://");
        if (authority <= 0) {
            return "";
        }
        int end = trimmed.length();
        for (int i = authority + 3; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        return trimmed.substring(0, end).toLowerCase(Locale.ROOT);
    }
}
