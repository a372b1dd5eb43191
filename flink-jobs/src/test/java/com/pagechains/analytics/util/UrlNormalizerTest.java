package com.pagechains.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {

    @Test
    void stripsFragmentOnly() {
        assertEquals("https://a.test/x?q=1", UrlNormalizer.withoutFragment("https://a.test/x?q=1#frag"));
        assertEquals("https://a.test/", UrlNormalizer.withoutFragment("https://a.test/"));
        assertNull(UrlNormalizer.withoutFragment(null));
    }

    @Test
    void extractsScheme() {
        assertEquals("https", UrlNormalizer.scheme("HTTPS://a.test/"));
        assertEquals("data", UrlNormalizer.scheme("data:image/png;base64,AAAA"));
        assertEquals("chrome-extension", UrlNormalizer.scheme("chrome-extension://abc/script.js"));
        assertEquals("", UrlNormalizer.scheme("/relative/path"));
        assertEquals("", UrlNormalizer.scheme(null));
    }

    @Test
    void lastPathComponentIgnoresQueryAndFragment() {
        assertEquals("favicon.ico", UrlNormalizer.lastPathComponent("https://a.test/static/favicon.ico?v=3#x"));
        assertEquals("", UrlNormalizer.lastPathComponent("https://a.test"));
        assertEquals("", UrlNormalizer.lastPathComponent("https://a.test/"));
        assertEquals("style.css", UrlNormalizer.lastPathComponent("style.css"));
    }

    @Test
    void originKeepsSchemeHostAndPort() {
        assertEquals("https://shop.example.com:8443", UrlNormalizer.origin("https://Shop.Example.com:8443/cart?x=1"));
        assertEquals("https://a.test", UrlNormalizer.origin("https://a.test"));
        assertEquals("", UrlNormalizer.origin("data:text/plain,hi"));
    }
}
