package com.webtestool.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void normalize_canonical_form() {
        assertEquals(URI.create("http://ex.com/a/b?a=1&b=2"),
                UrlUtils.normalize("HTTP://Ex.COM:80//a///b?b=2&a=1#frag"));
        assertEquals(URI.create("https://ex.com/"), UrlUtils.normalize("https://ex.com:443"));
        assertEquals(URI.create("https://ex.com:8443/x"), UrlUtils.normalize("https://ex.com:8443/x?"));
    }

    @Test
    void normalize_keeps_query_encoding() {
        assertEquals(URI.create("http://ex.com/s?q=a%20b&z=%2F"),
                UrlUtils.normalize("http://ex.com/s?z=%2F&q=a%20b"));
    }

    @Test
    void normalize_rejects_non_http() {
        assertNull(UrlUtils.normalize("mailto:a@ex.com"));
        assertNull(UrlUtils.normalize("javascript:void(0)"));
        assertNull(UrlUtils.normalize("ftp://ex.com/file"));
        assertNull(UrlUtils.normalize("http://"));
        assertNull(UrlUtils.normalize("  "));
        assertNull(UrlUtils.normalize((URI) null));
    }

    @Test
    void same_url_variants_collapse() {
        assertEquals(UrlUtils.normalize("http://ex.com/p?x=1&y=2"), UrlUtils.normalize("http://EX.com:80/p?y=2&x=1#top"));
    }

    @Test
    void scope() {
        URI base = URI.create("https://shop.test/");
        assertTrue(UrlUtils.sameDomain(URI.create("https://SHOP.test/x"), base));
        assertFalse(UrlUtils.sameDomain(URI.create("https://api.shop.test/"), base));

        List<String> allowed = List.of("api.partner.test", ".cdn.test");
        assertTrue(UrlUtils.hostInScope(URI.create("http://shop.test/a"), base, allowed));
        assertTrue(UrlUtils.hostInScope(URI.create("http://api.partner.test/"), base, allowed));
        assertTrue(UrlUtils.hostInScope(URI.create("http://img.cdn.test/"), base, allowed));
        assertTrue(UrlUtils.hostInScope(URI.create("http://cdn.test/"), base, allowed));
        assertFalse(UrlUtils.hostInScope(URI.create("http://evilcdn.test/"), base, allowed));
        assertFalse(UrlUtils.hostInScope(URI.create("http://partner.test/"), base, allowed));
    }

    @Test
    void origin() {
        assertEquals(URI.create("http://ex.com/"), UrlUtils.originOf(URI.create("http://ex.com:80/a/b?c=1")));
        assertEquals(URI.create("http://ex.com:8080/"), UrlUtils.originOf(URI.create("http://ex.com:8080/a")));
        assertEquals("ex.com", UrlUtils.hostOf(URI.create("http://EX.com/")));
    }
}
