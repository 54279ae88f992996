package com.webtestool.core.module.builtin;

import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestStatus;
import com.webtestool.core.testutil.Pages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SeoModuleTest {

    private static final String GOOD = """
            <html><head>
              <title>Widgets | Shop</title>
              <meta name="description" content="All the widgets">
              <meta name="viewport" content="width=device-width, initial-scale=1">
              <link rel="canonical" href="http://shop.test/">
              <meta property="og:title" content="Widgets">
              <script type="application/ld+json">{"@type":"Store"}</script>
            </head><body><h1>Widgets</h1><img src="a.png" alt="a widget"></body></html>
            """;

    private static Map<String, Finding> run(String html) throws Exception {
        return run(Pages.html("http://shop.test/", html));
    }

    private static Map<String, Finding> run(com.webtestool.core.model.CrawledPage p) throws Exception {
        ModuleResult r = new SeoModule().run(Pages.context("http://shop.test/", p));
        return r.getFindings().stream().collect(Collectors.toMap(Finding::getTitle, f -> f));
    }

    @Test
    void well_formed_page_passes() throws Exception {
        ModuleResult r = new SeoModule().run(Pages.context("http://shop.test/",
                Pages.html("http://shop.test/", GOOD)));
        assertEquals(TestStatus.PASSED, r.getStatus(), () -> r.getFindings().toString());
    }

    @Test
    @DisplayName("빈 페이지는 기본 항목이 전부 보고된다")
    void bare_page() throws Exception {
        Map<String, Finding> m = run("<html><body><img src='x.png'><img src='y.png'></body></html>");

        assertThat(m.keySet()).containsExactlyInAnyOrder(
                "Missing Title Tag", "Missing Meta Description", "Missing Viewport Meta Tag",
                "Missing H1 Tag", "Images Missing Alt Text", "Missing Canonical URL",
                "Missing Open Graph Tags", "No Structured Data");
        assertEquals(Severity.HIGH, m.get("Missing Title Tag").getSeverity());
        assertEquals("2", m.get("Images Missing Alt Text").getEvidence().get("count"));
    }

    @Test
    void long_title_and_multiple_h1() throws Exception {
        String html = GOOD.replace("Widgets | Shop", "x".repeat(SeoModule.MAX_TITLE_LENGTH + 1))
                .replace("<h1>Widgets</h1>", "<h1>a</h1><h1>b</h1>");
        Map<String, Finding> m = run(html);

        assertEquals(Severity.LOW, m.get("Title Too Long").getSeverity());
        assertEquals("2", m.get("Multiple H1 Tags").getEvidence().get("count"));
        assertEquals(2, m.size());
    }

    @Test
    void noindex_from_meta_or_header() throws Exception {
        Map<String, Finding> meta = run(GOOD.replace("</head>", "<meta name='robots' content='noindex,follow'></head>"));
        assertEquals("noindex,follow", meta.get("Page Set to No-Index").getEvidence().get("robots"));

        Map<String, Finding> header = run(Pages.html("http://shop.test/", GOOD,
                Pages.headers("X-Robots-Tag", "noindex")));
        assertEquals(Severity.INFO, header.get("Page Set to No-Index").getSeverity());
    }

    @Test
    void non_html_and_failed_pages_are_skipped() throws Exception {
        var json = com.webtestool.core.model.CrawledPage.builder()
                .url(java.net.URI.create("http://shop.test/api")).statusCode(200)
                .contentType("application/json").build();
        var failed = com.webtestool.core.model.CrawledPage.builder()
                .url(java.net.URI.create("http://shop.test/down")).fetchError("timeout: read timed out").build();
        ModuleResult r = new SeoModule().run(Pages.context("http://shop.test/", json, failed));
        assertEquals(TestStatus.PASSED, r.getStatus());
    }
}
