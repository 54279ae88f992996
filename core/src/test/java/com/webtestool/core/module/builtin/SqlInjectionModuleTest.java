package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.model.TestStatus;
import com.webtestool.core.service.ScanComponents;
import com.webtestool.core.testutil.LocalSite;
import com.webtestool.core.testutil.Pages;
import com.webtestool.core.util.ProgressListener;
import com.webtestool.core.util.UrlParamUtil;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SqlInjectionModuleTest {

    private static final String BASE = "http://shop.test/";
    private static final String MYSQL_ERROR =
            "<html><body><b>Warning</b>: You have an error in your SQL syntax; check the manual</body></html>";

    /** GET 쿼리나 폼 본문의 값에 작은따옴표가 있으면 MySQL 오류 페이지를 돌려주는 가짜 서버 */
    private static final class QuoteSensitiveFetcher implements IFetcher {
        final List<FetchRequest> requests = Collections.synchronizedList(new ArrayList<>());
        private final List<String> vulnerableParams;

        QuoteSensitiveFetcher(String... vulnerableParams) { this.vulnerableParams = List.of(vulnerableParams); }

        @Override
        public FetchResult fetch(FetchRequest req) {
            requests.add(req);
            Map<String, String> params = "GET".equals(req.getMethod())
                    ? UrlParamUtil.parseQuery(req.getUrl())
                    : UrlParamUtil.parseQuery(URI.create("http://body.local/?" + req.getBody()));
            boolean broken = false;
            for (String p : vulnerableParams) {
                if (params.getOrDefault(p, "").contains("'")) broken = true;
            }
            return FetchResult.builder().url(req.getUrl())
                    .statusCode(broken ? 500 : 200)
                    .contentType("text/html")
                    .body(broken ? MYSQL_ERROR : "<html><body>fine</body></html>")
                    .responseTimeMs(5)
                    .build();
        }
    }

    private static ScanConfig cfg(String target) {
        return ScanConfig.defaults().setTarget(target);
    }

    private static SqlInjectionModule init(ScanConfig cfg) throws ModuleException {
        SqlInjectionModule m = new SqlInjectionModule();
        m.initialize(cfg);
        return m;
    }

    @Test
    void error_based_get_and_post() throws Exception {
        var page = Pages.html(BASE + "item?id=7", """
                <html><body>
                  <a href="/item?id=8">next</a>
                  <form method="post" action="/login">
                    <input name="user"><input type="password" name="pass"><input type="submit" name="go" value="Sign in">
                  </form>
                </body></html>""");
        QuoteSensitiveFetcher fetcher = new QuoteSensitiveFetcher("id", "user");
        ScanConfig cfg = cfg(BASE);

        ModuleResult r = init(cfg).run(Pages.context(cfg, fetcher, page));

        assertEquals(TestStatus.FAILED, r.getStatus());
        assertEquals(2, r.getFindings().size());

        Finding get = r.getFindings().get(0);
        assertEquals("SQL Injection (error-based)", get.getTitle());
        assertEquals(Severity.HIGH, get.getSeverity());
        assertEquals(URI.create(BASE + "item?id=7"), get.getUrl());
        assertEquals("id", get.getEvidence().get("parameter"));
        assertEquals("7'", get.getEvidence().get("payload"));
        assertEquals("You have an error in your SQL", get.getEvidence().get("signature"));
        assertThat(get.getEvidence().get("snippet")).contains("SQL syntax");
        assertEquals("CWE-89", get.getCweId());

        Finding post = r.getFindings().get(1);
        assertEquals(URI.create(BASE + "login"), post.getUrl());
        assertEquals("POST", post.getEvidence().get("method"));
        assertEquals("user", post.getEvidence().get("parameter"));
        assertEquals("1'", post.getEvidence().get("payload"));

        // id(1) + user/pass(2), 시간 기반은 비활성
        assertEquals(3, fetcher.requests.size());
        assertThat(fetcher.requests).allMatch(FetchRequest::isBypassCache).allMatch(FetchRequest::isAcceptServerErrors);
    }

    @Test
    void clean_application_passes() throws Exception {
        var page = Pages.html(BASE + "item?id=7", "<html><body>item</body></html>");
        ScanConfig cfg = cfg(BASE);
        ModuleResult r = init(cfg).run(Pages.context(cfg, new QuoteSensitiveFetcher(), page));
        assertEquals(TestStatus.PASSED, r.getStatus());
    }

    @Test
    void injection_points_are_deduplicated_and_scoped() throws Exception {
        var page = Pages.html(BASE, """
                <html><body>
                  <a href="/a?x=1">1</a><a href="/a?x=2">2</a><a href="/b">b</a>
                  <a href="http://evil.test/?q=1">evil</a>
                  <form action="/search"><input name="q"><input type="submit" value="go"></form>
                  <form method="post" action="/noop"><input type="submit" name="s"></form>
                  <form method="post" action="http://evil.test/steal"><input name="card"></form>
                </body></html>""");
        ScanConfig cfg = cfg(BASE);
        TestContext ctx = TestContext.builder()
                .targetUrl(URI.create(BASE)).config(cfg).fetcher(Pages.NO_NETWORK)
                .pages(List.of(page))
                .endpoints(List.of(
                        new ApiEndpoint("POST", URI.create(BASE + "api/items?limit=5"), "application/json",
                                List.of("limit", "name"), URI.create(BASE), ApiEndpoint.FROM_JAVASCRIPT),
                        new ApiEndpoint("DELETE", URI.create(BASE + "api/items/1?force=1"), null,
                                List.of("force"), URI.create(BASE), ApiEndpoint.FROM_JAVASCRIPT),
                        new ApiEndpoint(null, URI.create(BASE + "api/ping"), null, List.of(), null, null)))
                .build();

        List<InjectionPoint> points = init(cfg).injectionPoints(ctx);

        assertThat(points).extracting(p -> p.method() + " " + p.url().getPath())
                .containsExactly("GET /a", "GET /search", "POST /api/items");
        assertEquals(Map.of("q", "1"), points.get(1).params());
        assertEquals(Map.of("limit", "5", "name", "1"), points.get(2).params());
    }

    @Test
    void injection_points_are_capped() throws Exception {
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 5; i++) links.append("<a href=\"/p").append(i).append("?id=1\">x</a>");
        var page = Pages.html(BASE, "<html><body>" + links + "</body></html>");
        ScanConfig cfg = cfg(BASE);
        cfg.getModules().setting("sql_injection", "maxInjectionPoints", 2);

        assertEquals(2, init(cfg).injectionPoints(Pages.context(cfg, Pages.NO_NETWORK, page)).size());
    }

    @Test
    void invalid_settings_fail_initialize() {
        ScanConfig zero = cfg(BASE);
        zero.getModules().setting("sql_injection", "timeThresholdMs", 0);
        ModuleException e = assertThrows(ModuleException.class, () -> init(zero));
        assertEquals("sql_injection", e.getModuleName());

        ScanConfig text = cfg(BASE);
        text.getModules().setting("sql_injection", "timeThresholdMs", "slow");
        assertThrows(ModuleException.class, () -> init(text));

        ScanConfig points = cfg(BASE);
        points.getModules().setting("sql_injection", "maxInjectionPoints", -3);
        assertThrows(ModuleException.class, () -> init(points));
    }

    @Test
    void signature_matching() {
        assertEquals("ORA-00933", SqlInjectionModule.match("ORA-00933: SQL command not properly ended"));
        assertEquals("Unclosed quotation mark", SqlInjectionModule.match("unclosed QUOTATION mark after the character string"));
        assertNull(SqlInjectionModule.match("<html>nothing to see</html>"));
        assertNull(SqlInjectionModule.match(null));
    }

    @Test
    void conflicts_with_performance() {
        assertEquals(java.util.Set.of("performance"), new SqlInjectionModule().conflictsWith());
    }

    @Test
    void time_based_blind_over_http() throws Exception {
        try (LocalSite site = new LocalSite()) {
            site.handle("/item", ex -> {
                String q = ex.getRequestURI().getQuery();
                if (q != null && q.toUpperCase(java.util.Locale.ROOT).contains("SLEEP")) {
                    try {
                        Thread.sleep(1500);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                }
                LocalSite.respond(ex, 200, "text/html", "<html><body>item</body></html>");
            });
            site.page("/safe", "<html><body>safe</body></html>");

            ScanConfig cfg = cfg(site.url("/"));
            cfg.getRateLimit().setMaxRequests(50);
            cfg.getModules().setting("sql_injection", "timeThresholdMs", 1000);
            cfg.getModules().setting("sql_injection", "timePayloads", List.of("' OR SLEEP(2)--"));
            cfg.validate();
            IFetcher fetcher = ScanComponents.standard()
                    .create(cfg, ProgressListener.NONE, new AtomicBoolean()).fetcher();

            var page = Pages.html(site.url("/item?id=1"), "<html><body>item</body></html>");
            var safe = Pages.html(site.url("/safe?id=1"), "<html><body>safe</body></html>");
            ModuleResult r = init(cfg).run(Pages.context(cfg, fetcher, page, safe));

            assertEquals(1, r.getFindings().size(), () -> r.getFindings().toString());
            Finding f = r.getFindings().get(0);
            assertEquals("SQL Injection (time-based blind)", f.getTitle());
            assertEquals(URI.create(site.url("/item?id=1")), f.getUrl());
            assertEquals("' OR SLEEP(2)--", f.getEvidence().get("payload"));
            assertEquals("1000", f.getEvidence().get("thresholdMs"));
            assertThat(Long.parseLong(f.getEvidence().get("latencyDeltaMs"))).isGreaterThanOrEqualTo(1000L);
        }
    }
}
