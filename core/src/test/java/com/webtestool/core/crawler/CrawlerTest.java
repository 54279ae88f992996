package com.webtestool.core.crawler;

import com.webtestool.core.crawler.robots.RobotsFetcher;
import com.webtestool.core.crawler.robots.RobotsRepository;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.CrawlResult;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.ratelimit.MinIntervalLimiter;
import com.webtestool.core.testutil.FrozenClock;
import com.webtestool.core.testutil.RecordingSleeper;
import com.webtestool.core.util.Deadline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CrawlerTest {

    private static final String BASE = "http://site.test";

    private static ScanConfig cfg() {
        ScanConfig c = ScanConfig.defaults().setTarget(BASE + "/").setConcurrency(3);
        c.getCrawler().setRespectRobots(false);
        return c;
    }

    private static String links(String... paths) {
        return "<html><body>" + java.util.Arrays.stream(paths)
                .map(p -> "<a href=\"" + p + "\">" + p + "</a>")
                .collect(Collectors.joining()) + "</body></html>";
    }

    private static List<String> urls(CrawlResult r) {
        return r.pages().stream().map(p -> p.getUrl().toString()).toList();
    }

    private static CrawlResult crawl(ScanConfig c, MapFetcher f) {
        return new Crawler(c, f, new JsoupPageParser(), null, null).crawl(Deadline.none());
    }

    @Test
    @DisplayName("BFS: 깊이 제한, (depth, 발견 순서) 정렬")
    void bfs_respects_max_depth_and_orders_by_depth() {
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("/a", "/b"))
                .html(BASE + "/a", links("/c", "/"))
                .html(BASE + "/b", links("/a"))
                .html(BASE + "/c", links("/d"))
                .html(BASE + "/d", links());

        CrawlResult r = crawl(cfg().setMaxDepth(2), f);

        assertEquals(List.of(BASE + "/", BASE + "/a", BASE + "/b", BASE + "/c"), urls(r));
        assertThat(r.pages()).extracting(CrawledPage::getDepth).containsExactly(0, 1, 1, 2);
        assertEquals(URI.create(BASE + "/a"), r.pages().get(3).getParentUrl());
        assertEquals(0, f.calls(BASE + "/d"));
        assertEquals(1, f.calls(BASE + "/a"));
        assertFalse(r.timedOut());
    }

    @Test
    void max_pages_is_a_hard_cap() {
        String[] many = IntStream.range(0, 20).mapToObj(i -> "/p" + i).toArray(String[]::new);
        MapFetcher f = new MapFetcher().html(BASE + "/", links(many));
        for (String p : many) f.html(BASE + p, links());

        CrawlResult r = crawl(cfg().setMaxPages(5), f);

        assertEquals(5, r.pages().size());
        assertEquals(List.of(BASE + "/", BASE + "/p0", BASE + "/p1", BASE + "/p2", BASE + "/p3"), urls(r));
    }

    @Test
    void out_of_scope_and_excluded_links_are_recorded_not_fetched() {
        ScanConfig c = cfg();
        c.getCrawler().setExcludePaths(List.of("/admin"));
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("https://other.test/x", "/admin/users", "/ok"))
                .html(BASE + "/ok", links());

        CrawlResult r = crawl(c, f);

        assertEquals(List.of(BASE + "/", BASE + "/ok"), urls(r));
        assertEquals(List.of(URI.create(BASE + "/admin/users"), URI.create("https://other.test/x")), r.outOfScopeLinks());
        assertEquals(0, f.calls("https://other.test/x"));
        assertThat(r.pages().get(0).getLinks()).hasSize(3);
    }

    @Test
    void fetch_failure_becomes_failed_page() {
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("/down"))
                .fail(BASE + "/down", new FetchException(FetchException.Kind.CONNECTION,
                        URI.create(BASE + "/down"), "ConnectException: refused", null));

        CrawlResult r = crawl(cfg(), f);

        assertEquals(2, r.pages().size());
        CrawledPage down = r.pages().get(1);
        assertTrue(down.isFailed());
        assertThat(down.getFetchError()).startsWith("connection:");
        assertEquals(1, r.successfulPages());
    }

    @Test
    void json_responses_and_script_calls_become_endpoints() {
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", "<a href=\"/api/items.json?page=1\">x</a>"
                        + "<script>fetch('/api/users?id=7'); fetch('https://cdn.other.test/api/x');</script>")
                .put(BASE + "/api/items.json?page=1", 200, "application/json", "[]");

        CrawlResult r = crawl(cfg(), f);

        assertThat(r.endpoints()).extracting(ApiEndpoint::key).containsExactly(
                "GET " + BASE + "/api/items.json?page=1",
                "UNKNOWN " + BASE + "/api/users?id=7");
        ApiEndpoint json = r.endpoints().get(0);
        assertEquals(ApiEndpoint.FROM_RESPONSE, json.discoveredFrom());
        assertEquals(List.of("page"), json.parameters());
        assertEquals(URI.create(BASE + "/"), json.parentPage());
    }

    @Test
    void robots_disallowed_pages_are_skipped_and_crawl_delay_applied() {
        ScanConfig c = cfg();
        c.getCrawler().setRespectRobots(true);
        FrozenClock clk = new FrozenClock(0);
        RobotsFetcher robotsTxt = uri -> new RobotsFetcher.Response(200,
                "User-agent: *\nDisallow: /private\nCrawl-delay: 2\n", uri);
        RobotsRepository robots = new RobotsRepository(robotsTxt, clk, c.getUserAgent());
        MinIntervalLimiter polite = new MinIntervalLimiter(0, clk, new RecordingSleeper(clk));
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("/private/a", "/public"))
                .html(BASE + "/public", links());

        CrawlResult r = new Crawler(c, f, new JsoupPageParser(), robots, polite).crawl(Deadline.none());

        assertEquals(List.of(BASE + "/", BASE + "/public"), urls(r));
        assertEquals(List.of(URI.create(BASE + "/private/a")), r.robotsBlocked());
        assertEquals(0, f.calls(BASE + "/private/a"));
        assertEquals(2000, polite.intervalMillis("site.test"));
    }

    @Test
    void robots_ignored_when_disabled() {
        RobotsRepository robots = new RobotsRepository(
                uri -> new RobotsFetcher.Response(200, "User-agent: *\nDisallow: /\n", uri),
                new FrozenClock(0), "bot");
        MapFetcher f = new MapFetcher().html(BASE + "/", links());

        CrawlResult r = new Crawler(cfg(), f, new JsoupPageParser(), robots, null).crawl(Deadline.none());

        assertEquals(1, r.pages().size());
        assertTrue(r.robotsBlocked().isEmpty());
    }

    @Test
    void expired_deadline_returns_partial_result() {
        FrozenClock clk = new FrozenClock(0);
        Deadline d = Deadline.after(Duration.ofSeconds(1), clk);
        clk.plusMillis(1_000);
        MapFetcher f = new MapFetcher().html(BASE + "/", links());

        CrawlResult r = new Crawler(cfg(), f, new JsoupPageParser(), null, null).crawl(d);

        assertTrue(r.timedOut());
        assertTrue(r.pages().isEmpty());
    }

    @Test
    void cancel_flag_aborts_crawl() {
        MapFetcher f = new MapFetcher().html(BASE + "/", links());
        Crawler crawler = new Crawler(cfg(), f, new JsoupPageParser(), null, null)
                .cancelFlag(new AtomicBoolean(true));
        assertThrows(CancellationException.class, () -> crawler.crawl(Deadline.none()));
    }

    @Test
    void bodies_not_retained_are_refetched_on_demand() {
        ScanConfig c = cfg();
        c.getCrawler().setRetainBodies(false);
        MapFetcher f = new MapFetcher().html(BASE + "/", "<title>T</title>");

        CrawledPage p = crawl(c, f).pages().get(0);

        assertFalse(p.getBody().isRetained());
        assertEquals("T", p.getTitle());
        assertThat(p.getBody().text()).contains("<title>T</title>");
        assertEquals(2, f.calls(BASE + "/"));
    }

    @Test
    void progress_reports_crawl_phase() {
        java.util.List<String> phases = new java.util.concurrent.CopyOnWriteArrayList<>();
        MapFetcher f = new MapFetcher().html(BASE + "/", links("/a")).html(BASE + "/a", links());

        new Crawler(cfg(), f, new JsoupPageParser(), null, null)
                .progress((p, phase, done, total) -> phases.add(phase + ":" + done))
                .crawl(Deadline.none());

        assertEquals("crawl:0", phases.get(0));
        assertEquals("crawl:2", phases.get(phases.size() - 1));
    }

    @Test
    void worker_count_can_be_capped_by_system_property() {
        assertEquals(1, Crawler.workerCount(0));
        assertEquals(8, Crawler.workerCount(8));
        System.setProperty("wt.crawl.maxWorkers", "3");
        try {
            assertEquals(3, Crawler.workerCount(8));
            assertEquals(2, Crawler.workerCount(2));
        } finally {
            System.clearProperty("wt.crawl.maxWorkers");
        }
    }

    @Test
    @DisplayName("fetch 중 unchecked 예외가 나도 페이지는 오류로 기록")
    void unchecked_failure_still_records_the_page() {
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("/a", "/b"))
                .crash(BASE + "/a", new IllegalStateException("cache backend down"))
                .html(BASE + "/b", links());

        CrawlResult r = crawl(cfg(), f);

        assertEquals(List.of(BASE + "/", BASE + "/a", BASE + "/b"), urls(r));
        CrawledPage a = r.pages().get(1);
        assertThat(a.getFetchError()).contains("IllegalStateException").contains("cache backend down");
        assertTrue(a.getLinks().isEmpty());
    }

    @Test
    void relative_links_resolve_against_the_redirect_target() {
        ScanConfig c = cfg().setTarget(BASE + "/dir");
        MapFetcher f = new MapFetcher()
                .redirected(BASE + "/dir", BASE + "/dir/", "<html><body><a href='x'>x</a></body></html>")
                .html(BASE + "/dir/x", links());

        CrawlResult r = crawl(c, f);

        assertEquals(List.of(BASE + "/dir", BASE + "/dir/x"), urls(r));
        assertEquals(0, f.calls(BASE + "/x"));
    }

    @Test
    void redirect_out_of_scope_is_recorded_without_links() {
        MapFetcher f = new MapFetcher()
                .html(BASE + "/", links("/go"))
                .redirected(BASE + "/go", "https://elsewhere.test/landing",
                        "<html><body><a href='/inner'>inner</a></body></html>");

        CrawlResult r = crawl(cfg(), f);

        assertEquals(List.of(BASE + "/", BASE + "/go"), urls(r));
        CrawledPage go = r.pages().get(1);
        assertThat(go.getFetchError()).startsWith("redirected out of scope");
        assertTrue(go.getLinks().isEmpty());
        assertEquals(0, f.calls(BASE + "/inner"));
        assertThat(r.outOfScopeLinks()).extracting(URI::toString).contains("https://elsewhere.test/landing");
    }
}
