package com.webtestool.core.crawler.robots;

import com.webtestool.core.testutil.FrozenClock;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RobotsRepositoryTest {

    private static final String UA = "webtestool/0.3";

    @Test
    void success_is_cached_for_30_minutes() {
        StubRobotsFetcher f = new StubRobotsFetcher().ok("https://ex.com/robots.txt", "User-agent: *\nDisallow: /private\n");
        FrozenClock clk = new FrozenClock(0);
        RobotsRepository repo = new RobotsRepository(f, clk, UA);

        RobotsPolicy p = repo.policyFor(URI.create("https://ex.com/a"));
        assertFalse(p.allow(URI.create("https://ex.com/private")));
        assertTrue(p.allow(URI.create("https://ex.com/public")));

        clk.plus(Duration.ofMinutes(29));
        repo.policyFor(URI.create("https://ex.com/b"));
        assertEquals(1, f.calls.get());

        clk.plus(Duration.ofMinutes(2));
        repo.policyFor(URI.create("https://ex.com/c"));
        assertEquals(2, f.calls.get());
    }

    @Test
    void not_found_allows_all_and_is_cached_for_10_minutes() {
        StubRobotsFetcher f = new StubRobotsFetcher().status("http://ex.com/robots.txt", 404);
        FrozenClock clk = new FrozenClock(0);
        RobotsRepository repo = new RobotsRepository(f, clk, UA);

        assertTrue(repo.policyFor(URI.create("http://ex.com/x")).isAllowAll());
        clk.plus(Duration.ofMinutes(9));
        repo.policyFor(URI.create("http://ex.com/y"));
        assertEquals(1, f.calls.get());
        clk.plus(Duration.ofMinutes(2));
        repo.policyFor(URI.create("http://ex.com/y"));
        assertEquals(2, f.calls.get());
    }

    @Test
    void hosts_are_cached_separately_by_origin() {
        StubRobotsFetcher f = new StubRobotsFetcher()
                .ok("https://a.com/robots.txt", "User-agent: *\nDisallow: /\n")
                .ok("https://b.com:8443/robots.txt", "User-agent: *\nDisallow: /q\n");
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);

        assertFalse(repo.policyFor(URI.create("https://a.com/x")).allow(URI.create("https://a.com/x")));
        RobotsPolicy b = repo.policyFor(URI.create("https://b.com:8443/x"));
        assertTrue(b.allow(URI.create("https://b.com:8443/x")));
        assertFalse(b.allow(URI.create("https://b.com:8443/q")));
    }

    @Test
    void same_host_redirect_followed_cross_host_allows_all() {
        StubRobotsFetcher f = new StubRobotsFetcher()
                .redirect("http://ex.com/robots.txt", "https://ex.com/robots.txt", 301)
                .ok("https://ex.com/robots.txt", "User-agent: *\nDisallow: /q\n")
                .redirect("https://a.com/robots.txt", "https://b.com/robots.txt", 302);
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);

        assertFalse(repo.policyFor(URI.create("http://ex.com/")).allow(URI.create("http://ex.com/q?a=1")));
        assertTrue(repo.policyFor(URI.create("https://a.com/")).isAllowAll());
    }

    @Test
    void crawl_delay_exposed_and_network_failure_allows_all() {
        StubRobotsFetcher f = new StubRobotsFetcher().ok("https://ex.com/robots.txt", "User-agent: *\nCrawl-delay: 2\n");
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);
        assertEquals(2000, repo.policyFor(URI.create("https://ex.com/")).crawlDelayMs());
        assertTrue(repo.policyFor(URI.create("https://down.example/")).isAllowAll());
    }

    @Test
    void robots_uri_keeps_port_and_rejects_non_http() {
        assertEquals(URI.create("http://h:8080/robots.txt"), RobotsRepository.robotsTxtUri(URI.create("http://h:8080/a/b?c")));
        assertNull(RobotsRepository.robotsTxtUri(URI.create("ftp://h/a")));
        assertEquals("https://h:443", RobotsRepository.cacheKey(URI.create("https://H/x")));
    }
}
