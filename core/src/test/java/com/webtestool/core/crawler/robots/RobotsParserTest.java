package com.webtestool.core.crawler.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RobotsParserTest {

    private static boolean allowed(String url, RobotsRules r) {
        return RobotsMatcher.isAllowed(URI.create(url), r);
    }

    @Test
    void groups_share_rules_and_star_is_fallback() {
        String robots = """
                # crawler group
                User-agent: AlphaBot
                User-agent: webtestool
                Disallow: /private
                Allow: /private/open$
                Crawl-delay: 1.5

                User-agent: *
                Disallow: /tmp
                """;

        RobotsParser.ParsedRobots parsed = RobotsParser.parse(robots);

        RobotsRules ours = parsed.selectFor("webtestool/0.3 (+crawler)");
        assertFalse(allowed("https://ex.com/private", ours));
        assertFalse(allowed("https://ex.com/private/x", ours));
        assertTrue(allowed("https://ex.com/private/open", ours));
        assertTrue(allowed("https://ex.com/tmp", ours));
        assertEquals(1500, ours.crawlDelayMs());

        RobotsRules alpha = parsed.selectFor("AlphaBot");
        assertFalse(allowed("https://ex.com/private", alpha));

        RobotsRules other = parsed.selectFor("Other/1.0");
        assertFalse(allowed("https://ex.com/tmp", other));
        assertTrue(allowed("https://ex.com/private", other));
        assertFalse(other.hasCrawlDelay());
    }

    @Test
    void empty_disallow_allows_everything() {
        RobotsRules r = RobotsParser.parse("User-agent: *\nDisallow:\n").selectFor("x");
        assertTrue(allowed("https://ex.com/anything", r));
    }

    @Test
    void rules_without_user_agent_go_to_star_and_bad_delay_ignored() {
        RobotsRules r = RobotsParser.parse("Disallow: /a\nCrawl-delay: soon\nSitemap: /s.xml\n").selectFor("bot");
        assertFalse(allowed("https://ex.com/a", r));
        assertFalse(r.hasCrawlDelay());
    }

    @Test
    void product_token_is_lowercased_prefix() {
        assertEquals("webtestool", RobotsParser.productToken("WebTestool/0.3 (+crawler)"));
        assertEquals("", RobotsParser.productToken(null));
    }
}
