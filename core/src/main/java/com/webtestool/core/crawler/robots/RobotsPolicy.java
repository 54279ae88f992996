package com.webtestool.core.crawler.robots;

import java.net.URI;

/** 한 호스트에 대해 우리 UA 로 선택된 robots 규칙. 실패/없음이면 전체 허용. */
public final class RobotsPolicy {
    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(null);

    private final RobotsRules rules;   // null = allow-all

    private RobotsPolicy(RobotsRules rules) {
        this.rules = rules;
    }

    public static RobotsPolicy parse(String robotsTxt, String userAgent) {
        return new RobotsPolicy(RobotsParser.parse(robotsTxt).selectFor(userAgent));
    }

    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allow(URI url) {
        return rules == null || RobotsMatcher.isAllowed(url, rules);
    }

    /** Crawl-delay(ms). 지정 없으면 -1 */
    public long crawlDelayMs() {
        return (rules == null) ? -1 : rules.crawlDelayMs();
    }

    public boolean isAllowAll() {
        return rules == null;
    }
}
