package com.webtestool.core.crawler.robots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 한 User-agent 그룹의 규칙. 값은 RobotsMatcher.normalizeRule 을 거친 형태로 저장된다. */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();
    private long crawlDelayMs = -1;   // -1 = 지정 없음

    RobotsRules addAllow(String rule) {
        if (rule != null && !rule.isBlank()) allow.add(RobotsMatcher.normalizeRule(rule));
        return this;
    }

    /** "Disallow:" (빈 값)은 규칙이 아니다 */
    RobotsRules addDisallow(String rule) {
        if (rule != null && !rule.isBlank()) disallow.add(RobotsMatcher.normalizeRule(rule));
        return this;
    }

    RobotsRules crawlDelayMs(long ms) {
        if (ms >= 0) this.crawlDelayMs = ms;
        return this;
    }

    public List<String> allow() { return Collections.unmodifiableList(allow); }
    public List<String> disallow() { return Collections.unmodifiableList(disallow); }
    public long crawlDelayMs() { return crawlDelayMs; }
    public boolean hasCrawlDelay() { return crawlDelayMs >= 0; }
    public boolean isEmpty() { return allow.isEmpty() && disallow.isEmpty(); }
}
