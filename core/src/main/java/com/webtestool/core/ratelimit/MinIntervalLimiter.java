package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트별 최소 요청 간격(politeness). 기본 간격은 crawlDelayMs,
 * robots.txt Crawl-delay 가 더 길면 {@link #raiseInterval}로 늘린다(줄이지는 않는다).
 */
public final class MinIntervalLimiter extends AbstractRateLimiter {

    private static final class Slot {
        long last = Long.MIN_VALUE;
    }

    private final long defaultIntervalMs;
    private final Map<String, Long> intervals = new ConcurrentHashMap<>();
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public MinIntervalLimiter(long defaultIntervalMs, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        this.defaultIntervalMs = Math.max(0, defaultIntervalMs);
    }

    public long intervalMillis(String key) {
        return intervals.getOrDefault(key, defaultIntervalMs);
    }

    public void raiseInterval(String key, long intervalMs) {
        intervals.merge(key, Math.max(defaultIntervalMs, intervalMs), Math::max);
    }

    @Override public boolean allow(String key) {
        Slot s = slots.computeIfAbsent(key, k -> new Slot());
        synchronized (s) {
            long now = clock.nowMillis();
            long iv = intervalMillis(key);
            if (s.last != Long.MIN_VALUE && now - s.last < iv) return false;
            s.last = now;
            return true;
        }
    }

    @Override public long estimateWaitMillis(String key) {
        Slot s = slots.computeIfAbsent(key, k -> new Slot());
        synchronized (s) {
            if (s.last == Long.MIN_VALUE) return 0;
            return Math.max(0, s.last + intervalMillis(key) - clock.nowMillis());
        }
    }
}
