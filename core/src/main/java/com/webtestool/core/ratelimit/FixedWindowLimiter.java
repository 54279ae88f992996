package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 고정 창: now / window 로 창을 나누고 창마다 maxRequests 까지 허가 */
public final class FixedWindowLimiter extends AbstractRateLimiter {

    private static final class Window {
        long index = Long.MIN_VALUE;
        int count;
    }

    private final int maxRequests;
    private final long windowMs;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowLimiter(int maxRequests, Duration window, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be >= 1");
        this.maxRequests = maxRequests;
        this.windowMs = Math.max(1, window.toMillis());
    }

    private Window roll(String key, long now) {
        Window w = windows.computeIfAbsent(key, k -> new Window());
        long idx = Math.floorDiv(now, windowMs);
        if (w.index != idx) {
            w.index = idx;
            w.count = 0;
        }
        return w;
    }

    @Override public boolean allow(String key) {
        long now = clock.nowMillis();
        Window w = windows.computeIfAbsent(key, k -> new Window());
        synchronized (w) {
            roll(key, now);
            if (w.count >= scaled(key, maxRequests)) return false;
            w.count++;
            return true;
        }
    }

    @Override public long estimateWaitMillis(String key) {
        long now = clock.nowMillis();
        Window w = windows.computeIfAbsent(key, k -> new Window());
        synchronized (w) {
            roll(key, now);
            if (w.count < scaled(key, maxRequests)) return 0;
            return (w.index + 1) * windowMs - now;
        }
    }
}
