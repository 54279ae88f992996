package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 슬라이딩 창: 최근 window 안의 허가 시각을 들고 maxRequests 를 넘지 않게 한다 */
public final class SlidingWindowLimiter extends AbstractRateLimiter {

    private final int maxRequests;
    private final long windowMs;
    private final Map<String, Deque<Long>> log = new ConcurrentHashMap<>();

    public SlidingWindowLimiter(int maxRequests, Duration window, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be >= 1");
        this.maxRequests = maxRequests;
        this.windowMs = Math.max(1, window.toMillis());
    }

    private Deque<Long> evict(String key, long now) {
        Deque<Long> q = log.computeIfAbsent(key, k -> new ArrayDeque<>());
        long cutoff = now - windowMs;
        while (!q.isEmpty() && q.peekFirst() <= cutoff) q.pollFirst();
        return q;
    }

    @Override public boolean allow(String key) {
        Deque<Long> q = log.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (q) {
            long now = clock.nowMillis();
            evict(key, now);
            if (q.size() >= scaled(key, maxRequests)) return false;
            q.addLast(now);
            return true;
        }
    }

    @Override public long estimateWaitMillis(String key) {
        Deque<Long> q = log.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (q) {
            long now = clock.nowMillis();
            evict(key, now);
            if (q.size() < scaled(key, maxRequests)) return 0;
            return Math.max(1, q.peekFirst() + windowMs - now);
        }
    }

    /** 현재 창에서 남은 허가 수 */
    public int remaining(String key) {
        Deque<Long> q = log.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (q) {
            evict(key, clock.nowMillis());
            return Math.max(0, scaled(key, maxRequests) - q.size());
        }
    }
}
