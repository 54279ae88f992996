package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 키별 토큰 버킷. 처음엔 가득 찬 상태, 경과 시간만큼 refillPerSecond 로 채운다. */
public final class TokenBucketLimiter extends AbstractRateLimiter {

    private static final class Bucket {
        double tokens;
        long lastRefill;
        Bucket(double tokens, long now) { this.tokens = tokens; this.lastRefill = now; }
    }

    private final int capacity;
    private final double refillPerSecond;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketLimiter(int capacity, double refillPerSecond, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (!(refillPerSecond > 0)) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
    }

    private Bucket bucket(String key) {
        return buckets.computeIfAbsent(key, k -> new Bucket(scaled(k, capacity), clock.nowMillis()));
    }

    private void refill(String key, Bucket b, long now) {
        double cap = scaled(key, capacity);
        double rate = refillPerSecond * scale(key);
        long elapsed = Math.max(0, now - b.lastRefill);
        b.tokens = Math.min(cap, b.tokens + elapsed * rate / 1000.0);
        b.lastRefill = now;
    }

    @Override public boolean allow(String key) {
        Bucket b = bucket(key);
        synchronized (b) {
            refill(key, b, clock.nowMillis());
            if (b.tokens >= 1.0) {
                b.tokens -= 1.0;
                return true;
            }
            return false;
        }
    }

    @Override public long estimateWaitMillis(String key) {
        Bucket b = bucket(key);
        synchronized (b) {
            refill(key, b, clock.nowMillis());
            if (b.tokens >= 1.0) return 0;
            double rate = refillPerSecond * scale(key);
            return (long) Math.ceil((1.0 - b.tokens) * 1000.0 / rate);
        }
    }

    /** 현재 토큰 수(테스트/진단용) */
    public double tokens(String key) {
        Bucket b = bucket(key);
        synchronized (b) {
            refill(key, b, clock.nowMillis());
            return b.tokens;
        }
    }
}
