package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 공통 골격: 시간원/슬리퍼 주입, allowBlocking 대기 루프, 키별 한도 배율(scale).
 * 실효 한도 = 기본 한도 × scale (0.1..1.0).
 */
public abstract class AbstractRateLimiter implements RateLimiter {
    public static final double MIN_SCALE = 0.1;
    public static final double MAX_SCALE = 1.0;

    protected final TickClock clock;
    private final Sleeper sleeper;
    private final Map<String, Double> scales = new ConcurrentHashMap<>();

    protected AbstractRateLimiter(TickClock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public boolean allowBlocking(String key, Duration maxWait) throws InterruptedException {
        long budget = (maxWait == null) ? 0 : Math.max(0, maxWait.toMillis());
        long start = clock.nowMillis();
        while (true) {
            if (allow(key)) return true;
            long waited = clock.nowMillis() - start;
            long wait = Math.max(1, estimateWaitMillis(key));
            if (waited + wait > budget) return false;
            sleeper.sleep(Duration.ofMillis(wait));
        }
    }

    public void setScale(String key, double factor) {
        scales.put(key, clamp(factor));
    }

    public double scale(String key) {
        return scales.getOrDefault(key, MAX_SCALE);
    }

    /** 배율 적용 후 최소 1 */
    protected int scaled(String key, int base) {
        return Math.max(1, (int) Math.floor(base * scale(key)));
    }

    static double clamp(double f) {
        if (Double.isNaN(f)) return MAX_SCALE;
        return Math.max(MIN_SCALE, Math.min(MAX_SCALE, f));
    }
}
