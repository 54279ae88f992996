package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 서버 부하 신호에 따라 delegate 의 키별 한도를 조절한다.
 * 429/503/전송 실패 → 배율 절반, 연속 성공 successStreak 회 → +0.1. 범위는 0.1..1.0.
 */
public final class AdaptiveLimiter extends AbstractRateLimiter implements RateFeedback {
    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveLimiter.class);

    public static final int DEFAULT_SUCCESS_STREAK = 10;
    static final double STEP_UP = 0.1;

    private final AbstractRateLimiter delegate;
    private final int successStreak;
    private final Map<String, int[]> streaks = new ConcurrentHashMap<>();

    public AdaptiveLimiter(AbstractRateLimiter delegate, int successStreak, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        this.delegate = delegate;
        this.successStreak = Math.max(1, successStreak);
    }

    @Override public boolean allow(String key) { return delegate.allow(key); }

    @Override public long estimateWaitMillis(String key) { return delegate.estimateWaitMillis(key); }

    @Override public double scale(String key) { return delegate.scale(key); }

    @Override public void setScale(String key, double factor) { delegate.setScale(key, factor); }

    @Override public void onResponse(String key, int statusCode) {
        if (statusCode == 429 || statusCode == 503) {
            backOff(key, "status " + statusCode);
        } else if (statusCode > 0 && statusCode < 500) {
            succeed(key);
        }
    }

    @Override public void onFailure(String key) {
        backOff(key, "transport failure");
    }

    private void backOff(String key, String why) {
        int[] s = streaks.computeIfAbsent(key, k -> new int[1]);
        synchronized (s) {
            s[0] = 0;
            double before = delegate.scale(key);
            delegate.setScale(key, before / 2.0);
            LOG.debug("adaptive limit {} {}: {} -> {}", key, why, before, delegate.scale(key));
        }
    }

    private void succeed(String key) {
        int[] s = streaks.computeIfAbsent(key, k -> new int[1]);
        synchronized (s) {
            if (++s[0] >= successStreak) {
                s[0] = 0;
                delegate.setScale(key, delegate.scale(key) + STEP_UP);
            }
        }
    }
}
