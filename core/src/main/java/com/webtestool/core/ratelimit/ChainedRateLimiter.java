package com.webtestool.core.ratelimit;

import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.util.List;

/**
 * 여러 리미터를 모두 통과해야 허가. 하나라도 대기가 필요하면 아무것도 소모하지 않는다.
 * 피드백은 RateFeedback 을 구현한 하위 리미터 모두에게 전달된다.
 */
public final class ChainedRateLimiter extends AbstractRateLimiter implements RateFeedback {

    private final List<RateLimiter> chain;

    public ChainedRateLimiter(List<RateLimiter> chain, TickClock clock, Sleeper sleeper) {
        super(clock, sleeper);
        if (chain == null || chain.isEmpty()) throw new IllegalArgumentException("empty chain");
        this.chain = List.copyOf(chain);
    }

    @Override public synchronized boolean allow(String key) {
        for (RateLimiter r : chain) {
            if (r.estimateWaitMillis(key) > 0) return false;
        }
        for (RateLimiter r : chain) {
            r.allow(key);
        }
        return true;
    }

    @Override public long estimateWaitMillis(String key) {
        long max = 0;
        for (RateLimiter r : chain) max = Math.max(max, r.estimateWaitMillis(key));
        return max;
    }

    @Override public void onResponse(String key, int statusCode) {
        for (RateLimiter r : chain) {
            if (r instanceof RateFeedback fb) fb.onResponse(key, statusCode);
        }
    }

    @Override public void onFailure(String key) {
        for (RateLimiter r : chain) {
            if (r instanceof RateFeedback fb) fb.onFailure(key);
        }
    }

    public List<RateLimiter> chain() { return chain; }
}
