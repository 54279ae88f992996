package com.webtestool.core.ratelimit;

import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/** 설정 → 리미터 구성. 처리량 리미터 뒤에 호스트별 politeness 간격 리미터를 항상 붙인다. */
public final class RateLimiterFactory {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimiterFactory.class);

    private RateLimiterFactory() {}

    /** politeness 는 크롤러가 robots Crawl-delay 를 반영할 때 직접 쓴다 */
    public record Limiters(RateLimiter limiter, MinIntervalLimiter politeness) {}

    public static Limiters create(ScanConfig cfg, TickClock clock, Sleeper sleeper) {
        AbstractRateLimiter throughput = throughput(cfg.getRateLimit(), clock, sleeper);
        MinIntervalLimiter polite = new MinIntervalLimiter(cfg.getCrawler().getCrawlDelayMs(), clock, sleeper);
        RateLimiter chained = new ChainedRateLimiter(List.of(throughput, polite), clock, sleeper);
        LOG.info("rate limiter: {} {}req/{}ms, crawlDelay={}ms",
                cfg.getRateLimit().getStrategy(), cfg.getRateLimit().getMaxRequests(),
                cfg.getRateLimit().getWindow().toMillis(), cfg.getCrawler().getCrawlDelayMs());
        return new Limiters(chained, polite);
    }

    static AbstractRateLimiter throughput(ScanConfig.RateLimitCfg rl, TickClock clock, Sleeper sleeper) {
        int max = rl.getMaxRequests();
        Duration window = rl.getWindow();
        return switch (rl.getStrategy()) {
            case TOKEN_BUCKET -> tokenBucket(max, window, clock, sleeper);
            case FIXED_WINDOW -> new FixedWindowLimiter(max, window, clock, sleeper);
            case SLIDING_WINDOW -> new SlidingWindowLimiter(max, window, clock, sleeper);
            case ADAPTIVE -> new AdaptiveLimiter(tokenBucket(max, window, clock, sleeper),
                    AdaptiveLimiter.DEFAULT_SUCCESS_STREAK, clock, sleeper);
        };
    }

    /** refill = max / window */
    private static TokenBucketLimiter tokenBucket(int max, Duration window, TickClock clock, Sleeper sleeper) {
        double perSecond = max * 1000.0 / Math.max(1, window.toMillis());
        return new TokenBucketLimiter(max, perSecond, clock, sleeper);
    }
}
