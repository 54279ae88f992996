package com.webtestool.core.service;

import com.webtestool.core.api.ICrawler;
import com.webtestool.core.api.IFetcher;
import com.webtestool.core.cache.CacheFactory;
import com.webtestool.core.cache.CacheStore;
import com.webtestool.core.cache.RemoteCacheClient;
import com.webtestool.core.crawler.Crawler;
import com.webtestool.core.crawler.JsoupPageParser;
import com.webtestool.core.crawler.robots.FetcherRobotsFetcher;
import com.webtestool.core.crawler.robots.RobotsRepository;
import com.webtestool.core.http.CachedResponse;
import com.webtestool.core.http.DefaultRetryPolicy;
import com.webtestool.core.http.Fetcher;
import com.webtestool.core.http.HttpTransport;
import com.webtestool.core.http.JdkHttpTransport;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.ScanStats;
import com.webtestool.core.ratelimit.RateLimiterFactory;
import com.webtestool.core.util.DefaultSleeper;
import com.webtestool.core.util.ProgressListener;
import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.TickClock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스캔 1회분 협력 객체 묶음(Fetcher/Crawler/통계).
 * 캐시/리미터/robots 저장소는 같은 Fetcher 를 공유한다.
 */
public final class ScanComponents {

    /** 스캔마다 새 묶음을 만든다(검증된 설정만 들어온다) */
    @FunctionalInterface
    public interface Factory {
        ScanComponents create(ScanConfig config, ProgressListener progress, AtomicBoolean cancel);
    }

    private final IFetcher fetcher;
    private final ICrawler crawler;
    private final ScanStats stats;

    public ScanComponents(IFetcher fetcher, ICrawler crawler, ScanStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.stats = (stats == null) ? new ScanStats() : stats;
    }

    public IFetcher fetcher() { return fetcher; }
    public ICrawler crawler() { return crawler; }
    public ScanStats stats() { return stats; }

    /** 실제 HTTP(JDK HttpClient) + 시스템 시계 */
    public static Factory standard() {
        return standard(null, null, TickClock.SYSTEM, DefaultSleeper.INSTANCE);
    }

    /**
     * @param transport null 이면 JdkHttpTransport
     * @param remote    TIERED 캐시의 원격 계층(없으면 null)
     */
    public static Factory standard(HttpTransport transport, RemoteCacheClient remote, TickClock clock, Sleeper sleeper) {
        return (config, progress, cancel) -> {
            ScanStats stats = new ScanStats();
            CacheStore<CachedResponse> cache = config.getCache().isEnabled()
                    ? CacheFactory.create(config.getCache(), CachedResponse.class, remote, clock)
                    : null;
            RateLimiterFactory.Limiters limiters = RateLimiterFactory.create(config, clock, sleeper);
            HttpTransport t = (transport != null) ? transport : new JdkHttpTransport(config);
            Fetcher fetcher = new Fetcher(config, t, cache, limiters.limiter(),
                    DefaultRetryPolicy.from(config.getRetry()), sleeper, clock, stats);

            RobotsRepository robots = null;
            if (config.getCrawler().isRespectRobots()) {
                Duration ttl = Duration.ofMinutes(config.getCrawler().getRobotsTtlMinutes());
                robots = new RobotsRepository(new FetcherRobotsFetcher(fetcher), clock, config.getUserAgent(),
                        ttl, RobotsRepository.DEFAULT_FAILURE_TTL);
            }
            Crawler crawler = new Crawler(config, fetcher, new JsoupPageParser(), robots, limiters.politeness())
                    .progress(progress)
                    .cancelFlag(cancel);
            return new ScanComponents(fetcher, crawler, stats);
        };
    }
}
