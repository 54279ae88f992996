package com.webtestool.core.crawler.robots;

import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.TickClock;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트별 robots 정책 캐시. 같은 호스트는 동시에 한 번만 가져온다.
 * 성공 TTL 30분, 실패(404/410/5xx/네트워크/교차 호스트 리다이렉트) TTL 10분 → allow-all.
 */
public final class RobotsRepository {
    private static final StructuredLog SLOG = StructuredLog.get(RobotsRepository.class);

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    static final int MAX_REDIRECTS = 3;

    private record Entry(RobotsPolicy policy, long expiresAt) {}

    private final RobotsFetcher fetcher;
    private final TickClock clock;
    private final String userAgent;
    private final Duration successTtl;
    private final Duration failureTtl;
    private final Map<String, Entry> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public RobotsRepository(RobotsFetcher fetcher, TickClock clock, String userAgent) {
        this(fetcher, clock, userAgent, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    public RobotsRepository(RobotsFetcher fetcher, TickClock clock, String userAgent,
                            Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.userAgent = userAgent;
        this.successTtl = (successTtl == null) ? DEFAULT_SUCCESS_TTL : successTtl;
        this.failureTtl = (failureTtl == null) ? DEFAULT_FAILURE_TTL : failureTtl;
    }

    /** scheme://host:port 키(기본 포트 채움) */
    static String cacheKey(URI page) {
        String scheme = (page.getScheme() == null) ? "https" : page.getScheme().toLowerCase(Locale.ROOT);
        String host = (page.getHost() == null) ? "" : page.getHost().toLowerCase(Locale.ROOT);
        int port = page.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return scheme + "://" + host + ":" + port;
    }

    public RobotsPolicy policyFor(URI page) {
        String key = cacheKey(page);
        Entry e = cache.get(key);
        if (e != null && e.expiresAt() > clock.nowMillis()) return e.policy();

        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            e = cache.get(key);
            long now = clock.nowMillis();
            if (e != null && e.expiresAt() > now) return e.policy();

            RobotsPolicy p = load(page);
            Duration ttl = p.isAllowAll() ? failureTtl : successTtl;
            cache.put(key, new Entry(p, now + ttl.toMillis()));
            SLOG.info("robots-loaded", "origin", key, "allowAll", p.isAllowAll(), "crawlDelayMs", p.crawlDelayMs());
            return p;
        }
    }

    private RobotsPolicy load(URI page) {
        URI robots = robotsTxtUri(page);
        if (robots == null) return RobotsPolicy.allowAll();

        URI cur = robots;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();
            if (s >= 200 && s < 300) {
                // 전송 계층이 리다이렉트를 따라간 경우도 같은 호스트여야 한다
                if (r.location() != null && !sameHost(robots, r.location())) return RobotsPolicy.allowAll();
                return RobotsPolicy.parse(r.body(), userAgent);
            }
            if (isRedirect(s) && r.location() != null && sameHost(cur, r.location())) {
                cur = r.location();
                continue;
            }
            return RobotsPolicy.allowAll();
        }
        return RobotsPolicy.allowAll();   // 리다이렉트 초과
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 303 || s == 307 || s == 308;
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = (a.getHost() == null) ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = (b.getHost() == null) ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = (page.getScheme() == null) ? "https" : page.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        int port = page.getPort();
        return URI.create(scheme + "://" + host + (port < 0 ? "" : ":" + port) + "/robots.txt");
    }
}
