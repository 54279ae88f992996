package com.webtestool.core.http;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.cache.CacheKeys;
import com.webtestool.core.cache.CacheStore;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.RateLimitedException;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.ScanStats;
import com.webtestool.core.ratelimit.RateFeedback;
import com.webtestool.core.ratelimit.RateLimiter;
import com.webtestool.core.util.Sleeper;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.TickClock;
import com.webtestool.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;

/**
 * 요청 파이프라인: 캐시 조회 → 레이트리미터 대기 → 전송 → 재시도 → 캐시 기록.
 * 크롤러와 모듈이 같은 인스턴스를 공유한다.
 */
public final class Fetcher implements IFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(Fetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(Fetcher.class);

    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);
    /** HttpRequest.Builder 가 거부하는 헤더 */
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final ScanConfig config;
    private final HttpTransport transport;
    private final CacheStore<CachedResponse> cache;   // nullable = 캐시 끔
    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final TickClock clock;
    private final ScanStats stats;

    public Fetcher(ScanConfig config, HttpTransport transport, CacheStore<CachedResponse> cache,
                   RateLimiter limiter, RetryPolicy retryPolicy, Sleeper sleeper, TickClock clock, ScanStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.cache = cache;
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = (stats == null) ? new ScanStats() : stats;
    }

    public ScanStats stats() { return stats; }

    @Override
    public FetchResult fetch(FetchRequest req) throws FetchException {
        Objects.requireNonNull(req, "req");
        final URI url = req.getUrl();
        final String host = UrlUtils.hostOf(url);

        String key = null;
        if (cache != null && req.isCacheable()) {
            key = CacheKeys.fingerprint(req.getMethod(), url, relevantHeaders(req));
            Optional<CachedResponse> hit = cache.get(key);
            if (hit.isPresent()) {
                stats.cacheHit();
                LOG.debug("cache hit {}", url);
                return hit.get().toResult();
            }
        }

        final HttpRequest httpReq = buildRequest(req);
        final boolean follow = (req.getFollowRedirects() != null)
                ? req.getFollowRedirects() : config.isFollowRedirects();
        final Duration maxWait = config.getRateLimit().getMaxQueueWait();
        int attempt = 1;
        try {
            while (true) {
                if (!limiter.allowBlocking(host, maxWait)) {
                    stats.rateLimited();
                    stats.addAttempts(attempt - 1);
                    SLOG.warn("rate-limited", "url", url, "host", host, "maxWaitMs", maxWait.toMillis());
                    throw new RateLimitedException(url, host, maxWait);
                }

                long t0 = System.nanoTime();
                TransportResponse resp = null;
                IOException ioError = null;
                stats.enter();
                try {
                    resp = transport.send(httpReq, follow);
                } catch (IOException e) {
                    ioError = e;
                } finally {
                    stats.exit();
                }
                long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
                stats.addLatencyMs(elapsedMs);

                int status = (resp == null) ? -1 : resp.statusCode();
                feedback(host, status);

                boolean accepted = req.isAcceptServerErrors() && status >= 500;
                if (!accepted && retryPolicy.shouldRetry(status, attempt)) {
                    Duration delay = retryDelay(resp, retryPolicy.nextDelay(attempt));
                    LOG.debug("retry {} after {}ms (status {}, attempt {})", url, delay.toMillis(), status, attempt);
                    sleeper.sleep(delay);
                    attempt++;
                    continue;
                }

                stats.addAttempts(attempt);
                if (ioError != null) {
                    stats.failure();
                    FetchException.Kind kind = (ioError instanceof HttpTimeoutException)
                            ? FetchException.Kind.TIMEOUT : FetchException.Kind.CONNECTION;
                    throw new FetchException(kind, url, -1, attempt,
                            ioError.getClass().getSimpleName() + ": " + ioError.getMessage(), ioError);
                }
                if (!accepted && DefaultRetryPolicy.isTransient(status)) {
                    stats.failure();
                    throw new FetchException(FetchException.Kind.HTTP_STATUS, url, status, attempt,
                            "retries exhausted", null);
                }

                FetchResult result = FetchResult.builder()
                        .url(url)
                        .finalUrl(resp.finalUri())
                        .statusCode(status)
                        .headers(resp.headers())
                        .body(resp.body())
                        .responseTimeMs(elapsedMs)
                        .attempts(attempt)
                        .build();
                if (key != null && result.isCacheable()) {
                    cache.set(key, CachedResponse.of(result), config.getCache().getTtl());
                }
                return result;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("fetch interrupted: " + url);
        }
    }

    private void feedback(String host, int status) {
        if (limiter instanceof RateFeedback fb) {
            if (status < 0) fb.onFailure(host); else fb.onResponse(host, status);
        }
    }

    /** 요청 고유 헤더 + 인증 여부(세션이 다르면 키도 다르게) */
    private Map<String, String> relevantHeaders(FetchRequest req) {
        Map<String, String> m = new LinkedHashMap<>(req.getHeaders());
        String token = config.getSession().getAuthToken();
        if (token != null && !token.isBlank()) m.put("x-wt-auth", CacheKeys.sha256Hex(token));
        return m;
    }

    HttpRequest buildRequest(FetchRequest req) {
        Duration timeout = (req.getTimeout() != null) ? req.getTimeout() : config.getTimeout();
        HttpRequest.BodyPublisher body = (req.getBody() == null)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(req.getBody());
        HttpRequest.Builder b = HttpRequest.newBuilder(req.getUrl())
                .timeout(timeout)
                .method(req.getMethod(), body);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", config.getUserAgent());
        headers.putAll(config.getSession().getHeaders());
        String cookie = cookieHeader(config.getSession().getCookies());
        if (cookie != null) headers.put("Cookie", cookie);
        String token = config.getSession().getAuthToken();
        if (token != null && !token.isBlank() && !containsIgnoreCase(headers, "Authorization")) {
            headers.put("Authorization", "Bearer " + token);
        }
        headers.putAll(req.getHeaders());

        headers.forEach((k, v) -> {
            if (k == null || v == null) return;
            if (RESTRICTED.contains(k.toLowerCase(Locale.ROOT))) {
                LOG.debug("skip restricted header {}", k);
                return;
            }
            b.setHeader(k, v);
        });
        return b.build();
    }

    static String cookieHeader(Map<String, String> cookies) {
        if (cookies == null || cookies.isEmpty()) return null;
        StringJoiner sj = new StringJoiner("; ");
        cookies.forEach((k, v) -> sj.add(k + "=" + (v == null ? "" : v)));
        return sj.toString();
    }

    private static boolean containsIgnoreCase(Map<String, String> m, String name) {
        for (String k : m.keySet()) if (k.equalsIgnoreCase(name)) return true;
        return false;
    }

    /** Retry-After(초 또는 HTTP-date)를 존중하되 30초로 상한 */
    Duration retryDelay(TransportResponse resp, Duration fallback) {
        if (resp == null) return fallback;
        String v = null;
        for (var e : resp.headers().entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase("Retry-After")
                    && e.getValue() != null && !e.getValue().isEmpty()) {
                v = e.getValue().get(0).trim();
                break;
            }
        }
        if (v == null || v.isEmpty()) return fallback;
        Duration d;
        try {
            d = Duration.ofSeconds(Math.max(0, Long.parseLong(v)));
        } catch (NumberFormatException notSeconds) {
            try {
                long at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
                d = Duration.ofMillis(Math.max(0, at - clock.nowMillis()));
            } catch (DateTimeParseException badDate) {
                LOG.debug("unparseable Retry-After '{}', using backoff", v);
                return fallback;
            }
        }
        return (d.compareTo(RETRY_AFTER_CAP) > 0) ? RETRY_AFTER_CAP : d;
    }
}
