package com.webtestool.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 요청 텔레메트리 누적기 (스레드 세이프). Fetcher 가 채우고 ScanResult 에 스냅샷으로 실린다. */
public final class ScanStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // 네트워크 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong cacheHits     = new AtomicLong(0);
    private final AtomicLong rateLimited   = new AtomicLong(0);   // 대기 상한 초과로 거절된 요청
    private final AtomicLong failures      = new AtomicLong(0);   // 최종 FetchException
    private final AtomicLong sumLatencyMs  = new AtomicLong(0);
    private final AtomicInteger inFlight   = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** attempts = 1 + retries */
    public void addAttempts(long attempts) {
        requestsTotal.addAndGet(attempts);
        if (attempts > 1) retriesTotal.addAndGet(attempts - 1);
    }
    public void addLatencyMs(long ms) { sumLatencyMs.addAndGet(Math.max(0, ms)); }
    public void cacheHit() { cacheHits.incrementAndGet(); }
    public void rateLimited() { rateLimited.incrementAndGet(); }
    public void failure() { failures.incrementAndGet(); }

    /** 네트워크 진입/이탈 시 호출. 최대 동시 요청 수를 관측한다. */
    public void enter() {
        int now = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(now, Math::max);
    }
    public void exit() { inFlight.decrementAndGet(); }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long avg = (req == 0) ? 0 : sumLatencyMs.get() / req;
        return new Snapshot(req, retriesTotal.get(), cacheHits.get(), rateLimited.get(),
                failures.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final long cacheHits;
        public final long rateLimited;
        public final long failures;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;

        public Snapshot(long requestsTotal, long retriesTotal, long cacheHits, long rateLimited,
                        long failures, int maxObservedConcurrency, long avgLatencyMs) {
            this.requestsTotal = requestsTotal;
            this.retriesTotal = retriesTotal;
            this.cacheHits = cacheHits;
            this.rateLimited = rateLimited;
            this.failures = failures;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgLatencyMs = avgLatencyMs;
        }

        public static Snapshot empty() { return new Snapshot(0, 0, 0, 0, 0, 0, 0); }
    }
}
