package com.webtestool.core.http;

import com.webtestool.core.model.ScanConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 429/5xx/전송 실패에서만 재시도. base → 2·base → 4·base (±10% 지터) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 250); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    public static DefaultRetryPolicy from(ScanConfig.RetryCfg cfg) {
        return new DefaultRetryPolicy(cfg.getMaxAttempts(), cfg.getBaseDelayMs());
    }

    public static boolean isTransient(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return isTransient(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
