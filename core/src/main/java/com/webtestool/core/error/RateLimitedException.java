package com.webtestool.core.error;

import java.net.URI;
import java.time.Duration;

/** 레이트리미터 대기 상한을 넘긴 경우. 해당 페이지에 대해서는 FetchException으로 취급된다. */
public class RateLimitedException extends FetchException {
    private final String limiterKey;
    private final Duration waited;

    public RateLimitedException(URI url, String limiterKey, Duration waited) {
        super(Kind.RATE_LIMITED, url,
                "rate limit wait exceeded for key=" + limiterKey + " after " + waited.toMillis() + "ms", null);
        this.limiterKey = limiterKey;
        this.waited = waited;
    }

    public String getLimiterKey() { return limiterKey; }
    public Duration getWaited() { return waited; }
}
