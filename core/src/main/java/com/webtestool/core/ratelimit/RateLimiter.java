package com.webtestool.core.ratelimit;

import java.time.Duration;

/**
 * 키(호스트)별 요청 허가. 모든 구현은 내부 동기화되어 여러 워커가 공유한다.
 */
public interface RateLimiter {

    /** 지금 허가되면 한 단위 소모하고 true. 대기하지 않는다. */
    boolean allow(String key);

    /** 다음 허가까지 예상 대기(ms). 소모하지 않는다. 0 = 즉시 가능 */
    long estimateWaitMillis(String key);

    /** maxWait 안에 허가받으면 true, 넘기면 false(소모 없음) */
    boolean allowBlocking(String key, Duration maxWait) throws InterruptedException;
}
