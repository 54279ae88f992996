package com.webtestool.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt 는 1부터(방금 끝난 시도 번호). statusCode -1 = 전송 실패. true 면 지연 후 재시도. */
    boolean shouldRetry(int statusCode, int attempt);
    /** attempt 다음 시도 전 지연 */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함) */
    int maxAttempts();
}
