package com.webtestool.core.util;

import java.time.Duration;

/** 재시도 백오프/대기용 sleep 추상화(테스트에서 기록형 구현으로 교체). */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
