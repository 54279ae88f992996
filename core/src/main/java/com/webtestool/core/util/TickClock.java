package com.webtestool.core.util;

/**
 * 밀리초 단위 시간원. 캐시 TTL / 레이트리미터 / robots 캐시 / 데드라인이 공유한다.
 * 테스트에서는 고정 시계를 주입해 시간 흐름을 직접 제어한다.
 */
@FunctionalInterface
public interface TickClock {
    long nowMillis();

    TickClock SYSTEM = System::currentTimeMillis;
}
