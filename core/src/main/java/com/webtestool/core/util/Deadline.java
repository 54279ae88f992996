package com.webtestool.core.util;

import java.time.Duration;
import java.util.Objects;

/**
 * 스캔 전체 마감 시각. 크롤러와 오케스트레이터가 같은 인스턴스를 관찰한다.
 * 요청/모듈 단위 타임아웃은 {@link #cap(Duration)}으로 남은 시간 안에 중첩시킨다.
 */
public final class Deadline {
    private final TickClock clock;
    private final long expiresAtMillis;

    private Deadline(TickClock clock, long expiresAtMillis) {
        this.clock = clock;
        this.expiresAtMillis = expiresAtMillis;
    }

    public static Deadline after(Duration d, TickClock clock) {
        Objects.requireNonNull(d, "d");
        Objects.requireNonNull(clock, "clock");
        long now = clock.nowMillis();
        long ms = d.toMillis();
        long exp = (Long.MAX_VALUE - now < ms) ? Long.MAX_VALUE : now + ms;
        return new Deadline(clock, exp);
    }

    /** 만료 없음(테스트/내부용) */
    public static Deadline none() {
        return new Deadline(TickClock.SYSTEM, Long.MAX_VALUE);
    }

    public boolean isExpired() {
        return clock.nowMillis() >= expiresAtMillis;
    }

    public Duration remaining() {
        if (expiresAtMillis == Long.MAX_VALUE) return Duration.ofMillis(Long.MAX_VALUE);
        return Duration.ofMillis(Math.max(0, expiresAtMillis - clock.nowMillis()));
    }

    /** min(d, remaining) */
    public Duration cap(Duration d) {
        Duration r = remaining();
        return (d == null || r.compareTo(d) < 0) ? r : d;
    }
}
