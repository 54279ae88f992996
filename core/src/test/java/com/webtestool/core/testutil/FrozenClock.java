package com.webtestool.core.testutil;

import com.webtestool.core.util.TickClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

public final class FrozenClock implements TickClock {
    private final AtomicLong now;

    public FrozenClock(long start) { this.now = new AtomicLong(start); }

    public void plusMillis(long d) { now.addAndGet(d); }
    public void plus(Duration d) { plusMillis(d.toMillis()); }

    @Override public long nowMillis() { return now.get(); }
}
