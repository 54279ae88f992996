package com.webtestool.core.ratelimit;

import com.webtestool.core.testutil.FrozenClock;
import com.webtestool.core.testutil.RecordingSleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TokenBucketLimiterTest {

    @Test
    @DisplayName("용량 5, 초당 1: 즉시 5회 허용, 6번째 거부, 1초 뒤 1회 허용")
    void capacity5_refill1_sixthRejected() {
        FrozenClock clk = new FrozenClock(0);
        TokenBucketLimiter tb = new TokenBucketLimiter(5, 1.0, clk, new RecordingSleeper(clk));

        for (int i = 0; i < 5; i++) assertTrue(tb.allow("h"), "request " + (i + 1));
        assertFalse(tb.allow("h"), "6th must be rejected");

        clk.plusMillis(1000);
        assertTrue(tb.allow("h"));
        assertFalse(tb.allow("h"));
    }

    @Test
    void keys_are_independent() {
        FrozenClock clk = new FrozenClock(0);
        TokenBucketLimiter tb = new TokenBucketLimiter(1, 1.0, clk, new RecordingSleeper(clk));
        assertTrue(tb.allow("a"));
        assertFalse(tb.allow("a"));
        assertTrue(tb.allow("b"));
    }

    @Test
    void estimateWait_reflects_refill_rate() {
        FrozenClock clk = new FrozenClock(0);
        TokenBucketLimiter tb = new TokenBucketLimiter(2, 4.0, clk, new RecordingSleeper(clk));
        tb.allow("h");
        tb.allow("h");
        assertEquals(250, tb.estimateWaitMillis("h"));
        clk.plusMillis(100);
        assertEquals(150, tb.estimateWaitMillis("h"));
    }

    @Test
    @DisplayName("allowBlocking: 예산 안이면 대기 후 허용, 넘으면 거부")
    void allowBlocking_waits_within_budget() throws Exception {
        FrozenClock clk = new FrozenClock(0);
        RecordingSleeper sl = new RecordingSleeper(clk);
        TokenBucketLimiter tb = new TokenBucketLimiter(1, 1.0, clk, sl);

        assertTrue(tb.allowBlocking("h", Duration.ZERO));
        assertTrue(tb.allowBlocking("h", Duration.ofSeconds(2)));
        assertThat(sl.totalMillis()).isEqualTo(1000);

        assertFalse(tb.allowBlocking("h", Duration.ofMillis(500)));
    }

    @Test
    void scale_shrinks_capacity_but_never_below_one() {
        FrozenClock clk = new FrozenClock(0);
        TokenBucketLimiter tb = new TokenBucketLimiter(10, 10.0, clk, new RecordingSleeper(clk));
        tb.setScale("h", 0.01);
        assertEquals(AbstractRateLimiter.MIN_SCALE, tb.scale("h"));
        assertTrue(tb.allow("h"));
        assertFalse(tb.allow("h"));
        assertThat(tb.tokens("h")).isLessThan(1.0);
    }
}
