package com.webtestool.core.cache;

import com.webtestool.core.testutil.FrozenClock;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCacheTest {

    /** GET/SETEX/DEL 의미만 흉내 내는 인메모리 클라이언트 */
    private static class MapClient implements RemoteCacheClient {
        final Map<String, String> data = new HashMap<>();
        final Map<String, Long> ttls = new HashMap<>();

        @Override public String get(String key) { return data.get(key); }
        @Override public void setex(String key, long ttlSeconds, String value) {
            data.put(key, value);
            ttls.put(key, ttlSeconds);
        }
        @Override public void del(String key) { data.remove(key); }
        @Override public void delByPrefix(String prefix) { data.keySet().removeIf(k -> k.startsWith(prefix)); }
    }

    @Test
    void remote_tier_stores_prefixed_envelope_with_rounded_ttl() {
        FrozenClock clk = new FrozenClock(0);
        MapClient client = new MapClient();
        TieredCacheStore<String> store = new TieredCacheStore<>(
                List.of(new RemoteCache<>(client, String.class, clk)), clk);

        store.set("abc", "hello", Duration.ofMillis(1_500));
        assertTrue(client.data.containsKey("wt:abc"));
        assertTrue(client.data.get("wt:abc").contains("\"hello\""));
        assertEquals(2L, client.ttls.get("wt:abc"));
        assertEquals("hello", store.get("abc").orElseThrow());
        assertEquals(1, store.stats().remoteHits());

        clk.plusMillis(1_500);
        assertTrue(store.get("abc").isEmpty());
        assertFalse(client.data.containsKey("wt:abc"));
    }

    @Test
    void clear_only_touches_own_prefix() {
        FrozenClock clk = new FrozenClock(0);
        MapClient client = new MapClient();
        client.data.put("other:1", "x");
        TieredCacheStore<String> store = new TieredCacheStore<>(
                List.of(new RemoteCache<>(client, String.class, clk)), clk);
        store.set("a", "1", Duration.ofMinutes(1));
        store.clear();
        assertEquals(Map.of("other:1", "x"), client.data);
    }

    @Test
    void unchecked_client_failure_degrades_to_miss() {
        FrozenClock clk = new FrozenClock(0);
        RemoteCacheClient down = new MapClient() {
            @Override public String get(String key) { throw new IllegalStateException("connection refused"); }
            @Override public void setex(String key, long ttlSeconds, String value) {
                throw new IllegalStateException("connection refused");
            }
        };
        MemoryLruCache<String> mem = new MemoryLruCache<>(10, clk);
        TieredCacheStore<String> store = new TieredCacheStore<>(
                List.of(mem, new RemoteCache<>(down, String.class, clk)), clk);

        assertTrue(store.get("k").isEmpty());
        store.set("k", "v", Duration.ofMinutes(1));
        assertEquals("v", store.get("k").orElseThrow());
        assertEquals(2, store.stats().tierErrors());
    }

    @Test
    void null_or_foreign_payload_is_a_miss() {
        FrozenClock clk = new FrozenClock(0);
        MapClient client = new MapClient();
        client.data.put("wt:k", "null");
        client.data.put("wt:other", "{\"key\":\"someone-else\",\"expiresAt\":\"2100-01-01T00:00:00Z\",\"value\":\"x\"}");
        TieredCacheStore<String> store = new TieredCacheStore<>(
                List.of(new RemoteCache<>(client, String.class, clk)), clk);

        assertTrue(store.get("k").isEmpty());
        assertTrue(store.get("other").isEmpty());
        assertEquals(0, store.stats().tierErrors());
    }
}
