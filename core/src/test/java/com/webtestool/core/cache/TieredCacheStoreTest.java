package com.webtestool.core.cache;

import com.webtestool.core.error.CacheException;
import com.webtestool.core.testutil.FrozenClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TieredCacheStoreTest {

    /** 캐시 값 DTO */
    public static final class Page {
        public String url;
        public int status;

        public Page() {}

        Page(String url, int status) { this.url = url; this.status = status; }
    }

    /** 항상 실패하는 계층 */
    private static final class BrokenTier implements CacheTier<Page> {
        @Override public String name() { return "remote"; }
        @Override public Optional<CacheEntry<Page>> read(String key) throws CacheException {
            throw new CacheException("remote", "connection refused", null);
        }
        @Override public void write(String key, CacheEntry<Page> entry) throws CacheException {
            throw new CacheException("remote", "connection refused", null);
        }
        @Override public void remove(String key) throws CacheException {
            throw new CacheException("remote", "connection refused", null);
        }
        @Override public void clear() throws CacheException {
            throw new CacheException("remote", "connection refused", null);
        }
    }

    /** 읽은 값을 쥔 채 latch 가 풀릴 때까지 멈추는 하위 계층 */
    private static final class HeldTier implements CacheTier<Page> {
        final MemoryLruCache<Page> inner;
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean hold = true;

        HeldTier(FrozenClock clk) { this.inner = new MemoryLruCache<>(100, clk); }

        @Override public String name() { return "disk"; }
        @Override public Optional<CacheEntry<Page>> read(String key) {
            Optional<CacheEntry<Page>> snapshot = inner.read(key);
            if (hold) {
                hold = false;
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return snapshot;
        }
        @Override public void write(String key, CacheEntry<Page> entry) { inner.write(key, entry); }
        @Override public void remove(String key) { inner.remove(key); }
        @Override public void clear() { inner.clear(); }
    }

    @Test
    void memory_entry_expires_after_ttl() {
        FrozenClock clk = new FrozenClock(1_000);
        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(new MemoryLruCache<>(10, clk)), clk);

        store.set("k", new Page("http://a/", 200), Duration.ofSeconds(5));
        assertEquals(200, store.get("k").orElseThrow().status);

        clk.plusMillis(4_999);
        assertTrue(store.get("k").isPresent());
        clk.plusMillis(1);
        assertTrue(store.get("k").isEmpty());

        assertEquals(2, store.stats().hits());
        assertEquals(1, store.stats().misses());
    }

    @Test
    void lru_evicts_least_recently_used() {
        FrozenClock clk = new FrozenClock(0);
        MemoryLruCache<Page> mem = new MemoryLruCache<>(2, clk);
        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(mem), clk);

        store.set("a", new Page("a", 1), Duration.ofMinutes(1));
        store.set("b", new Page("b", 2), Duration.ofMinutes(1));
        store.get("a");                                  // a 최근 사용
        store.set("c", new Page("c", 3), Duration.ofMinutes(1));

        assertEquals(2, mem.size());
        assertTrue(store.get("a").isPresent());
        assertTrue(store.get("b").isEmpty());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    void disk_roundtrip_survives_new_instance(@TempDir Path dir) throws Exception {
        FrozenClock clk = new FrozenClock(0);
        DiskCache<Page> disk = new DiskCache<>(dir, Page.class, clk);
        disk.write("key-1", new CacheEntry<>(new Page("http://x/", 404), 60_000));

        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                    .containsExactly(CacheKeys.sha256Hex("key-1") + ".json");
        }

        DiskCache<Page> reopened = new DiskCache<>(dir, Page.class, clk);
        CacheEntry<Page> e = reopened.read("key-1").orElseThrow();
        assertEquals("http://x/", e.value().url);
        assertEquals(60_000, e.expiresAtMillis());

        clk.plusMillis(60_000);
        assertTrue(reopened.read("key-1").isEmpty());
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("디스크 적중은 남은 TTL 그대로 메모리에 승격")
    void disk_hit_promoted_to_memory(@TempDir Path dir) {
        FrozenClock clk = new FrozenClock(0);
        MemoryLruCache<Page> mem = new MemoryLruCache<>(10, clk);
        DiskCache<Page> disk = new DiskCache<>(dir, Page.class, clk);

        TieredCacheStore<Page> writer = new TieredCacheStore<>(List.of(disk), clk);
        writer.set("k", new Page("u", 200), Duration.ofSeconds(10));

        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(mem, disk), clk);
        clk.plusMillis(4_000);
        assertTrue(store.get("k").isPresent());
        assertEquals(1, store.stats().diskHits());
        assertEquals(1, mem.size());

        assertTrue(store.get("k").isPresent());
        assertEquals(1, store.stats().memoryHits());

        clk.plusMillis(6_000);                           // 원래 만료 시각
        assertTrue(store.get("k").isEmpty());
    }

    @Test
    void broken_tier_degrades_to_miss_and_write_skip() {
        FrozenClock clk = new FrozenClock(0);
        MemoryLruCache<Page> mem = new MemoryLruCache<>(10, clk);
        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(mem, new BrokenTier()), clk);

        assertTrue(store.get("none").isEmpty());
        store.set("k", new Page("u", 200), Duration.ofSeconds(10));
        assertTrue(store.get("k").isPresent());
        assertDoesNotThrow(() -> store.delete("k"));
        assertDoesNotThrow(store::clear);

        assertEquals(4, store.stats().tierErrors());
        assertEquals(List.of("memory", "remote"), store.tierNames());
    }

    @Test
    void fingerprint_ignores_query_order_and_header_case() {
        String a = CacheKeys.fingerprint("get", java.net.URI.create("http://Ex.com/p?b=2&a=1"), java.util.Map.of("X-A", "1"));
        String b = CacheKeys.fingerprint("GET", java.net.URI.create("http://ex.com/p?a=1&b=2"), java.util.Map.of("x-a", "1"));
        String c = CacheKeys.fingerprint("GET", java.net.URI.create("http://ex.com/p?a=1&b=2"), java.util.Map.of("x-a", "2"));
        assertEquals(a, b);
        assertNotEquals(b, c);
        assertThat(a).hasSize(64);
    }

    @Test
    @DisplayName("읽는 도중 set 된 새 값을 오래된 승격이 덮어쓰지 않음")
    void stale_lower_tier_read_is_not_promoted_over_newer_set() throws Exception {
        FrozenClock clk = new FrozenClock(0);
        MemoryLruCache<Page> mem = new MemoryLruCache<>(10, clk);
        HeldTier lower = new HeldTier(clk);
        lower.inner.write("k", new CacheEntry<>(new Page("old", 200), 60_000));
        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(mem, lower), clk);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<Page>> reader = pool.submit(() -> store.get("k"));
            assertTrue(lower.entered.await(5, TimeUnit.SECONDS));

            store.set("k", new Page("new", 200), Duration.ofMinutes(1));
            lower.release.countDown();
            reader.get(5, TimeUnit.SECONDS);

            assertEquals("new", store.get("k").orElseThrow().url);
            assertEquals("new", mem.read("k").orElseThrow().value().url);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrent_set_and_get_leave_tiers_consistent() throws Exception {
        FrozenClock clk = new FrozenClock(0);
        MemoryLruCache<Page> mem = new MemoryLruCache<>(1, clk);         // 잦은 축출 → 승격 경로
        MemoryLruCache<Page> lower = new MemoryLruCache<>(100, clk);
        TieredCacheStore<Page> store = new TieredCacheStore<>(List.of(mem, lower), clk);
        List<String> keys = List.of("a", "b", "c");

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                final int id = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 500; i++) {
                        String k = keys.get((id + i) % keys.size());
                        if (i % 3 == 0) store.set(k, new Page(k + "-" + id + "-" + i, 200), Duration.ofMinutes(1));
                        else store.get(k).ifPresent(p -> assertTrue(p.url.startsWith(k + "-")));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        for (String k : keys) {
            String latest = lower.read(k).orElseThrow().value().url;
            mem.read(k).ifPresent(e -> assertEquals(latest, e.value().url));
            assertEquals(latest, store.get(k).orElseThrow().url);
        }
        assertEquals(0, store.stats().tierErrors());
    }
}
