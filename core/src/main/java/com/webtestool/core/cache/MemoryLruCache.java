package com.webtestool.core.cache;

import com.webtestool.core.util.TickClock;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 크기 제한 LRU(접근 순서) + 항목별 만료. 단일 모니터로 동기화. */
public final class MemoryLruCache<V> implements CacheTier<V> {
    static final String TIER = "memory";

    private final TickClock clock;
    private final Map<String, CacheEntry<V>> map;

    public MemoryLruCache(int maxEntries, TickClock clock) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.clock = clock;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override protected boolean removeEldestEntry(Map.Entry<String, CacheEntry<V>> e) {
                return size() > maxEntries;
            }
        };
    }

    @Override public String name() { return TIER; }

    @Override public synchronized Optional<CacheEntry<V>> read(String key) {
        CacheEntry<V> e = map.get(key);
        if (e == null) return Optional.empty();
        if (e.isExpired(clock.nowMillis())) {
            map.remove(key);
            return Optional.empty();
        }
        return Optional.of(e);
    }

    @Override public synchronized void write(String key, CacheEntry<V> entry) {
        map.put(key, entry);
    }

    @Override public synchronized void remove(String key) {
        map.remove(key);
    }

    @Override public synchronized void clear() {
        map.clear();
    }

    public synchronized int size() {
        return map.size();
    }
}
