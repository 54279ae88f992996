package com.webtestool.core.cache;

import com.webtestool.core.error.CacheException;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.TickClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 위 계층부터 조회(memory → disk → remote).
 * 아래 계층 적중은 남은 TTL 그대로 위 계층 전부에 승격한다.
 * 계층 오류는 로그만 남기고 미스/쓰기 생략으로 처리한다.
 */
public final class TieredCacheStore<V> implements CacheStore<V> {
    private static final Logger LOG = LoggerFactory.getLogger(TieredCacheStore.class);
    private static final StructuredLog SLOG = StructuredLog.get(TieredCacheStore.class);

    private static final int STRIPES = 64;

    private final List<CacheTier<V>> tiers;
    private final TickClock clock;
    private final CacheStats stats = new CacheStats();
    // 키 스트라이프별 쓰기 버전. 해당 스트라이프 모니터 안에서만 읽고 쓴다.
    private final Object[] locks = new Object[STRIPES];
    private final long[] versions = new long[STRIPES];

    public TieredCacheStore(List<CacheTier<V>> tiers, TickClock clock) {
        if (tiers == null || tiers.isEmpty()) throw new IllegalArgumentException("at least one tier required");
        this.tiers = List.copyOf(tiers);
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < STRIPES; i++) locks[i] = new Object();
    }

    private static int stripe(String key) {
        return (key.hashCode() & 0x7fffffff) % STRIPES;
    }

    private long version(int stripe) {
        synchronized (locks[stripe]) {
            return versions[stripe];
        }
    }

    @Override public Optional<V> get(String key) {
        final int st = stripe(key);
        final long seen = version(st);
        for (int i = 0; i < tiers.size(); i++) {
            CacheTier<V> t = tiers.get(i);
            Optional<CacheEntry<V>> hit;
            try {
                hit = t.read(key);
            } catch (CacheException e) {
                degraded("cache-read-failed", e);
                continue;
            } catch (RuntimeException e) {
                degraded("cache-read-failed", t.name(), e);
                continue;
            }
            if (hit.isPresent()) {
                CacheEntry<V> e = hit.get();
                if (i > 0) promote(key, e, i, st, seen);
                stats.hit(t.name());
                return Optional.ofNullable(e.value());
            }
        }
        stats.miss();
        return Optional.empty();
    }

    /** 읽는 사이 같은 스트라이프에 쓰기가 있었으면 오래된 값일 수 있으니 승격하지 않는다 */
    private void promote(String key, CacheEntry<V> e, int foundAt, int st, long seen) {
        synchronized (locks[st]) {
            if (versions[st] != seen) {
                LOG.debug("skip promotion of {}: concurrent write", key);
                return;
            }
            for (int j = 0; j < foundAt; j++) {
                CacheTier<V> t = tiers.get(j);
                try {
                    t.write(key, e);
                } catch (CacheException ex) {
                    degraded("cache-promote-failed", ex);
                } catch (RuntimeException ex) {
                    degraded("cache-promote-failed", t.name(), ex);
                }
            }
        }
    }

    @Override public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        long now = clock.nowMillis();
        long ms = ttl.toMillis();
        long exp = (Long.MAX_VALUE - now < ms) ? Long.MAX_VALUE : now + ms;
        CacheEntry<V> entry = new CacheEntry<>(value, exp);
        final int st = stripe(key);
        synchronized (locks[st]) {
            versions[st]++;
            for (CacheTier<V> t : tiers) {
                try {
                    t.write(key, entry);
                } catch (CacheException e) {
                    degraded("cache-write-failed", e);
                } catch (RuntimeException e) {
                    degraded("cache-write-failed", t.name(), e);
                }
            }
        }
        stats.write();
    }

    @Override public void delete(String key) {
        final int st = stripe(key);
        synchronized (locks[st]) {
            versions[st]++;
            for (CacheTier<V> t : tiers) {
                try {
                    t.remove(key);
                } catch (CacheException e) {
                    degraded("cache-delete-failed", e);
                } catch (RuntimeException e) {
                    degraded("cache-delete-failed", t.name(), e);
                }
            }
        }
    }

    @Override public void clear() {
        for (int i = 0; i < STRIPES; i++) {
            synchronized (locks[i]) {
                versions[i]++;
            }
        }
        for (CacheTier<V> t : tiers) {
            try {
                t.clear();
            } catch (CacheException e) {
                degraded("cache-clear-failed", e);
            } catch (RuntimeException e) {
                degraded("cache-clear-failed", t.name(), e);
            }
        }
    }

    @Override public CacheStats stats() { return stats; }

    public List<String> tierNames() {
        return tiers.stream().map(CacheTier::name).toList();
    }

    private void degraded(String event, CacheException e) {
        stats.tierError();
        LOG.warn("cache tier '{}' degraded: {}", e.getTier(), e.getMessage());
        SLOG.warn(event, e, "tier", e.getTier());
    }

    private void degraded(String event, String tier, RuntimeException e) {
        stats.tierError();
        LOG.warn("cache tier '{}' degraded: {}", tier, e.toString());
        SLOG.warn(event, e, "tier", tier);
    }
}
