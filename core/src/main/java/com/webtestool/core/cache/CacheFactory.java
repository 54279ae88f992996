package com.webtestool.core.cache;

import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.util.TickClock;

import java.util.ArrayList;
import java.util.List;

/** 설정(cache.backend) → 계층 구성 */
public final class CacheFactory {
    private CacheFactory() {}

    /**
     * @param remote TIERED 일 때만 쓰인다(null 이면 원격 계층 없음)
     */
    public static <V> TieredCacheStore<V> create(ScanConfig.CacheCfg cfg, Class<V> valueType,
                                                 RemoteCacheClient remote, TickClock clock) {
        List<CacheTier<V>> tiers = new ArrayList<>(3);
        switch (cfg.getBackend()) {
            case MEMORY -> tiers.add(new MemoryLruCache<>(cfg.getMemoryMaxEntries(), clock));
            case DISK -> tiers.add(new DiskCache<>(cfg.getDir(), valueType, clock));
            case TIERED -> {
                tiers.add(new MemoryLruCache<>(cfg.getMemoryMaxEntries(), clock));
                tiers.add(new DiskCache<>(cfg.getDir(), valueType, clock));
                if (remote != null) tiers.add(new RemoteCache<>(remote, valueType, clock));
            }
        }
        return new TieredCacheStore<>(tiers, clock);
    }
}
