package com.webtestool.core.cache;

import java.util.concurrent.atomic.AtomicLong;

/** 캐시 적중/실패 카운터 (스레드 세이프) */
public final class CacheStats {
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong diskHits = new AtomicLong();
    private final AtomicLong remoteHits = new AtomicLong();
    private final AtomicLong tierErrors = new AtomicLong();

    void hit(String tier) {
        hits.incrementAndGet();
        switch (tier) {
            case MemoryLruCache.TIER -> memoryHits.incrementAndGet();
            case DiskCache.TIER -> diskHits.incrementAndGet();
            case RemoteCache.TIER -> remoteHits.incrementAndGet();
            default -> { }
        }
    }
    void miss() { misses.incrementAndGet(); }
    void write() { writes.incrementAndGet(); }
    void tierError() { tierErrors.incrementAndGet(); }

    public long hits() { return hits.get(); }
    public long misses() { return misses.get(); }
    public long writes() { return writes.get(); }
    public long memoryHits() { return memoryHits.get(); }
    public long diskHits() { return diskHits.get(); }
    public long remoteHits() { return remoteHits.get(); }
    public long tierErrors() { return tierErrors.get(); }

    public double hitRate() {
        long total = hits.get() + misses.get();
        return (total == 0) ? 0.0 : (double) hits.get() / total;
    }

    @Override public String toString() {
        return "CacheStats{hits=" + hits + ", misses=" + misses + ", writes=" + writes
                + ", memory=" + memoryHits + ", disk=" + diskHits + ", remote=" + remoteHits
                + ", errors=" + tierErrors + "}";
    }
}
