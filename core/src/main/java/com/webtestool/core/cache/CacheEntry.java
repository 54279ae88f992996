package com.webtestool.core.cache;

/** 계층 간 이동 단위: 값 + 절대 만료 시각(epoch ms) */
public record CacheEntry<V>(V value, long expiresAtMillis) {

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAtMillis;
    }

    public long remainingMillis(long nowMillis) {
        return Math.max(0, expiresAtMillis - nowMillis);
    }
}
