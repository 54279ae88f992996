package com.webtestool.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/** 디스크/원격 계층의 저장 형식: {key, expiresAt, value} */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CacheEnvelope<V> {
    public String key;
    public Instant expiresAt;
    public V value;

    public CacheEnvelope() {}

    CacheEnvelope(String key, CacheEntry<V> e) {
        this.key = key;
        this.expiresAt = Instant.ofEpochMilli(e.expiresAtMillis());
        this.value = e.value();
    }

    CacheEntry<V> toEntry() {
        return new CacheEntry<>(value, expiresAt == null ? 0L : expiresAt.toEpochMilli());
    }
}
