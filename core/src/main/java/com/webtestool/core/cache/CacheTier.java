package com.webtestool.core.cache;

import com.webtestool.core.error.CacheException;

import java.util.Optional;

/**
 * TieredCacheStore 가 위에서부터 차례로 조회하는 단일 계층.
 * read 는 만료 항목을 지우고 empty 를 돌려준다(지연 만료).
 */
public interface CacheTier<V> {

    /** "memory", "disk", "remote" */
    String name();

    Optional<CacheEntry<V>> read(String key) throws CacheException;

    void write(String key, CacheEntry<V> entry) throws CacheException;

    void remove(String key) throws CacheException;

    void clear() throws CacheException;
}
