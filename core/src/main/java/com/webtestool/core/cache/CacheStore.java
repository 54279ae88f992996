package com.webtestool.core.cache;

import java.time.Duration;
import java.util.Optional;

/** 키/값 캐시 계약. 만료된 항목은 절대 반환하지 않는다. 모든 구현은 스레드 세이프. */
public interface CacheStore<V> {

    Optional<V> get(String key);

    /** 기존 키면 값과 TTL 을 함께 교체 */
    void set(String key, V value, Duration ttl);

    void delete(String key);

    default boolean exists(String key) { return get(key).isPresent(); }

    void clear();

    CacheStats stats();
}
