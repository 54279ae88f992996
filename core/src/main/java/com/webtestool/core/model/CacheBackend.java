package com.webtestool.core.model;

/** 캐시 계층 구성 */
public enum CacheBackend {
    /** 메모리 LRU 만 */
    MEMORY,
    /** 디스크(JSON 파일)만 */
    DISK,
    /** 메모리 → 디스크 (→ 원격, 클라이언트가 주입된 경우) */
    TIERED
}
