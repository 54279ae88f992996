package com.webtestool.core.error;

/** 캐시 티어(디스크/원격) 장애. 상위에서는 캐시 미스로 강등 처리한다. */
public class CacheException extends Exception {
    private final String tier;

    public CacheException(String tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public String getTier() { return tier; }
}
