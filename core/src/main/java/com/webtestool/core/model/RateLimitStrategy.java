package com.webtestool.core.model;

public enum RateLimitStrategy {
    TOKEN_BUCKET,
    FIXED_WINDOW,
    SLIDING_WINDOW,
    /** 토큰 버킷 + 서버 응답(429/503/실패)에 따른 한도 조절 */
    ADAPTIVE
}
