package com.webtestool.core.model;

import java.util.Locale;

/** 테스트 모듈 분류 */
public enum Category {
    SECURITY,
    PERFORMANCE,
    FUNCTIONAL,
    API,
    COMPATIBILITY,
    ACCESSIBILITY,
    SEO,
    INFRASTRUCTURE,
    VISUAL,
    DATA,
    BUSINESS_LOGIC;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}
