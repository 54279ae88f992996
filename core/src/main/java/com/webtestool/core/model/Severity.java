package com.webtestool.core.model;

import java.util.Locale;

/** 심각도. 선언 순서 = 낮음 → 높음 (정렬 시 reversed() 로 높은 것 먼저). */
public enum Severity {
    INFO(10),
    LOW(25),
    MEDIUM(50),
    HIGH(75),
    CRITICAL(90);

    private final int weight;

    Severity(int weight) { this.weight = weight; }

    /** 0..100 위험 가중치 */
    public int weight() { return weight; }

    /** 소문자 라벨 (critical/high/medium/low/info) */
    public String label() { return name().toLowerCase(Locale.ROOT); }

    /** 대소문자 무시 파싱. 알 수 없으면 IllegalArgumentException */
    public static Severity parse(String s) {
        if (s == null) throw new IllegalArgumentException("severity is null");
        return Severity.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
