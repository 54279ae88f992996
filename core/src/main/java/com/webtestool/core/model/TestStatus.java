package com.webtestool.core.model;

/**
 * ModuleResult 상태.
 * PASSED = 발견 없음, FAILED = 발견 1건 이상, ERROR = 모듈 자체 실패(예외/타임아웃/초기화 실패).
 */
public enum TestStatus {
    PENDING,
    RUNNING,
    PASSED,
    FAILED,
    ERROR,
    SKIPPED
}
