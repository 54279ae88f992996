package com.webtestool.core.model;

/** 모듈 실행 방식 */
public enum ExecutionMode {
    PARALLEL,
    SEQUENTIAL
}
