package com.webtestool.core.model;

/** 스캔 상태 머신: CREATED → CRAWLING → TESTING → AGGREGATING → COMPLETED, 설정 오류 시 FAILED */
public enum ScanState {
    CREATED,
    CRAWLING,
    TESTING,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() { return this == COMPLETED || this == FAILED; }

    /** 허용 전이만 true. FAILED 는 CREATED(설정 단계)에서만 진입. */
    public boolean canMoveTo(ScanState next) {
        return switch (this) {
            case CREATED -> next == CRAWLING || next == FAILED;
            case CRAWLING -> next == TESTING;
            case TESTING -> next == AGGREGATING;
            case AGGREGATING -> next == COMPLETED;
            case COMPLETED, FAILED -> false;
        };
    }
}
