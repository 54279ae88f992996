package com.webtestool.core.service;

import com.webtestool.core.model.ScanState;

/** 상태 전이 콜백(호출 스레드에서 동기 호출) */
@FunctionalInterface
public interface ScanStateListener {
    void onStateChanged(ScanState from, ScanState to);

    ScanStateListener NONE = (f, t) -> {};
}
