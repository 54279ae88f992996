package com.webtestool.core.error;

/**
 * 스캔 시작 전 설정/대상 오류(잘못된 target URL, 알 수 없는 모듈명 등).
 * 크롤링 이전에만 던져지며, 오케스트레이터는 이를 FAILED 상태로 기록한다.
 */
public class SetupException extends RuntimeException {
    public SetupException(String message) {
        super(message);
    }
    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
