package com.webtestool.core.error;

import java.net.URI;

/** 단일 요청의 최종 실패. 페이지 단위로 기록되며 스캔 전체를 중단시키지 않는다. */
public class FetchException extends Exception {

    public enum Kind {
        /** 요청별 타임아웃 초과 */
        TIMEOUT,
        /** 연결 실패/리셋/TLS 오류 등 전송 계층 문제 */
        CONNECTION,
        /** 재시도 한도 소진 후에도 재시도 대상 상태코드(429/5xx) */
        HTTP_STATUS,
        /** 레이트리미터 대기 상한 초과 */
        RATE_LIMITED
    }

    private final Kind kind;
    private final URI url;
    private final int statusCode; // HTTP_STATUS일 때만 의미 있음(그 외 -1)
    private final int attempts;

    public FetchException(Kind kind, URI url, String message, Throwable cause) {
        this(kind, url, -1, 1, message, cause);
    }

    public FetchException(Kind kind, URI url, int statusCode, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public Kind getKind() { return kind; }
    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public int getAttempts() { return attempts; }

    /** CrawledPage.fetchError 에 남길 한 줄 요약 */
    public String summary() {
        String base = kind.name().toLowerCase() + ": " + getMessage();
        return (statusCode > 0) ? base + " (status " + statusCode + ")" : base;
    }
}
