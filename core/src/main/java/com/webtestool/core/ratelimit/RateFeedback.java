package com.webtestool.core.ratelimit;

/** 서버 응답을 보고 한도를 조절하는 리미터가 구현한다. Fetcher 가 호출. */
public interface RateFeedback {

    void onResponse(String key, int statusCode);

    /** 전송 계층 실패(타임아웃/연결 오류) */
    void onFailure(String key);
}
