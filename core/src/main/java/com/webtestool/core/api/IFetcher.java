package com.webtestool.core.api;

import com.webtestool.core.error.FetchException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.FetchResult;

import java.net.URI;

/**
 * 요청 계약: 캐시 → 레이트리미터 → 전송 → 재시도 → 캐시 기록.
 * 재시도 대상이 아닌 4xx 는 예외가 아니라 결과로 돌려준다.
 */
public interface IFetcher {
    FetchResult fetch(FetchRequest request) throws FetchException;

    default FetchResult get(URI url) throws FetchException {
        return fetch(FetchRequest.get(url));
    }
}
