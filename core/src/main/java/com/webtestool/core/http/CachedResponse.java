package com.webtestool.core.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.webtestool.core.model.FetchResult;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 캐시 계층에 저장되는 응답 DTO(Jackson 직렬화 대상) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CachedResponse {
    public String url;
    public String finalUrl;
    public int statusCode;
    public Map<String, List<String>> headers = new LinkedHashMap<>();
    public String body;
    public String contentType;
    public long responseTimeMs;

    public CachedResponse() {}

    static CachedResponse of(FetchResult r) {
        CachedResponse c = new CachedResponse();
        c.url = r.getUrl().toString();
        c.finalUrl = r.getFinalUrl().toString();
        c.statusCode = r.getStatusCode();
        c.headers = new LinkedHashMap<>(r.getHeaders());
        c.body = r.getBody();
        c.contentType = r.getContentType();
        c.responseTimeMs = r.getResponseTimeMs();
        return c;
    }

    FetchResult toResult() {
        return FetchResult.builder()
                .url(URI.create(url))
                .finalUrl(finalUrl == null ? null : URI.create(finalUrl))
                .statusCode(statusCode)
                .headers(headers)
                .body(body)
                .contentType(contentType)
                .responseTimeMs(responseTimeMs)
                .fromCache(true)
                .attempts(0)
                .build();
    }
}
