package com.webtestool.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 중 발견한 API 엔드포인트.
 * discoveredFrom: {@link #FROM_RESPONSE}(JSON/XML 응답) 또는 {@link #FROM_JAVASCRIPT}(스크립트 정규식).
 */
public record ApiEndpoint(String method,
                          URI url,
                          String contentType,
                          List<String> parameters,
                          URI parentPage,
                          String discoveredFrom) {

    public static final String FROM_RESPONSE = "response";
    public static final String FROM_JAVASCRIPT = "javascript";
    public static final String METHOD_UNKNOWN = "UNKNOWN";

    public ApiEndpoint {
        Objects.requireNonNull(url, "url");
        method = (method == null || method.isBlank()) ? METHOD_UNKNOWN : method.toUpperCase(java.util.Locale.ROOT);
        parameters = (parameters == null) ? List.of() : List.copyOf(parameters);
        discoveredFrom = (discoveredFrom == null) ? FROM_RESPONSE : discoveredFrom;
    }

    public String path() {
        String p = url.getPath();
        return (p == null || p.isEmpty()) ? "/" : p;
    }

    /** 중복 제거 키(method + url) */
    public String key() {
        return method + " " + url;
    }
}
