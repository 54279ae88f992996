package com.webtestool.core.http;

import java.net.URI;
import java.util.List;
import java.util.Map;

/** 전송 계층이 돌려주는 원시 응답. finalUri 는 리다이렉트를 따라간 뒤의 주소(null 이면 요청 주소). */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, String body, URI finalUri) {
    public TransportResponse {
        headers = (headers == null) ? Map.of() : headers;
        body = (body == null) ? "" : body;
    }

    public TransportResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this(statusCode, headers, body, null);
    }
}
