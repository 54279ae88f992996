package com.webtestool.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 한 번의 논리적 요청 결과(텍스트 본문 기준). 캐시 적중 여부와 실제 시도 횟수를 함께 담는다. */
public final class FetchResult {
    private final URI url;
    private final URI finalUrl;     // 리다이렉트 후 주소
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final boolean fromCache;
    private final int attempts;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = (b.contentType != null) ? b.contentType : firstHeader(this.headers, "Content-Type");
        this.responseTimeMs = b.responseTimeMs;
        this.fromCache = b.fromCache;
        this.attempts = Math.max(0, b.attempts);
    }

    public URI getUrl() { return url; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public boolean isFromCache() { return fromCache; }
    /** 네트워크 시도 횟수(캐시 적중이면 0) */
    public int getAttempts() { return attempts; }

    /** 2xx/3xx → 캐시 대상 */
    public boolean isCacheable() { return statusCode >= 200 && statusCode < 400; }

    public boolean isHtml() {
        String ct = (contentType == null) ? "" : contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        return firstHeader(headers, name);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        return allHeaders(headers, name);
    }

    static List<String> allHeaders(Map<String, List<String>> headers, String name) {
        if (name == null || headers == null) return List.of();
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    static String firstHeader(Map<String, List<String>> headers, String name) {
        if (name == null || headers == null) return null;
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 캐시 적중본으로 표시한 사본 */
    public FetchResult asCached() {
        return toBuilder().fromCache(true).attempts(0).build();
    }

    public Builder toBuilder() {
        return builder().url(url).finalUrl(finalUrl).statusCode(statusCode).headers(headers).body(body)
                .contentType(contentType).responseTimeMs(responseTimeMs)
                .fromCache(fromCache).attempts(attempts);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private boolean fromCache;
        private int attempts = 1;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder fromCache(boolean fromCache) { this.fromCache = fromCache; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
