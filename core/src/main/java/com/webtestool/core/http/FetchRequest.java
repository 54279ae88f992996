package com.webtestool.core.http;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 논리적 요청 1건. 세션 헤더/쿠키/UA 는 Fetcher 가 붙이므로 여기에는 요청 고유 헤더만 둔다.
 * bypassCache=true 면 캐시를 읽지도 쓰지도 않는다(시간 측정 프로브 등).
 */
public final class FetchRequest {
    private final String method;
    private final URI url;
    private final Map<String, String> headers;
    private final String body;            // nullable
    private final Duration timeout;       // nullable → 설정값
    private final boolean bypassCache;
    private final boolean acceptServerErrors;
    private final Boolean followRedirects; // null → 설정값

    private FetchRequest(Builder b) {
        this.method = b.method;
        this.url = b.url;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
        this.bypassCache = b.bypassCache;
        this.acceptServerErrors = b.acceptServerErrors;
        this.followRedirects = b.followRedirects;
    }

    public static FetchRequest get(URI url) { return builder(url).build(); }

    public String getMethod() { return method; }
    public URI getUrl() { return url; }
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }
    public Duration getTimeout() { return timeout; }
    public boolean isBypassCache() { return bypassCache; }
    /** true 면 5xx 를 재시도하지 않고 결과로 돌려준다(오류 페이지 본문을 봐야 하는 프로브) */
    public boolean isAcceptServerErrors() { return acceptServerErrors; }

    /** 리다이렉트 추적 여부. null 이면 ScanConfig.followRedirects 를 따른다. */
    public Boolean getFollowRedirects() { return followRedirects; }

    /** GET/HEAD 만 캐시 대상. 리다이렉트를 끈 요청의 3xx 가 일반 요청에 재사용되면 안 된다. */
    public boolean isCacheable() {
        return !bypassCache && !Boolean.FALSE.equals(followRedirects)
                && ("GET".equals(method) || "HEAD".equals(method));
    }

    @Override public String toString() { return method + " " + url; }

    public static Builder builder(URI url) { return new Builder(url); }

    public static final class Builder {
        private String method = "GET";
        private final URI url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Duration timeout;
        private boolean bypassCache;
        private boolean acceptServerErrors;
        private Boolean followRedirects;

        private Builder(URI url) { this.url = Objects.requireNonNull(url, "url"); }

        public Builder method(String m) { this.method = (m == null) ? "GET" : m.toUpperCase(Locale.ROOT); return this; }
        public Builder header(String name, String value) { if (name != null && value != null) headers.put(name, value); return this; }
        /** application/x-www-form-urlencoded 본문 */
        public Builder formBody(String encoded) {
            this.body = encoded;
            headers.putIfAbsent("Content-Type", "application/x-www-form-urlencoded");
            return this;
        }
        public Builder body(String body) { this.body = body; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder bypassCache(boolean v) { this.bypassCache = v; return this; }
        public Builder acceptServerErrors(boolean v) { this.acceptServerErrors = v; return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }

        public FetchRequest build() { return new FetchRequest(this); }
    }
}
