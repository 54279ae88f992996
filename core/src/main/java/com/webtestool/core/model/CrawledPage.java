package com.webtestool.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 크롤러가 방문한 페이지 한 건. 정규화된 url 이 스캔 내 식별자다. */
public final class CrawledPage {
    private final URI url;
    private final int statusCode;               // fetch 실패 시 -1
    private final Map<String, List<String>> headers;
    private final BodyHandle body;
    private final String contentType;
    private final String title;
    private final List<FormInfo> forms;
    private final List<URI> links;              // 스코프 밖 링크 포함
    private final List<URI> scripts;            // <script src>
    private final int depth;
    private final URI parentUrl;                // 시드면 null
    private final long fetchDurationMs;
    private final boolean fromCache;
    private final String fetchError;            // nullable

    private CrawledPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = (b.body == null) ? BodyHandle.EMPTY : b.body;
        this.contentType = b.contentType;
        this.title = b.title;
        this.forms = (b.forms == null) ? List.of() : List.copyOf(b.forms);
        this.links = (b.links == null) ? List.of() : List.copyOf(b.links);
        this.scripts = (b.scripts == null) ? List.of() : List.copyOf(b.scripts);
        this.depth = b.depth;
        this.parentUrl = b.parentUrl;
        this.fetchDurationMs = b.fetchDurationMs;
        this.fromCache = b.fromCache;
        this.fetchError = b.fetchError;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public BodyHandle getBody() { return body; }
    public String getContentType() { return contentType; }
    public String getTitle() { return title; }
    public List<FormInfo> getForms() { return forms; }
    public List<URI> getLinks() { return links; }
    public List<URI> getScripts() { return scripts; }
    public int getDepth() { return depth; }
    public URI getParentUrl() { return parentUrl; }
    public long getFetchDurationMs() { return fetchDurationMs; }
    public boolean isFromCache() { return fromCache; }
    public String getFetchError() { return fetchError; }

    public boolean isFailed() { return fetchError != null; }

    public boolean isHtml() {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(java.util.Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** 첫 헤더 값(대소문자 무시) */
    public String header(String name) {
        return FetchResult.firstHeader(headers, name);
    }

    public List<String> headers(String name) {
        return FetchResult.allHeaders(headers, name);
    }

    @Override public String toString() {
        return "CrawledPage{" + url + ", depth=" + depth + ", status=" + statusCode
                + (fetchError == null ? "" : ", error=" + fetchError) + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = -1;
        private Map<String, List<String>> headers;
        private BodyHandle body;
        private String contentType;
        private String title;
        private List<FormInfo> forms;
        private List<URI> links;
        private List<URI> scripts;
        private int depth;
        private URI parentUrl;
        private long fetchDurationMs;
        private boolean fromCache;
        private String fetchError;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(BodyHandle body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder forms(List<FormInfo> forms) { this.forms = forms; return this; }
        public Builder links(List<URI> links) { this.links = links; return this; }
        public Builder scripts(List<URI> scripts) { this.scripts = scripts; return this; }
        public Builder depth(int depth) { this.depth = depth; return this; }
        public Builder parentUrl(URI parentUrl) { this.parentUrl = parentUrl; return this; }
        public Builder fetchDurationMs(long fetchDurationMs) { this.fetchDurationMs = fetchDurationMs; return this; }
        public Builder fromCache(boolean fromCache) { this.fromCache = fromCache; return this; }
        public Builder fetchError(String fetchError) { this.fetchError = fetchError; return this; }

        public CrawledPage build() {
            Objects.requireNonNull(url, "url");
            return new CrawledPage(this);
        }
    }
}
