package com.webtestool.core.model;

import com.webtestool.core.api.IFetcher;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 모든 모듈에 전달되는 읽기 전용 입력.
 * fetcher 는 추가 요청이 필요한 모듈(sql_injection 등)이 캐시/리미터를 공유하도록 넘겨진다.
 */
public final class TestContext {
    private final URI targetUrl;
    private final URI baseUrl;
    private final List<CrawledPage> pages;
    private final List<ApiEndpoint> endpoints;
    private final ScanConfig config;
    private final Map<String, String> sessionHeaders;
    private final Map<String, String> cookies;
    private final String authToken;
    private final Map<String, Object> pluginContext;
    private final IFetcher fetcher;

    private TestContext(Builder b) {
        this.targetUrl = b.targetUrl;
        this.baseUrl = b.baseUrl;
        this.pages = List.copyOf(b.pages);
        this.endpoints = List.copyOf(b.endpoints);
        this.config = b.config;
        this.sessionHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(b.sessionHeaders));
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(b.cookies));
        this.authToken = b.authToken;
        this.pluginContext = Collections.unmodifiableMap(new LinkedHashMap<>(b.pluginContext));
        this.fetcher = b.fetcher;
    }

    public URI getTargetUrl() { return targetUrl; }
    public URI getBaseUrl() { return baseUrl; }
    public List<CrawledPage> getPages() { return pages; }
    public List<ApiEndpoint> getEndpoints() { return endpoints; }
    public ScanConfig getConfig() { return config; }
    public Map<String, String> getSessionHeaders() { return sessionHeaders; }
    public Map<String, String> getCookies() { return cookies; }
    public String getAuthToken() { return authToken; }
    public Map<String, Object> getPluginContext() { return pluginContext; }
    public IFetcher getFetcher() { return fetcher; }

    /** fetchError 없이 받아온 페이지만 */
    public List<CrawledPage> fetchedPages() {
        return pages.stream().filter(p -> !p.isFailed()).toList();
    }

    /** 모듈별 설정(modules.settings.&lt;name&gt;) */
    public Map<String, Object> settingsFor(String moduleName) {
        return config.getModules().settingsFor(moduleName);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI targetUrl;
        private URI baseUrl;
        private List<CrawledPage> pages = List.of();
        private List<ApiEndpoint> endpoints = List.of();
        private ScanConfig config;
        private Map<String, String> sessionHeaders = Map.of();
        private Map<String, String> cookies = Map.of();
        private String authToken;
        private final Map<String, Object> pluginContext = new LinkedHashMap<>();
        private IFetcher fetcher;

        public Builder targetUrl(URI targetUrl) { this.targetUrl = targetUrl; return this; }
        public Builder baseUrl(URI baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder pages(List<CrawledPage> pages) { this.pages = (pages == null) ? List.of() : pages; return this; }
        public Builder endpoints(List<ApiEndpoint> endpoints) { this.endpoints = (endpoints == null) ? List.of() : endpoints; return this; }
        public Builder config(ScanConfig config) { this.config = config; return this; }
        public Builder sessionHeaders(Map<String, String> h) { this.sessionHeaders = (h == null) ? Map.of() : h; return this; }
        public Builder cookies(Map<String, String> c) { this.cookies = (c == null) ? Map.of() : c; return this; }
        public Builder authToken(String authToken) { this.authToken = authToken; return this; }
        public Builder pluginContext(Map<String, Object> additions) {
            if (additions != null) pluginContext.putAll(additions);
            return this;
        }
        public Builder fetcher(IFetcher fetcher) { this.fetcher = fetcher; return this; }

        public TestContext build() {
            Objects.requireNonNull(targetUrl, "targetUrl");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(fetcher, "fetcher");
            if (baseUrl == null) {
                baseUrl = com.webtestool.core.util.UrlUtils.originOf(targetUrl);
            }
            return new TestContext(this);
        }
    }
}
