package com.webtestool.core.module.builtin;

import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.FormField;
import com.webtestool.core.model.FormInfo;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.util.UrlParamUtil;
import com.webtestool.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 주입 지점: 파라미터 이름과 기본값. GET 이 아니면 폼 본문으로 보낸다.
 * 같은 method/경로/파라미터 집합은 한 번만 수집한다.
 */
record InjectionPoint(String method, URI url, Map<String, String> params) {

    boolean isBody() { return !"GET".equals(method); }

    String key() { return method + " " + UrlParamUtil.withRawQuery(url, null) + " " + new TreeSet<>(params.keySet()); }

    /** param 하나만 value 로 바꾼 요청. 나머지 파라미터는 기본값 그대로. */
    FetchRequest.Builder request(String param, String value) {
        if (isBody()) {
            Map<String, String> body = new LinkedHashMap<>(params);
            body.put(param, value);
            return FetchRequest.builder(url).method(method).formBody(UrlParamUtil.formEncode(body));
        }
        URI base = url;
        for (var e : params.entrySet()) {
            if (!UrlParamUtil.parseQuery(base).containsKey(e.getKey())) {
                base = UrlParamUtil.withParamOverrideFirst(base, e.getKey(), e.getValue());
            }
        }
        return FetchRequest.builder(UrlParamUtil.withParamOverrideFirst(base, param, value));
    }

    /** 크롤 결과(쿼리 URL, 링크, 폼)와 발견된 API 엔드포인트에서 대상 도메인의 지점만 모은다 */
    static List<InjectionPoint> collect(TestContext context) {
        URI target = context.getTargetUrl();
        Map<String, InjectionPoint> points = new LinkedHashMap<>();

        for (CrawledPage page : context.fetchedPages()) {
            addQuery(points, target, page.getUrl());
            for (URI link : page.getLinks()) addQuery(points, target, link);
            for (FormInfo form : page.getForms()) addForm(points, target, form);
        }
        for (ApiEndpoint ep : context.getEndpoints()) {
            if (!UrlUtils.sameDomain(ep.url(), target) || ep.parameters().isEmpty()) continue;
            String m = ApiEndpoint.METHOD_UNKNOWN.equals(ep.method()) ? "GET" : ep.method();
            if (!"GET".equals(m) && !"POST".equals(m)) continue;
            Map<String, String> params = new LinkedHashMap<>();
            Map<String, String> existing = UrlParamUtil.parseQuery(ep.url());
            for (String n : ep.parameters()) params.put(n, existing.getOrDefault(n, "1"));
            put(points, new InjectionPoint(m, ep.url(), params));
        }
        return new ArrayList<>(points.values());
    }

    private static void addQuery(Map<String, InjectionPoint> points, URI target, URI url) {
        if (url == null || url.getRawQuery() == null || !UrlUtils.sameDomain(url, target)) return;
        Map<String, String> params = UrlParamUtil.parseQuery(url);
        if (!params.isEmpty()) put(points, new InjectionPoint("GET", url, params));
    }

    private static void addForm(Map<String, InjectionPoint> points, URI target, FormInfo form) {
        if (!UrlUtils.sameDomain(form.action(), target)) return;
        Map<String, String> params = new LinkedHashMap<>();
        for (FormField f : form.fields()) {
            if (f.name() == null || f.name().isBlank()) continue;
            switch (f.type()) {
                case "submit", "button", "image", "reset", "file" -> { }
                default -> params.put(f.name(), f.value().isEmpty() ? "1" : f.value());
            }
        }
        if (params.isEmpty()) return;
        String method = "GET".equals(form.method()) ? "GET" : "POST";
        put(points, new InjectionPoint(method, form.action(), params));
    }

    private static void put(Map<String, InjectionPoint> points, InjectionPoint p) {
        points.putIfAbsent(p.key(), p);
    }
}
