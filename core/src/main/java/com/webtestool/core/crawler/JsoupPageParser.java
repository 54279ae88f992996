package com.webtestool.core.crawler;

import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.FormField;
import com.webtestool.core.model.FormInfo;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Jsoup 기반 PageParser: 링크/폼/스크립트/제목 + 인라인 JS 의 API 호출 패턴 */
public final class JsoupPageParser implements PageParser {

    private static final String LINK_SELECTOR = "a[href], area[href], iframe[src], frame[src]";

    /** group(1)=method(있으면), group(2)=url */
    private static final List<Pattern> JS_CALLS = List.of(
            Pattern.compile("()fetch\\(\\s*[\"'`]([^\"'`]+)[\"'`]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("axios\\.(get|post|put|delete|patch)\\(\\s*[\"'`]([^\"'`]+)[\"'`]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("()\\$\\.ajax\\(\\s*\\{[^}]*?url\\s*:\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.open\\(\\s*[\"']([A-Za-z]+)[\"']\\s*,\\s*[\"']([^\"']+)[\"']"),
            Pattern.compile("()[\"'](/(?:api|graphql|rest|v\\d+)(?:/[^\"'\\s]*)?)[\"']", Pattern.CASE_INSENSITIVE)
    );

    @Override
    public ParsedPage parse(URI pageUrl, String html) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl.toString());

        String title = doc.title();
        if (title != null && title.isBlank()) title = null;

        Set<URI> links = new LinkedHashSet<>();
        for (Element e : doc.select(LINK_SELECTOR)) {
            URI u = absolute(e.hasAttr("href") ? e.attr("abs:href") : e.attr("abs:src"));
            if (u != null) links.add(u);
        }

        List<FormInfo> forms = new ArrayList<>();
        for (Element f : doc.select("form")) {
            forms.add(toForm(pageUrl, f));
        }

        Set<URI> scripts = new LinkedHashSet<>();
        for (Element s : doc.select("script[src]")) {
            URI u = absolute(s.attr("abs:src"));
            if (u != null) scripts.add(u);
        }

        Map<String, ApiEndpoint> endpoints = new LinkedHashMap<>();
        for (Element s : doc.select("script:not([src])")) {
            for (ApiEndpoint ep : scanScript(pageUrl, s.data())) endpoints.putIfAbsent(ep.key(), ep);
        }

        return new ParsedPage(title, new ArrayList<>(links), forms, new ArrayList<>(scripts),
                new ArrayList<>(endpoints.values()));
    }

    private static FormInfo toForm(URI pageUrl, Element f) {
        String action = f.hasAttr("action") ? f.attr("abs:action") : "";
        URI actionUri = absolute(action);
        if (actionUri == null) actionUri = stripFragment(pageUrl);
        List<FormField> fields = new ArrayList<>();
        for (Element in : f.select("input, textarea, select")) {
            String type = in.tagName().equals("input") ? in.attr("type") : in.tagName();
            fields.add(new FormField(in.attr("name"), type, in.attr("value"), in.hasAttr("required")));
        }
        return new FormInfo(actionUri, f.attr("method"), fields);
    }

    /** 인라인 JS 에서 API 호출 주소 추출 */
    static List<ApiEndpoint> scanScript(URI pageUrl, String js) {
        List<ApiEndpoint> out = new ArrayList<>();
        if (js == null || js.isBlank()) return out;
        for (Pattern p : JS_CALLS) {
            Matcher m = p.matcher(js);
            while (m.find()) {
                String raw = m.group(2);
                if (raw == null || raw.isBlank() || raw.startsWith("data:") || raw.startsWith("javascript:")) continue;
                URI u;
                try {
                    u = stripFragment(pageUrl.resolve(raw.trim()));
                } catch (IllegalArgumentException bad) {
                    continue;
                }
                if (u == null || !isHttp(u)) continue;
                String method = m.group(1);
                out.add(new ApiEndpoint((method == null || method.isEmpty()) ? null : method.toUpperCase(Locale.ROOT),
                        u, null, queryParamNames(u), pageUrl, ApiEndpoint.FROM_JAVASCRIPT));
            }
        }
        return out;
    }

    /** ?a=1&b=2&a=3 → [a, b] */
    public static List<String> queryParamNames(URI u) {
        String q = u.getRawQuery();
        if (q == null || q.isEmpty()) return List.of();
        Set<String> names = new LinkedHashSet<>();
        for (String pair : q.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = (eq >= 0) ? pair.substring(0, eq) : pair;
            if (!name.isEmpty()) names.add(name);
        }
        return new ArrayList<>(names);
    }

    private static URI absolute(String abs) {
        if (abs == null || abs.isBlank()) return null;
        try {
            URI u = URI.create(abs.trim());
            return isHttp(u) ? stripFragment(u) : null;
        } catch (IllegalArgumentException bad) {
            return null;   // 잘못된 URL
        }
    }

    private static boolean isHttp(URI u) {
        String s = u.getScheme();
        return s != null && (s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"));
    }

    private static URI stripFragment(URI u) {
        if (u == null || u.getRawFragment() == null) return u;
        String s = u.toString();
        return URI.create(s.substring(0, s.indexOf('#')));
    }
}
