package com.webtestool.core.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 쿼리/폼 파라미터 유틸.
 * - withParamOverrideFirst: 같은 키의 기존 값을 지우고 key=value 를 쿼리 선두에 둔다(주입 프로브용)
 * - parseQuery: 단일값(마지막 값 채택), parseQueryMulti: 다값
 * - formEncode: application/x-www-form-urlencoded 본문
 */
public final class UrlParamUtil {
    private UrlParamUtil() {}

    /** 서버가 첫 값만 읽는 경우까지 덮도록 선두에 배치. 나머지 쌍은 원본 인코딩 그대로 보존. */
    public static URI withParamOverrideFirst(URI base, String key, String value) {
        Objects.requireNonNull(base, "base");
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key must not be blank");

        StringBuilder q = new StringBuilder();
        q.append(enc(key)).append('=').append(enc(value == null ? "" : value));
        String raw = base.getRawQuery();
        if (raw != null && !raw.isBlank()) {
            for (String part : raw.split("&")) {
                if (part.isBlank()) continue;
                int eq = part.indexOf('=');
                String k = dec(eq >= 0 ? part.substring(0, eq) : part);
                if (!k.equalsIgnoreCase(key)) q.append('&').append(part);
            }
        }
        return withRawQuery(base, q.toString());
    }

    /** 쿼리를 통째로 교체(null/빈 값이면 제거) */
    public static URI withRawQuery(URI base, String rawQuery) {
        StringBuilder sb = new StringBuilder();
        sb.append(base.getScheme()).append("://").append(base.getRawAuthority());
        String path = base.getRawPath();
        sb.append((path == null || path.isEmpty()) ? "/" : path);
        if (rawQuery != null && !rawQuery.isEmpty()) sb.append('?').append(rawQuery);
        return URI.create(sb.toString());
    }

    public static Map<String, String> parseQuery(URI url) {
        Map<String, String> single = new LinkedHashMap<>();
        parseQueryMulti(url).forEach((k, vals) -> single.put(k, vals.isEmpty() ? "" : vals.get(vals.size() - 1)));
        return single;
    }

    /** 입력 순서 유지 */
    public static Map<String, List<String>> parseQueryMulti(URI url) {
        Objects.requireNonNull(url, "url");
        Map<String, List<String>> m = new LinkedHashMap<>();
        String q = url.getRawQuery();
        if (q == null || q.isEmpty()) return m;
        for (String p : q.split("&")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            String k = dec(i < 0 ? p : p.substring(0, i));
            String v = (i < 0) ? "" : dec(p.substring(i + 1));
            m.computeIfAbsent(k, __ -> new ArrayList<>()).add(v);
        }
        return m;
    }

    public static String formEncode(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(enc(e.getKey())).append('=').append(enc(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    private static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
    private static String dec(String s) { return URLDecoder.decode(s, StandardCharsets.UTF_8); }
}
