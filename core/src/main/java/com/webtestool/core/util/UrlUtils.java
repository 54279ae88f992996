package com.webtestool.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** URL 정규화(페이지 식별자) + 도메인/스코프 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙(결과 문자열이 CrawledPage 식별자):
     * - fragment 제거
     * - scheme/host 소문자, 기본 포트 제거(http:80, https:443)
     * - 빈 경로는 "/", 중복 슬래시 축소
     * - 쿼리 파라미터는 키(다음 값) 기준 정렬, 빈 쿼리는 제거
     * http/https 가 아니거나 host 가 없으면 null.
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        String scheme = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = u.getHost();
        if (host == null || host.isEmpty()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");

        String query = sortQuery(u.getRawQuery());

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** 문자열 버전: 파싱 불가/비 HTTP 이면 null */
    public static URI normalize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return normalize(new URI(raw.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** raw 쿼리를 "key=value" 단위로 안정 정렬(인코딩은 건드리지 않음) */
    static String sortQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return null;
        List<String> pairs = new ArrayList<>();
        for (String p : rawQuery.split("&")) {
            if (!p.isEmpty()) pairs.add(p);
        }
        if (pairs.isEmpty()) return null;
        pairs.sort(null);
        return String.join("&", pairs);
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return hostOf(a).equals(hostOf(b));
    }

    /** host 가 base 와 같거나 allowed 목록(정확 일치 또는 ".suffix" 하위도메인)에 있으면 true */
    public static boolean hostInScope(URI u, URI base, Collection<String> allowed) {
        if (u == null) return false;
        String h = hostOf(u);
        if (h.isEmpty()) return false;
        if (base != null && h.equals(hostOf(base))) return true;
        if (allowed == null) return false;
        for (String a : allowed) {
            if (a == null || a.isBlank()) continue;
            String al = a.trim().toLowerCase(Locale.ROOT);
            if (al.startsWith(".")) {
                if (h.endsWith(al) || h.equals(al.substring(1))) return true;
            } else if (h.equals(al)) {
                return true;
            }
        }
        return false;
    }

    /** 레이트리미터/robots 키: 소문자 host (없으면 빈 문자열) */
    public static String hostOf(URI u) {
        return (u == null || u.getHost() == null) ? "" : u.getHost().toLowerCase(Locale.ROOT);
    }

    /** scheme://host[:port]/ 형태의 origin */
    public static URI originOf(URI u) {
        URI n = normalize(u);
        if (n == null) return null;
        String port = (n.getPort() >= 0) ? ":" + n.getPort() : "";
        return URI.create(n.getScheme() + "://" + n.getHost() + port + "/");
    }
}
