package com.webtestool.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 크롤 범위 필터 패턴 매칭.
 * <ul>
 *   <li>접두(prefix): {@code "/logout"} 또는 {@code "https://host/path"}</li>
 *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/admin/*"})</li>
 *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?.*token=.*})</li>
 * </ul>
 * 컴파일된 패턴은 문자열 단위로 캐시한다(워커 스레드 공유).
 */
public final class UrlExclusion {
    private UrlExclusion(){}

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    /** 하나라도 일치하면 true (패턴 없으면 false) */
    public static boolean matchesAny(URI url, List<String> patterns) {
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String s = url.toString();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            if (matches(s, p.trim())) return true;
        }
        return false;
    }

    /** include 목록이 비어 있으면 전부 통과, 있으면 하나 이상 일치해야 통과 */
    public static boolean isIncluded(URI url, List<String> includes) {
        return includes == null || includes.isEmpty() || matchesAny(url, includes);
    }

    public static boolean isExcluded(URI url, List<String> excludes) {
        return matchesAny(url, excludes);
    }

    private static boolean matches(String s, String p) {
        if (p.startsWith("re:")) {
            return compiled(p, () -> p.substring(3)).matcher(s).find();
        }
        if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
            return compiled(p, () -> globToRegex(p)).matcher(s).find();
        }
        if (s.regionMatches(true, 0, p, 0, p.length())) return true;

        // 호스트 상대 prefix: "/logout" → 경로 부분과 비교
        if (p.startsWith("/")) {
            int schemeEnd = s.indexOf("://");
            if (schemeEnd > 0) {
                int i = s.indexOf('/', schemeEnd + 3);
                String pathAndMore = (i > 0) ? s.substring(i) : "/";
                return pathAndMore.toLowerCase(Locale.ROOT).startsWith(p.toLowerCase(Locale.ROOT));
            }
        }
        return false;
    }

    private static Pattern compiled(String key, java.util.function.Supplier<String> regex) {
        return COMPILED.computeIfAbsent(key, k -> Pattern.compile(regex.get(), Pattern.CASE_INSENSITIVE));
    }

    static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> r.append(".*");
                case '?' -> r.append('.');
                case '.', '\\', '+', '(', ')', '^', '$', '|', '{', '}', '[', ']' -> r.append('\\').append(c);
                default -> r.append(c);
            }
        }
        return r.toString();
    }
}
