package com.webtestool.core.crawler.robots;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 경로 매칭(쿼리/프래그먼트 무시, 퍼센트 인코딩은 디코드하지 않고 HEX 대문자로만 통일).
 * 우선순위: 더 구체적인(긴) 규칙 승, 같으면 Allow 승. '*' 와 끝의 '$' 는 길이에 넣지 않는다.
 * 평문 규칙은 세그먼트 경계 접두 매칭("/admin" 은 "/admin", "/admin/x" 와 매치, "/admins" 와는 불일치).
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    private static final Map<String, Pattern> WILDCARDS = new ConcurrentHashMap<>();

    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        return isAllowed(normalizePath(url), rules);
    }

    public static boolean isAllowed(String path, RobotsRules rules) {
        Objects.requireNonNull(rules, "rules");
        int bestLen = -1;
        boolean bestAllow = true;
        for (String r : rules.disallow()) {
            if (matches(path, r)) {
                int len = specificity(r);
                if (len > bestLen) { bestLen = len; bestAllow = false; }
            }
        }
        for (String r : rules.allow()) {
            if (matches(path, r)) {
                int len = specificity(r);
                if (len >= bestLen) { bestLen = len; bestAllow = true; }
            }
        }
        return bestAllow;
    }

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isEmpty()) return false;
        boolean anchored = rule.endsWith("$");
        String r = anchored ? rule.substring(0, rule.length() - 1) : rule;

        if (r.indexOf('*') >= 0) {
            Pattern p = WILDCARDS.computeIfAbsent(rule, k -> compileWildcard(r, anchored));
            return p.matcher(path).matches();
        }
        if (anchored) return path.equals(r);
        if (r.endsWith("/")) return path.startsWith(r);
        if (!path.startsWith(r)) return false;
        return path.length() == r.length() || path.charAt(r.length()) == '/';
    }

    private static Pattern compileWildcard(String r, boolean anchored) {
        StringBuilder sb = new StringBuilder("^");
        int from = 0;
        for (int i = 0; i < r.length(); i++) {
            if (r.charAt(i) == '*') {
                if (i > from) sb.append(Pattern.quote(r.substring(from, i)));
                sb.append(".*");
                from = i + 1;
            }
        }
        if (from < r.length()) sb.append(Pattern.quote(r.substring(from)));
        sb.append(anchored ? "$" : ".*");
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    static int specificity(String rule) {
        int end = rule.endsWith("$") ? rule.length() - 1 : rule.length();
        int n = 0;
        for (int i = 0; i < end; i++) if (rule.charAt(i) != '*') n++;
        return n;
    }

    static String normalizeRule(String rule) {
        if (rule == null) return "";
        return uppercasePctHex(rule.trim());
    }

    static String normalizePath(URI uri) {
        String raw = uri.getRawPath();
        return uppercasePctHex((raw == null || raw.isEmpty()) ? "/" : raw);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%').append(Character.toUpperCase(s.charAt(i + 1))).append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
