package com.webtestool.core.crawler.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서.
 * - 지시어: User-agent / Allow / Disallow / Crawl-delay (키 대소문자 무시), 그 외 무시
 * - 연속된 User-agent 줄은 한 그룹, 뒤따르는 규칙이 그룹 전체에 적용
 * - User-agent 없이 나온 규칙은 "*" 그룹
 */
public final class RobotsParser {
    private RobotsParser() {}

    static final String UA_ALL = "*";
    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");

    public static ParsedRobots parse(String robotsTxt) {
        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> group = new ArrayList<>();
        boolean lastWasUa = false;

        for (String raw : (robotsTxt == null ? "" : robotsTxt).split("\\r?\\n")) {
            int hash = raw.indexOf('#');
            String line = (hash >= 0 ? raw.substring(0, hash) : raw).trim();
            if (line.isEmpty()) continue;
            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            if (key.equals("user-agent")) {
                if (!lastWasUa) group = new ArrayList<>();
                String ua = val.isEmpty() ? UA_ALL : val.toLowerCase(Locale.ROOT);
                group.add(ua);
                byUa.putIfAbsent(ua, new RobotsRules());
                lastWasUa = true;
                continue;
            }
            lastWasUa = false;
            if (group.isEmpty()) {
                group.add(UA_ALL);
                byUa.putIfAbsent(UA_ALL, new RobotsRules());
            }
            switch (key) {
                case "allow" -> group.forEach(ua -> byUa.get(ua).addAllow(val));
                case "disallow" -> group.forEach(ua -> byUa.get(ua).addDisallow(val));
                case "crawl-delay" -> {
                    long ms = parseDelayMs(val);
                    group.forEach(ua -> byUa.get(ua).crawlDelayMs(ms));
                }
                default -> { }
            }
        }
        byUa.putIfAbsent(UA_ALL, new RobotsRules());
        return new ParsedRobots(byUa);
    }

    /** 초 단위(소수 허용) → ms. 잘못된 값은 -1 */
    static long parseDelayMs(String v) {
        try {
            double sec = Double.parseDouble(v);
            return (sec < 0 || Double.isNaN(sec)) ? -1 : (long) (sec * 1000);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** UA(소문자) → 규칙 */
    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        /**
         * UA 선택: 그룹 이름이 우리 제품 토큰("webtestool/0.3 ..." → "webtestool")과 같으면 그 그룹,
         * 없으면 "*" 그룹.
         */
        public RobotsRules selectFor(String userAgent) {
            String token = productToken(userAgent);
            if (!token.isEmpty()) {
                RobotsRules exact = byUa.get(token);
                if (exact != null) return exact;
            }
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null) ? star : new RobotsRules();
        }
    }

    static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String ua = userAgent.trim().toLowerCase(Locale.ROOT);
        int cut = ua.length();
        for (int i = 0; i < ua.length(); i++) {
            char c = ua.charAt(i);
            if (c == '/' || c == ' ' || c == '(') { cut = i; break; }
        }
        return ua.substring(0, cut);
    }
}
