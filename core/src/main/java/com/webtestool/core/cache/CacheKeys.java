package com.webtestool.core.cache;

import com.webtestool.core.util.UrlUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** 요청 지문(SHA-256 hex) 생성 */
public final class CacheKeys {
    private CacheKeys() {}

    /**
     * method + 정규화 URL + 관련 헤더(이름 소문자, 정렬).
     * 쿼리 순서만 다른 URL 은 같은 키가 된다.
     */
    public static String fingerprint(String method, URI url, Map<String, String> relevantHeaders) {
        URI n = UrlUtils.normalize(url);
        StringBuilder sb = new StringBuilder(128)
                .append(method == null ? "GET" : method.toUpperCase(Locale.ROOT))
                .append(' ')
                .append(n != null ? n.toString() : String.valueOf(url));
        if (relevantHeaders != null && !relevantHeaders.isEmpty()) {
            Map<String, String> sorted = new TreeMap<>();
            relevantHeaders.forEach((k, v) -> {
                if (k != null) sorted.put(k.toLowerCase(Locale.ROOT), v == null ? "" : v);
            });
            sorted.forEach((k, v) -> sb.append('\n').append(k).append(':').append(v));
        }
        return sha256Hex(sb.toString());
    }

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
