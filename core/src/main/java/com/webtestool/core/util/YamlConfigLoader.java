package com.webtestool.core.util;

import com.webtestool.core.model.CacheBackend;
import com.webtestool.core.model.ExecutionMode;
import com.webtestool.core.model.RateLimitStrategy;
import com.webtestool.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 루트 scan.yml 을 읽어 ScanConfig 로 변환(SnakeYAML SafeConstructor).
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * maxDepth: 2
 * maxPages: 100
 * sameDomainOnly: true
 * timeoutMs: 10000
 * scanTimeoutMs: 600000
 * concurrency: 4
 * followRedirects: true
 * userAgent: "webtestool/0.3 (+crawler)"
 *
 * crawler:  { respectRobots, robotsTtlMinutes, crawlDelayMs, allowedDomains, excludePaths, includePatterns, retainBodies }
 * session:  { headers: {k: v}, cookies: {k: v}, authToken }
 * cache:    { enabled, ttlSeconds, backend: memory|disk|tiered, dir, memoryMaxEntries }
 * rateLimit:{ strategy: token_bucket|fixed_window|sliding_window|adaptive, maxRequests, windowMs, maxQueueWaitMs }
 * retry:    { maxAttempts, baseDelayMs }
 * modules:  { names: [..], profile, executionMode: parallel|sequential, concurrency, timeoutMs,
 *             settings: { sql_injection: { timeThresholdMs: 3000 } } }
 *
 * 값 형식 오류는 IllegalArgumentException.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath);
             Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(r);
        }
    }

    public static ScanConfig parse(String yamlText) {
        return load(new StringReader(yamlText == null ? "" : yamlText));
    }

    public static ScanConfig load(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(reader);

        ScanConfig cfg = ScanConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setInt(map, "maxPages", cfg::setMaxPages);
        setBoolean(map, "sameDomainOnly", cfg::setSameDomainOnly);
        setDurationMs(map, "timeoutMs", cfg::setTimeout);
        setDurationMs(map, "scanTimeoutMs", cfg::setScanTimeout);
        setInt(map, "concurrency", cfg::setConcurrency);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) crawler.*
        Map<String, Object> crawler = getMap(map, "crawler");
        if (crawler != null) {
            var c = cfg.getCrawler();
            setBoolean(crawler, "respectRobots", c::setRespectRobots);
            setInt(crawler, "robotsTtlMinutes", c::setRobotsTtlMinutes);
            setLong(crawler, "crawlDelayMs", c::setCrawlDelayMs);
            setStringList(crawler, "allowedDomains", c::setAllowedDomains);
            setStringList(crawler, "excludePaths", c::setExcludePaths);
            setStringList(crawler, "includePatterns", c::setIncludePatterns);
            setBoolean(crawler, "retainBodies", c::setRetainBodies);
        }

        // 3) session.*
        Map<String, Object> session = getMap(map, "session");
        if (session != null) {
            var s = cfg.getSession();
            setStringMap(session, "headers", s::setHeaders);
            setStringMap(session, "cookies", s::setCookies);
            setString(session, "authToken", s::setAuthToken);
        }

        // 4) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.getCache();
            setBoolean(cache, "enabled", c::setEnabled);
            Object ttl = cache.get("ttlSeconds");
            if (ttl != null) c.setTtl(Duration.ofSeconds(toLong("cache.ttlSeconds", ttl)));
            setEnum(cache, "backend", CacheBackend.class, c::setBackend);
            setString(cache, "dir", d -> c.setDir(Path.of(d)));
            setInt(cache, "memoryMaxEntries", c::setMemoryMaxEntries);
        }

        // 5) rateLimit.*
        Map<String, Object> rl = getMap(map, "rateLimit");
        if (rl != null) {
            var r = cfg.getRateLimit();
            setEnum(rl, "strategy", RateLimitStrategy.class, r::setStrategy);
            setInt(rl, "maxRequests", r::setMaxRequests);
            setDurationMs(rl, "windowMs", r::setWindow);
            setDurationMs(rl, "maxQueueWaitMs", r::setMaxQueueWait);
        }

        // 6) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setInt(retry, "maxAttempts", cfg.getRetry()::setMaxAttempts);
            setLong(retry, "baseDelayMs", cfg.getRetry()::setBaseDelayMs);
        }

        // 7) modules.*
        Map<String, Object> modules = getMap(map, "modules");
        if (modules != null) {
            var m = cfg.getModules();
            setStringList(modules, "names", m::setNames);
            setString(modules, "profile", m::setProfile);
            setEnum(modules, "executionMode", ExecutionMode.class, m::setExecutionMode);
            setInt(modules, "concurrency", m::setConcurrency);
            setDurationMs(modules, "timeoutMs", m::setModuleTimeout);
            Map<String, Object> settings = getMap(modules, "settings");
            if (settings != null) {
                for (var e : settings.entrySet()) {
                    if (e.getValue() instanceof Map<?, ?> per) {
                        per.forEach((k, v) -> m.setting(e.getKey(), String.valueOf(k), v));
                    } else if (e.getValue() != null) {
                        throw new IllegalArgumentException("modules.settings." + e.getKey() + " must be a mapping");
                    }
                }
            }
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        if (v != null) throw new IllegalArgumentException(key + " must be a mapping");
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setStringMap(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (!(v instanceof Map<?, ?> m)) throw new IllegalArgumentException(key + " must be a mapping");
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, val) -> out.put(String.valueOf(k), val == null ? "" : String.valueOf(val)));
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Math.toIntExact(toLong(key, v)));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toLong(key, v));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Duration.ofMillis(toLong(key, v)));
    }

    private static long toLong(String key, Object v) {
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }

    /** 대소문자 무시, '-' 는 '_' 로 취급 */
    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (E e : type.getEnumConstants()) {
            if (e.name().equals(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException(key + ": unknown value '" + v + "'");
    }
}
