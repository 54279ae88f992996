package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import com.webtestool.core.util.StructuredLog;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SQL 인젝션(액티브).
 * - 에러 기반: 작은따옴표 주입 후 DB 오류 시그니처
 * - 시간 기반 블라인드: 기준 지연 대비 지연 증가가 timeThresholdMs 이상이면 HIGH.
 *   timeThresholdMs 가 설정되지 않으면 시간 기반은 수행하지 않는다.
 * 모든 프로브는 캐시를 우회한다.
 */
public final class SqlInjectionModule extends AbstractTestModule {
    private static final StructuredLog SLOG = StructuredLog.get(SqlInjectionModule.class);

    static final String INJECT = "'";
    static final List<String> DEFAULT_TIME_PAYLOADS = List.of("' OR SLEEP(5)--", "' OR pg_sleep(5)--");
    static final int DEFAULT_MAX_POINTS = 25;

    private static final String CWE = "CWE-89";
    private static final String OWASP = "A03:2021-Injection";
    private static final String RECOMMENDATION =
            "Use parameterized queries / prepared statements and never concatenate request input into SQL.";

    // 대표 에러 시그니처(보수적)
    private static final String[] SIGNS = {
            "SQLSTATE[", "JDBCException", "HibernateException",
            "You have an error in your SQL", "SQL syntax", "MariaDB server version",
            "ERROR: syntax error at or near", "PG::SyntaxError",
            "ORA-00933", "ORA-00904", "ORA-01756", "ORA-00936",
            "Unclosed quotation mark", "Incorrect syntax near",
            "SQLite3::SQLException", "unrecognized token"
    };

    private Long thresholdMs;                       // null = 시간 기반 비활성
    private List<String> timePayloads = DEFAULT_TIME_PAYLOADS;
    private int maxPoints = DEFAULT_MAX_POINTS;
    private Duration baseTimeout = Duration.ofSeconds(10);

    public SqlInjectionModule() {
        super(BuiltinModules.SQL_INJECTION, Category.SECURITY,
                "Error-based and time-based blind SQL injection probes");
    }

    @Override
    public void initialize(ScanConfig config) throws ModuleException {
        Map<String, Object> s = config.getModules().settingsFor(name());
        try {
            thresholdMs = optionalLong(s, "timeThresholdMs");
            maxPoints = (int) longSetting(s, "maxInjectionPoints", DEFAULT_MAX_POINTS);
        } catch (IllegalArgumentException e) {
            throw new ModuleException(name(), e.getMessage(), e);
        }
        if (thresholdMs != null && thresholdMs <= 0) {
            throw new ModuleException(name(), "timeThresholdMs must be positive: " + thresholdMs);
        }
        if (maxPoints <= 0) {
            throw new ModuleException(name(), "maxInjectionPoints must be positive: " + maxPoints);
        }
        timePayloads = stringList(s, "timePayloads", DEFAULT_TIME_PAYLOADS);
        baseTimeout = config.getTimeout();
        if (thresholdMs == null) {
            log.info("sql_injection: timeThresholdMs not set, time-based probing disabled");
        }
    }

    /** 지연 측정끼리 간섭하지 않도록 */
    @Override
    public Set<String> conflictsWith() { return Set.of(BuiltinModules.PERFORMANCE); }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        List<InjectionPoint> points = injectionPoints(context);
        log.debug("sql_injection: {} injection point(s)", points.size());
        IFetcher fetcher = context.getFetcher();

        for (InjectionPoint p : points) {
            for (String param : p.params().keySet()) {
                Finding f = probeError(fetcher, p, param);
                if (f == null && thresholdMs != null) f = probeTime(fetcher, p, param);
                if (f != null) {
                    out.add(f);
                    SLOG.info("sqli-detected", "url", p.url(), "parameter", param, "title", f.getTitle());
                }
            }
        }
    }

    // ---------- 에러 기반 ----------

    private Finding probeError(IFetcher fetcher, InjectionPoint p, String param) {
        String value = p.params().getOrDefault(param, "") + INJECT;
        FetchResult r;
        try {
            r = fetcher.fetch(p.request(param, value).bypassCache(true).acceptServerErrors(true).build());
        } catch (FetchException e) {
            log.debug("error probe failed {} [{}]: {}", p.url(), param, e.summary());
            return null;
        }
        String hit = match(r.getBody());
        if (hit == null) return null;
        return finding("SQL Injection (error-based)", Severity.HIGH, p.url())
                .description("Database error signature returned after injecting a single quote into '" + param + "'.")
                .evidence("method", p.method())
                .evidence("parameter", param)
                .evidence("payload", value)
                .evidence("signature", hit)
                .evidence("snippet", snippetAround(r.getBody(), hit, 80))
                .cweId(CWE).owaspCategory(OWASP)
                .recommendation(RECOMMENDATION)
                .build();
    }

    // ---------- 시간 기반 ----------

    private Finding probeTime(IFetcher fetcher, InjectionPoint p, String param) {
        long threshold = thresholdMs;
        Duration timeout = baseTimeout.plusMillis(threshold);
        long baseline;
        try {
            baseline = fetcher.fetch(p.request(param, p.params().getOrDefault(param, ""))
                    .bypassCache(true).acceptServerErrors(true).timeout(timeout).build()).getResponseTimeMs();
        } catch (FetchException e) {
            log.debug("baseline failed {} [{}]: {}", p.url(), param, e.summary());
            return null;
        }

        for (String payload : timePayloads) {
            long observed;
            try {
                observed = fetcher.fetch(p.request(param, payload)
                        .bypassCache(true).acceptServerErrors(true).timeout(timeout).build()).getResponseTimeMs();
            } catch (FetchException e) {
                log.debug("time probe failed {} [{}] {}: {}", p.url(), param, payload, e.summary());
                continue;
            }
            long delta = observed - baseline;
            if (delta >= threshold) {
                return finding("SQL Injection (time-based blind)", Severity.HIGH, p.url())
                        .description("Response to '" + param + "' was delayed by " + delta
                                + "ms when a time-delay SQL payload was injected.")
                        .evidence("method", p.method())
                        .evidence("payload", payload)
                        .evidence("parameter", param)
                        .evidence("baselineMs", baseline)
                        .evidence("observedMs", observed)
                        .evidence("latencyDeltaMs", delta)
                        .evidence("thresholdMs", threshold)
                        .cweId(CWE).owaspCategory(OWASP)
                        .recommendation(RECOMMENDATION)
                        .build();
            }
        }
        return null;
    }

    // ---------- 주입 지점 수집 ----------

    List<InjectionPoint> injectionPoints(TestContext context) {
        List<InjectionPoint> out = InjectionPoint.collect(context);
        if (out.size() > maxPoints) {
            log.info("sql_injection: limiting {} injection points to {}", out.size(), maxPoints);
            out = out.subList(0, maxPoints);
        }
        return out;
    }

    // ---------- 헬퍼 ----------

    static String match(String body) {
        if (body == null || body.isEmpty()) return null;
        String l = body.toLowerCase(Locale.ROOT);
        for (String s : SIGNS) {
            if (l.contains(s.toLowerCase(Locale.ROOT))) return s;
        }
        return null;
    }

    private static String snippetAround(String body, String needle, int radius) {
        int i = body.toLowerCase(Locale.ROOT).indexOf(needle.toLowerCase(Locale.ROOT));
        if (i < 0) return "";
        int from = Math.max(0, i - radius);
        int to = Math.min(body.length(), i + needle.length() + radius);
        return body.substring(from, to).replaceAll("\\s+", " ").trim();
    }
}
