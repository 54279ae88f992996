package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.UrlParamUtil;
import com.webtestool.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CORS 설정 점검. 대상 URL 과 같은 도메인의 API 엔드포인트에 가짜 Origin 을 실어
 * 단순 GET 과 OPTIONS preflight 를 보내고 응답 헤더를 본다.
 * <ul>
 *   <li>임의 Origin 반사 + credentials 허용: HIGH</li>
 *   <li>임의 Origin 반사: MEDIUM</li>
 *   <li>ACAO=* + credentials 허용: MEDIUM</li>
 *   <li>ACAO=*: LOW</li>
 * </ul>
 * URL 당 가장 심각한 것 하나만 남긴다.
 */
public final class CorsModule extends AbstractTestModule {
    private static final StructuredLog SLOG = StructuredLog.get(CorsModule.class);

    static final List<String> DEFAULT_ORIGINS = List.of("https://webtestool.example", "null");
    static final int DEFAULT_MAX_URLS = 10;

    private List<String> origins = DEFAULT_ORIGINS;
    private int maxUrls = DEFAULT_MAX_URLS;

    public CorsModule() {
        super(BuiltinModules.CORS, Category.SECURITY,
                "Cross-origin resource sharing policy accepting foreign origins");
    }

    @Override
    public void initialize(ScanConfig config) throws ModuleException {
        Map<String, Object> s = config.getModules().settingsFor(name());
        try {
            maxUrls = (int) longSetting(s, "maxUrls", DEFAULT_MAX_URLS);
        } catch (IllegalArgumentException e) {
            throw new ModuleException(name(), e.getMessage(), e);
        }
        if (maxUrls <= 0) throw new ModuleException(name(), "maxUrls must be positive: " + maxUrls);
        origins = stringList(s, "origins", DEFAULT_ORIGINS);
        if (origins.isEmpty()) throw new ModuleException(name(), "origins must not be empty");
    }

    /** 응답 하나를 판정한 결과 */
    record Verdict(Severity severity, String title, String origin, String acao, String acac, String method) {}

    @Override
    protected void check(TestContext context, List<Finding> out) {
        IFetcher fetcher = context.getFetcher();
        for (URI url : urls(context)) {
            Verdict worst = null;
            for (String origin : origins) {
                worst = worse(worst, judge(send(fetcher, url, origin, false), origin, "GET"));
                worst = worse(worst, judge(send(fetcher, url, origin, true), origin, "OPTIONS"));
            }
            if (worst == null) continue;
            out.add(finding(worst.title(), worst.severity(), url)
                    .description("Origin '" + worst.origin() + "' received Access-Control-Allow-Origin: "
                            + worst.acao() + " (credentials: " + (worst.acac() == null ? "not allowed" : worst.acac()) + ").")
                    .evidence("origin", worst.origin())
                    .evidence("method", worst.method())
                    .evidence("Access-Control-Allow-Origin", worst.acao())
                    .evidence("Access-Control-Allow-Credentials", worst.acac() == null ? "" : worst.acac())
                    .cweId("CWE-942").owaspCategory("A05:2021-Security Misconfiguration")
                    .recommendation("Answer CORS requests only for an explicit allow-list of trusted origins "
                            + "and never combine a reflected or wildcard origin with Access-Control-Allow-Credentials: true.")
                    .build());
            SLOG.info("cors-misconfig", "url", url, "severity", worst.severity().label(), "origin", worst.origin());
        }
    }

    /** 대상 URL 먼저, 그 뒤 같은 도메인 API 엔드포인트(쿼리 제외) */
    List<URI> urls(TestContext context) {
        URI target = context.getTargetUrl();
        Set<URI> out = new LinkedHashSet<>();
        out.add(target);
        for (ApiEndpoint ep : context.getEndpoints()) {
            if (UrlUtils.sameDomain(ep.url(), target)) out.add(UrlParamUtil.withRawQuery(ep.url(), null));
        }
        List<URI> list = new ArrayList<>(out);
        if (list.size() > maxUrls) {
            log.info("cors: limiting {} urls to {}", list.size(), maxUrls);
            list = list.subList(0, maxUrls);
        }
        return list;
    }

    private FetchResult send(IFetcher fetcher, URI url, String origin, boolean preflight) {
        FetchRequest.Builder b = FetchRequest.builder(url)
                .header("Origin", origin)
                .bypassCache(true).acceptServerErrors(true);
        if (preflight) {
            b.method("OPTIONS").header("Access-Control-Request-Method", "GET");
        }
        try {
            return fetcher.fetch(b.build());
        } catch (FetchException e) {
            log.debug("cors {} {} failed: {}", preflight ? "OPTIONS" : "GET", url, e.summary());
            return null;
        }
    }

    static Verdict judge(FetchResult r, String origin, String method) {
        if (r == null) return null;
        String acao = r.header("Access-Control-Allow-Origin");
        if (acao == null || acao.isBlank()) return null;
        acao = acao.trim();
        String acac = r.header("Access-Control-Allow-Credentials");
        boolean creds = acac != null && "true".equalsIgnoreCase(acac.trim());
        if (acao.equals(origin)) {
            return new Verdict(creds ? Severity.HIGH : Severity.MEDIUM,
                    creds ? "CORS reflects arbitrary origin with credentials" : "CORS reflects arbitrary origin",
                    origin, acao, acac, method);
        }
        if ("*".equals(acao)) {
            return new Verdict(creds ? Severity.MEDIUM : Severity.LOW,
                    creds ? "CORS wildcard origin with credentials" : "CORS allows any origin",
                    origin, acao, acac, method);
        }
        return null;
    }

    private static Verdict worse(Verdict a, Verdict b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.severity().compareTo(a.severity()) > 0 ? b : a;
    }
}
