package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.CrawledPage;
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
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Open redirect. 리다이렉트를 따라가지 않는 요청으로 보낸다.
 * 이름이 리다이렉트 대상처럼 보이는 쿼리 파라미터에 외부 URL 을 넣고,
 * 3xx 의 Location 이 외부 호스트를 가리키면 보고한다. GET 이 3xx 가 아니면 HEAD 로 한 번 더.
 * 후보가 하나도 없으면 대상 URL 에 defaultParams 를 붙여 본다.
 */
public final class OpenRedirectModule extends AbstractTestModule {
    private static final StructuredLog SLOG = StructuredLog.get(OpenRedirectModule.class);

    static final String EXTERNAL = "https://webtestool.example/";
    static final String EXTERNAL_HOST = "webtestool.example";
    static final List<String> DEFAULT_PARAMS = List.of("next", "redirect", "url");
    static final int DEFAULT_MAX_CANDIDATES = 20;

    // 부분 일치
    private static final List<String> NAME_HINTS = List.of(
            "redirect", "redir", "url", "return", "next", "goto", "dest", "target", "continue", "callback");
    // 짧은 이름은 정확 일치만
    private static final Set<String> EXACT_NAMES = Set.of("r", "to", "u", "go");

    private List<String> defaultParams = DEFAULT_PARAMS;
    private int maxCandidates = DEFAULT_MAX_CANDIDATES;

    public OpenRedirectModule() {
        super(BuiltinModules.OPEN_REDIRECT, Category.SECURITY,
                "Redirect parameters that send the browser to an arbitrary external host");
    }

    @Override
    public void initialize(ScanConfig config) throws ModuleException {
        Map<String, Object> s = config.getModules().settingsFor(name());
        try {
            maxCandidates = (int) longSetting(s, "maxCandidates", DEFAULT_MAX_CANDIDATES);
        } catch (IllegalArgumentException e) {
            throw new ModuleException(name(), e.getMessage(), e);
        }
        if (maxCandidates <= 0) {
            throw new ModuleException(name(), "maxCandidates must be positive: " + maxCandidates);
        }
        defaultParams = stringList(s, "defaultParams", DEFAULT_PARAMS);
    }

    /** 리다이렉트 후보: URL 과 시험할 파라미터 이름 */
    record Candidate(URI url, String param) {}

    @Override
    protected void check(TestContext context, List<Finding> out) {
        List<Candidate> candidates = candidates(context);
        log.debug("open_redirect: {} candidate(s)", candidates.size());
        IFetcher fetcher = context.getFetcher();
        for (Candidate c : candidates) {
            Finding f = tryCandidate(fetcher, c);
            if (f != null) {
                out.add(f);
                SLOG.info("open-redirect", "url", c.url(), "parameter", c.param(), "location", f.getEvidence().get("location"));
            }
        }
    }

    List<Candidate> candidates(TestContext context) {
        URI target = context.getTargetUrl();
        Map<String, Candidate> found = new LinkedHashMap<>();
        for (CrawledPage page : context.fetchedPages()) {
            addQuery(found, target, page.getUrl());
            for (URI link : page.getLinks()) addQuery(found, target, link);
        }
        if (found.isEmpty()) {
            for (String p : defaultParams) {
                found.putIfAbsent(key(target, p), new Candidate(target, p));
            }
        }
        List<Candidate> out = new ArrayList<>(found.values());
        if (out.size() > maxCandidates) {
            log.info("open_redirect: limiting {} candidates to {}", out.size(), maxCandidates);
            out = out.subList(0, maxCandidates);
        }
        return out;
    }

    private static void addQuery(Map<String, Candidate> found, URI target, URI url) {
        if (url == null || url.getRawQuery() == null || !UrlUtils.sameDomain(url, target)) return;
        for (String name : UrlParamUtil.parseQuery(url).keySet()) {
            if (looksLikeRedirect(name)) found.putIfAbsent(key(url, name), new Candidate(url, name));
        }
    }

    private static String key(URI url, String param) {
        return UrlParamUtil.withRawQuery(url, null) + " " + param.toLowerCase(Locale.ROOT);
    }

    static boolean looksLikeRedirect(String param) {
        String p = param.toLowerCase(Locale.ROOT);
        if (EXACT_NAMES.contains(p)) return true;
        for (String h : NAME_HINTS) {
            if (p.contains(h)) return true;
        }
        return false;
    }

    /** 주입 값: 일반, 스킴 상대, 이중 인코딩 */
    static List<String> payloads() {
        return List.of(
                EXTERNAL,
                "//" + EXTERNAL_HOST + "/",
                URLEncoder.encode(EXTERNAL, StandardCharsets.UTF_8));
    }

    private Finding tryCandidate(IFetcher fetcher, Candidate c) {
        String baseHost = hostOf(c.url());
        for (String payload : payloads()) {
            URI attemptUrl = UrlParamUtil.withParamOverrideFirst(c.url(), c.param(), payload);
            FetchResult r = send(fetcher, "GET", attemptUrl);
            String method = "GET";
            if (r == null || !isRedirect(r)) {
                r = send(fetcher, "HEAD", attemptUrl);
                method = "HEAD";
            }
            if (r == null || !isRedirect(r)) continue;
            String loc = r.header("Location");
            if (!isExternal(loc, baseHost)) continue;
            return finding("Open Redirect", Severity.MEDIUM, c.url())
                    .description("Parameter '" + c.param() + "' redirects to an arbitrary external host.")
                    .evidence("parameter", c.param())
                    .evidence("payload", payload)
                    .evidence("request", method + " " + attemptUrl)
                    .evidence("status", r.getStatusCode())
                    .evidence("location", loc)
                    .cweId("CWE-601").owaspCategory("A01:2021-Broken Access Control")
                    .recommendation("Redirect only to relative paths or to an allow-list of hosts; "
                            + "map redirect targets to server-side identifiers instead of raw URLs.")
                    .build();
        }
        return null;
    }

    private FetchResult send(IFetcher fetcher, String method, URI url) {
        try {
            return fetcher.fetch(FetchRequest.builder(url).method(method)
                    .header("Accept", "text/html,application/xhtml+xml")
                    .followRedirects(false).bypassCache(true).acceptServerErrors(true).build());
        } catch (FetchException e) {
            log.debug("open_redirect {} {} failed: {}", method, url, e.summary());
            return null;
        }
    }

    private static boolean isRedirect(FetchResult r) {
        String loc = r.header("Location");
        return r.getStatusCode() >= 300 && r.getStatusCode() < 400 && loc != null && !loc.isBlank();
    }

    /** 절대 URL 이나 //host 형태가 다른 호스트를 가리키면 외부. 상대 경로는 내부. */
    static boolean isExternal(String location, String baseHost) {
        if (location == null) return false;
        String loc = location.trim().replace('\\', '/');
        try {
            URI u = loc.startsWith("//") ? URI.create("http:" + loc) : URI.create(loc);
            if (!u.isAbsolute() && !loc.startsWith("//")) return false;
            String h = hostOf(u);
            return !h.isEmpty() && !h.equals(baseHost);
        } catch (IllegalArgumentException e) {
            // 파싱되지 않는 Location 은 브라우저도 따라가지 않는다
            return false;
        }
    }

    private static String hostOf(URI u) {
        return (u.getHost() == null) ? "" : u.getHost().toLowerCase(Locale.ROOT);
    }
}
