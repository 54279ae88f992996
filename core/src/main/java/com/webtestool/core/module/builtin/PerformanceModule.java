package com.webtestool.core.module.builtin;

import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 응답 시간/리소스 점검.
 * 페이지별 수집 시간 + 대상 URL 순차 샘플링(캐시 우회).
 */
public final class PerformanceModule extends AbstractTestModule {

    static final long DEFAULT_WARNING_MS = 1000;
    static final long DEFAULT_CRITICAL_MS = 3000;
    static final long DEFAULT_LARGE_PAGE_BYTES = 5L * 1024 * 1024;
    static final int DEFAULT_SAMPLES = 3;

    private long warningMs = DEFAULT_WARNING_MS;
    private long criticalMs = DEFAULT_CRITICAL_MS;
    private long largePageBytes = DEFAULT_LARGE_PAGE_BYTES;
    private int samples = DEFAULT_SAMPLES;

    public PerformanceModule() {
        super(BuiltinModules.PERFORMANCE, Category.PERFORMANCE, "Response time and resource delivery checks");
    }

    @Override
    public void initialize(ScanConfig config) throws ModuleException {
        Map<String, Object> s = config.getModules().settingsFor(name());
        try {
            warningMs = longSetting(s, "warningMs", DEFAULT_WARNING_MS);
            criticalMs = longSetting(s, "criticalMs", DEFAULT_CRITICAL_MS);
            largePageBytes = longSetting(s, "largePageBytes", DEFAULT_LARGE_PAGE_BYTES);
            samples = (int) longSetting(s, "samples", DEFAULT_SAMPLES);
        } catch (IllegalArgumentException e) {
            throw new ModuleException(name(), e.getMessage(), e);
        }
        if (warningMs <= 0 || criticalMs < warningMs) {
            throw new ModuleException(name(), "require 0 < warningMs <= criticalMs (got " + warningMs + ", " + criticalMs + ")");
        }
        if (samples < 0) throw new ModuleException(name(), "samples must be >= 0");
    }

    @Override
    public Set<String> conflictsWith() { return Set.of(BuiltinModules.SQL_INJECTION); }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        for (CrawledPage p : context.fetchedPages()) {
            slow(out, p.getUrl(), p.getFetchDurationMs(), "Slow Response Time");
            if (!p.isHtml()) continue;

            if (p.header("Content-Encoding") == null) {
                out.add(finding("No Compression Enabled", Severity.LOW, p.getUrl())
                        .description("HTML response is served without Content-Encoding.")
                        .recommendation("Enable gzip or brotli compression for text responses.")
                        .build());
            }
            if (p.header("Cache-Control") == null) {
                out.add(finding("No Cache-Control Header", Severity.LOW, p.getUrl())
                        .description("Response does not declare a caching policy.")
                        .recommendation("Set Cache-Control for static and dynamic content.")
                        .build());
            }
            long size = pageSize(p);
            if (size > largePageBytes) {
                out.add(finding("Large Page Size", Severity.MEDIUM, p.getUrl())
                        .description("Page is " + size + " bytes (limit " + largePageBytes + ").")
                        .evidence("bytes", size)
                        .recommendation("Reduce page weight by splitting or lazy-loading content.")
                        .build());
            }
        }
        if (samples > 0) sampleTarget(context, out);
    }

    private void slow(List<Finding> out, URI url, long ms, String title) {
        if (ms > criticalMs) {
            out.add(finding(title + " (Critical)", Severity.HIGH, url)
                    .description("Took " + ms + "ms (threshold " + criticalMs + "ms).")
                    .evidence("responseTimeMs", ms)
                    .evidence("thresholdMs", criticalMs)
                    .recommendation("Profile the server side and cache expensive work.")
                    .build());
        } else if (ms > warningMs) {
            out.add(finding(title + " (Warning)", Severity.MEDIUM, url)
                    .description("Took " + ms + "ms (threshold " + warningMs + "ms).")
                    .evidence("responseTimeMs", ms)
                    .evidence("thresholdMs", warningMs)
                    .recommendation("Profile the server side and cache expensive work.")
                    .build());
        }
    }

    /** 대상 URL 을 순차로 여러 번 요청해 평균 지연을 본다 */
    private void sampleTarget(TestContext context, List<Finding> out) {
        URI target = context.getTargetUrl();
        long total = 0;
        int ok = 0;
        for (int i = 0; i < samples; i++) {
            try {
                total += context.getFetcher().fetch(FetchRequest.builder(target).bypassCache(true).build())
                        .getResponseTimeMs();
                ok++;
            } catch (FetchException e) {
                log.debug("latency sample {} failed: {}", i + 1, e.summary());
            }
        }
        if (ok == 0) {
            out.add(finding("Target Unreachable During Sampling", Severity.MEDIUM, target)
                    .description("All " + samples + " latency samples failed.")
                    .evidence("samples", samples)
                    .recommendation("Check availability of the target under sequential load.")
                    .build());
            return;
        }
        long avg = total / ok;
        log.debug("target latency avg={}ms over {} sample(s)", avg, ok);
        slow(out, target, avg, "Slow Target Response");
    }

    private static long pageSize(CrawledPage p) {
        String cl = p.header("Content-Length");
        if (cl != null && cl.trim().matches("\\d{1,18}")) return Long.parseLong(cl.trim());
        return p.getBody().isRetained() ? p.getBody().text().length() : 0;
    }
}
