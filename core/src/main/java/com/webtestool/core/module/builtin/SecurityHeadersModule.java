package com.webtestool.core.module.builtin;

import com.webtestool.core.model.Category;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import com.webtestool.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * 패시브: 응답 헤더/쿠키 품질 점검.
 * 헤더 발견은 origin 단위로 보고한다(url=origin 이라 같은 사이트의 여러 페이지가 1건으로 합쳐짐).
 */
public final class SecurityHeadersModule extends AbstractTestModule {

    private static final String OWASP = "A05:2021-Security Misconfiguration";

    public SecurityHeadersModule() {
        super(BuiltinModules.SECURITY_HEADERS, Category.SECURITY,
                "HTTP security headers and cookie flags");
    }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        for (CrawledPage p : context.fetchedPages()) {
            URI origin = UrlUtils.originOf(p.getUrl());
            boolean https = "https".equalsIgnoreCase(p.getUrl().getScheme());

            // 1) HSTS (HTTPS 에서 없으면 MEDIUM, HTTP 면 INFO)
            if (isBlank(p.header("Strict-Transport-Security"))) {
                out.add(missing(origin, "Strict-Transport-Security", https ? Severity.MEDIUM : Severity.INFO,
                        "Enable HSTS with a max-age of at least 6 months."));
            }

            // 2) CSP (부재 또는 지나치게 느슨함)
            String csp = p.header("Content-Security-Policy");
            if (isBlank(csp)) {
                out.add(missing(origin, "Content-Security-Policy", Severity.MEDIUM,
                        "Define a Content-Security-Policy restricting script sources."));
            } else if (isWeakCsp(csp)) {
                out.add(finding("Weak Content-Security-Policy", Severity.MEDIUM, origin)
                        .description("Content-Security-Policy is permissive.")
                        .evidence("header", "Content-Security-Policy")
                        .evidence("observed", elide(csp, 180))
                        .cweId("CWE-693").owaspCategory(OWASP)
                        .recommendation("Remove wildcard and 'unsafe-inline' sources.")
                        .build());
            }

            // 3~6) 나머지 헤더
            if (isBlank(p.header("X-Frame-Options")) && !hasFrameAncestors(csp)) {
                out.add(missing(origin, "X-Frame-Options", Severity.LOW,
                        "Set X-Frame-Options: DENY or a CSP frame-ancestors directive."));
            }
            String xcto = p.header("X-Content-Type-Options");
            if (isBlank(xcto) || !xcto.trim().equalsIgnoreCase("nosniff")) {
                out.add(missing(origin, "X-Content-Type-Options", Severity.LOW,
                        "Set X-Content-Type-Options: nosniff."));
            }
            if (isBlank(p.header("Referrer-Policy"))) {
                out.add(missing(origin, "Referrer-Policy", Severity.INFO,
                        "Set Referrer-Policy: strict-origin-when-cross-origin."));
            }
            if (isBlank(p.header("Permissions-Policy"))) {
                out.add(missing(origin, "Permissions-Policy", Severity.INFO,
                        "Restrict powerful browser features with Permissions-Policy."));
            }

            // 7) 쿠키 플래그
            for (String sc : p.headers("Set-Cookie")) {
                checkCookie(out, origin, https, sc);
            }
        }
    }

    private void checkCookie(List<Finding> out, URI origin, boolean https, String setCookie) {
        String name = cookieName(setCookie);
        String low = setCookie.toLowerCase(Locale.ROOT);
        if (!low.contains("httponly")) {
            out.add(cookie(origin, name, "HttpOnly", Severity.LOW, "CWE-1004"));
        }
        if (https && !low.contains("secure")) {
            out.add(cookie(origin, name, "Secure", Severity.LOW, "CWE-614"));
        }
        if (!low.contains("samesite")) {
            out.add(cookie(origin, name, "SameSite", Severity.INFO, "CWE-1275"));
        }
    }

    private Finding missing(URI origin, String header, Severity sev, String recommendation) {
        return finding("Missing security header: " + header, sev, origin)
                .description("Response does not set " + header + ".")
                .evidence("header", header)
                .evidence("observed", "(absent)")
                .cweId("CWE-693").owaspCategory(OWASP)
                .recommendation(recommendation)
                .build();
    }

    private Finding cookie(URI origin, String name, String flag, Severity sev, String cwe) {
        return finding("Cookie without " + flag + ": " + name, sev, origin)
                .description("Set-Cookie for '" + name + "' lacks the " + flag + " attribute.")
                .evidence("cookie", name)
                .evidence("flag", flag)
                .cweId(cwe).owaspCategory(OWASP)
                .recommendation("Add the " + flag + " attribute to session cookies.")
                .build();
    }

    // ---------- 헬퍼 ----------

    static boolean isWeakCsp(String csp) {
        String lc = csp.toLowerCase(Locale.ROOT);
        if (lc.contains("default-src *") || lc.contains("default-src 'unsafe-inline'") || lc.contains("default-src data: blob:")) return true;
        return lc.contains("script-src *") || lc.contains("script-src 'unsafe-inline'") || lc.contains("script-src data: blob:");
    }

    private static boolean hasFrameAncestors(String csp) {
        return csp != null && csp.toLowerCase(Locale.ROOT).contains("frame-ancestors");
    }

    private static String cookieName(String setCookie) {
        int i = setCookie.indexOf('=');
        if (i <= 0) return setCookie.split(";", 2)[0].trim();
        return setCookie.substring(0, i).trim();
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }

    private static String elide(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }
}
