package com.webtestool.core.module;

import com.webtestool.core.module.builtin.AccessibilityModule;
import com.webtestool.core.module.builtin.CorsModule;
import com.webtestool.core.module.builtin.CsrfModule;
import com.webtestool.core.module.builtin.OpenRedirectModule;
import com.webtestool.core.module.builtin.PerformanceModule;
import com.webtestool.core.module.builtin.SecurityHeadersModule;
import com.webtestool.core.module.builtin.SeoModule;
import com.webtestool.core.module.builtin.SqlInjectionModule;
import com.webtestool.core.module.builtin.XssModule;

import java.util.List;

/** 컴파일 시점에 고정된 내장 모듈 표 */
public final class BuiltinModules {
    private BuiltinModules() {}

    public static final String SECURITY_HEADERS = "security_headers";
    public static final String SQL_INJECTION = "sql_injection";
    public static final String XSS = "xss";
    public static final String CSRF = "csrf";
    public static final String OPEN_REDIRECT = "open_redirect";
    public static final String CORS = "cors";
    public static final String SEO = "seo";
    public static final String ACCESSIBILITY = "accessibility";
    public static final String PERFORMANCE = "performance";

    public static final List<String> ALL = List.of(
            SECURITY_HEADERS, SQL_INJECTION, XSS, CSRF, OPEN_REDIRECT, CORS, SEO, ACCESSIBILITY, PERFORMANCE);

    public static void registerAll(ModuleRegistry r) {
        r.register(SECURITY_HEADERS, SecurityHeadersModule::new);
        r.register(SQL_INJECTION, SqlInjectionModule::new);
        r.register(XSS, XssModule::new);
        r.register(CSRF, CsrfModule::new);
        r.register(OPEN_REDIRECT, OpenRedirectModule::new);
        r.register(CORS, CorsModule::new);
        r.register(SEO, SeoModule::new);
        r.register(ACCESSIBILITY, AccessibilityModule::new);
        r.register(PERFORMANCE, PerformanceModule::new);
    }
}
