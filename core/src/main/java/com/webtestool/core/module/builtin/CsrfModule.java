package com.webtestool.core.module.builtin;

import com.webtestool.core.model.Category;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.FormField;
import com.webtestool.core.model.FormInfo;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;

import java.util.List;
import java.util.Locale;

/** 상태 변경 폼(POST/PUT/PATCH/DELETE)에 anti-CSRF 토큰 필드가 없는지 패시브 점검 */
public final class CsrfModule extends AbstractTestModule {

    static final List<String> DEFAULT_TOKEN_NAMES =
            List.of("csrf", "csrf_token", "token", "_token", "xsrf", "authenticity_token");

    private List<String> tokenNames = DEFAULT_TOKEN_NAMES;

    public CsrfModule() {
        super(BuiltinModules.CSRF, Category.SECURITY, "State-changing forms without anti-CSRF tokens");
    }

    @Override
    public void initialize(ScanConfig config) {
        tokenNames = stringList(config.getModules().settingsFor(name()), "tokenNames", DEFAULT_TOKEN_NAMES)
                .stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        for (CrawledPage page : context.fetchedPages()) {
            for (FormInfo form : page.getForms()) {
                if (!form.isStateChanging() || hasToken(form)) continue;
                out.add(finding("Form without CSRF token", Severity.MEDIUM, form.action())
                        .description("A " + form.method() + " form submits to " + form.action()
                                + " without an anti-CSRF token field.")
                        .evidence("method", form.method())
                        .evidence("action", form.action())
                        .evidence("fields", fieldNames(form))
                        .cweId("CWE-352").owaspCategory("A01:2021-Broken Access Control")
                        .recommendation("Add a per-session CSRF token to every state-changing form and validate it server-side.")
                        .build());
            }
        }
    }

    /** 필드 이름에 토큰 이름이 포함되면 토큰으로 본다 */
    private boolean hasToken(FormInfo form) {
        for (FormField f : form.fields()) {
            if (f.name() == null) continue;
            String n = f.name().toLowerCase(Locale.ROOT);
            for (String t : tokenNames) {
                if (n.contains(t)) return true;
            }
        }
        return false;
    }

    private static String fieldNames(FormInfo form) {
        return String.join(",", form.fields().stream()
                .map(FormField::name).filter(n -> n != null && !n.isBlank()).toList());
    }
}
