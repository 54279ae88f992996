package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.FetchException;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import com.webtestool.core.util.StructuredLog;
import com.webtestool.core.util.UrlUtils;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cross-Site Scripting.
 * - reflected: 무해 토큰을 파라미터마다 주입하고, 이스케이프 없이 되돌아오면 보고.
 *   속성값 안에 반사되면 MEDIUM, 그 밖의 HTML 문맥이면 HIGH.
 * - dom: 인라인/동일 도메인 스크립트에 DOM 소스와 싱크가 함께 있으면 MEDIUM.
 */
public final class XssModule extends AbstractTestModule {
    private static final StructuredLog SLOG = StructuredLog.get(XssModule.class);

    static final String TOKEN = "WTT_XSS_TOKEN_<>";
    static final String ESCAPED_TOKEN = "WTT_XSS_TOKEN_&lt;&gt;";
    static final String REFLECTED = "reflected";
    static final String DOM = "dom";
    static final List<String> DEFAULT_CHECKS = List.of(REFLECTED, DOM);
    static final int DEFAULT_MAX_POINTS = 25;

    private static final String CWE = "CWE-79";
    private static final String OWASP = "A03:2021-Injection";
    private static final String RECOMMENDATION =
            "Encode user-supplied data for the output context (HTML, attribute, JavaScript, URL) "
                    + "and add a Content-Security-Policy that restricts script sources.";

    static final List<String> DOM_SOURCES = List.of(
            "document.URL", "document.documentURI", "location.href", "location.search",
            "location.hash", "location.pathname", "window.name", "document.referrer");
    static final List<String> DOM_SINKS = List.of(
            "eval(", "setTimeout(", "setInterval(", "Function(", ".innerHTML", ".outerHTML",
            "document.write(", "document.writeln(", ".insertAdjacentHTML");

    private static final Pattern ATTR_DOUBLE = Pattern.compile(
            "(?is).*\\b[A-Za-z0-9_-]+\\s*=\\s*\"[^\"]*" + Pattern.quote(TOKEN) + "[^\"]*\".*");
    private static final Pattern ATTR_SINGLE = Pattern.compile(
            "(?is).*\\b[A-Za-z0-9_-]+\\s*=\\s*'[^']*" + Pattern.quote(TOKEN) + "[^']*'.*");

    private Set<String> checks = Set.copyOf(DEFAULT_CHECKS);
    private int maxPoints = DEFAULT_MAX_POINTS;

    public XssModule() {
        super(BuiltinModules.XSS, Category.SECURITY,
                "Reflected XSS with a harmless marker and DOM source/sink review of scripts");
    }

    @Override
    public void initialize(ScanConfig config) throws ModuleException {
        Map<String, Object> s = config.getModules().settingsFor(name());
        try {
            maxPoints = (int) longSetting(s, "maxInjectionPoints", DEFAULT_MAX_POINTS);
        } catch (IllegalArgumentException e) {
            throw new ModuleException(name(), e.getMessage(), e);
        }
        if (maxPoints <= 0) {
            throw new ModuleException(name(), "maxInjectionPoints must be positive: " + maxPoints);
        }
        Set<String> c = new HashSet<>();
        for (String v : stringList(s, "checks", DEFAULT_CHECKS)) {
            String k = v.trim().toLowerCase(Locale.ROOT);
            if (!REFLECTED.equals(k) && !DOM.equals(k)) {
                throw new ModuleException(name(), "unknown check '" + v + "' (expected reflected, dom)");
            }
            c.add(k);
        }
        checks = Set.copyOf(c);
    }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        if (checks.contains(REFLECTED)) reflected(context, out);
        if (checks.contains(DOM)) dom(context, out);
    }

    // ---------- reflected ----------

    private void reflected(TestContext context, List<Finding> out) {
        List<InjectionPoint> points = InjectionPoint.collect(context);
        if (points.size() > maxPoints) {
            log.info("xss: limiting {} injection points to {}", points.size(), maxPoints);
            points = points.subList(0, maxPoints);
        }
        IFetcher fetcher = context.getFetcher();
        for (InjectionPoint p : points) {
            for (String param : p.params().keySet()) {
                Finding f = inject(fetcher, p, param);
                if (f != null) {
                    out.add(f);
                    SLOG.info("xss-reflected", "url", p.url(), "parameter", param, "severity", f.getSeverity().label());
                }
            }
        }
    }

    private Finding inject(IFetcher fetcher, InjectionPoint p, String param) {
        FetchRequest req = p.request(param, TOKEN)
                .header("Accept", "text/html,application/xhtml+xml")
                .bypassCache(true).acceptServerErrors(true).build();
        FetchResult r;
        try {
            r = fetcher.fetch(req);
        } catch (FetchException e) {
            log.debug("xss request failed {} [{}]: {}", p.url(), param, e.summary());
            return null;
        }
        String body = r.getBody();
        if (body == null || !body.contains(TOKEN)) {
            if (body != null && body.contains(ESCAPED_TOKEN)) {
                log.debug("xss marker escaped {} [{}]", p.url(), param);
            }
            return null;
        }
        Severity sev = contextSeverity(body);
        return finding("Reflected Cross-Site Scripting (XSS)", sev, p.url())
                .description(sev == Severity.HIGH
                        ? "Input of '" + param + "' is reflected into the HTML body without escaping."
                        : "Input of '" + param + "' is reflected unescaped inside an attribute value.")
                .evidence("method", p.method())
                .evidence("parameter", param)
                .evidence("payload", TOKEN)
                .evidence("request", req.getMethod() + " " + req.getUrl())
                .evidence("snippet", snippetAround(body, TOKEN, 80))
                .cweId(CWE).owaspCategory(OWASP)
                .recommendation(RECOMMENDATION)
                .build();
    }

    static Severity contextSeverity(String body) {
        String around = snippetAround(body, TOKEN, 64);
        boolean attr = ATTR_DOUBLE.matcher(around).matches() || ATTR_SINGLE.matcher(around).matches();
        return attr ? Severity.MEDIUM : Severity.HIGH;
    }

    // ---------- dom ----------

    private void dom(TestContext context, List<Finding> out) {
        Set<URI> seenScripts = new HashSet<>();
        for (HtmlPage page : htmlPages(context)) {
            StringBuilder inline = new StringBuilder();
            for (Element s : page.doc().select("script:not([src])")) inline.append(s.data()).append('\n');
            List<String> hit = domPattern(inline.toString());
            if (hit != null) out.add(domFinding(page.url(), null, hit));

            for (URI script : page.page().getScripts()) {
                if (!UrlUtils.sameDomain(script, context.getTargetUrl()) || !seenScripts.add(script)) continue;
                String js = fetchScript(context.getFetcher(), script);
                List<String> h = domPattern(js);
                if (h != null) out.add(domFinding(page.url(), script, h));
            }
        }
    }

    private String fetchScript(IFetcher fetcher, URI script) {
        try {
            FetchResult r = fetcher.get(script);
            String ct = r.getContentType() == null ? "" : r.getContentType().toLowerCase(Locale.ROOT);
            if (r.getStatusCode() != 200 || !(ct.contains("javascript") || ct.contains("ecmascript"))) return null;
            return r.getBody();
        } catch (FetchException e) {
            log.debug("xss: script {} not fetched: {}", script, e.summary());
            return null;
        }
    }

    /** 소스와 싱크가 모두 있으면 [source, sink], 아니면 null */
    static List<String> domPattern(String js) {
        if (js == null || js.isBlank()) return null;
        String source = null;
        for (String s : DOM_SOURCES) {
            if (js.contains(s)) { source = s; break; }
        }
        if (source == null) return null;
        for (String k : DOM_SINKS) {
            if (js.contains(k)) return List.of(source, k);
        }
        return null;
    }

    private Finding domFinding(URI page, URI script, List<String> hit) {
        Finding.Builder b = finding(script == null
                        ? "Potential DOM-based XSS"
                        : "Potential DOM-based XSS in external script", Severity.MEDIUM, page)
                .description("Script reads '" + hit.get(0) + "' and writes through '" + hit.get(1)
                        + "'; unsanitized flow between them allows DOM-based XSS.")
                .evidence("source", hit.get(0))
                .evidence("sink", hit.get(1))
                .cweId(CWE).owaspCategory(OWASP)
                .recommendation("Treat DOM sources as untrusted; prefer textContent over innerHTML and avoid eval-like sinks.");
        if (script != null) b.evidence("script", script.toString());
        return b.build();
    }

    private static String snippetAround(String body, String needle, int radius) {
        int i = body.indexOf(needle);
        if (i < 0) return "";
        int from = Math.max(0, i - radius);
        int to = Math.min(body.length(), i + needle.length() + radius);
        return body.substring(from, to).replaceAll("\\s+", " ").trim();
    }
}
