package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestStatus;
import com.webtestool.core.service.ScanComponents;
import com.webtestool.core.testutil.LocalSite;
import com.webtestool.core.testutil.Pages;
import com.webtestool.core.util.ProgressListener;
import com.webtestool.core.util.UrlParamUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OpenRedirectModuleTest {

    private static final String BASE = "http://shop.test/";

    /** (method, 요청 URL) → Location. null 이면 200. */
    private static final class RedirectingFetcher implements IFetcher {
        final List<FetchRequest> requests = Collections.synchronizedList(new ArrayList<>());
        private final BiFunction<String, URI, String> location;

        RedirectingFetcher(BiFunction<String, URI, String> location) { this.location = location; }

        @Override
        public FetchResult fetch(FetchRequest req) {
            requests.add(req);
            String loc = location.apply(req.getMethod(), req.getUrl());
            FetchResult.Builder b = FetchResult.builder().url(req.getUrl()).contentType("text/html").body("");
            if (loc == null) return b.statusCode(200).build();
            return b.statusCode(302).headers(Map.of("Location", List.of(loc))).build();
        }
    }

    private static OpenRedirectModule init(ScanConfig cfg) throws Exception {
        OpenRedirectModule m = new OpenRedirectModule();
        m.initialize(cfg);
        return m;
    }

    private static ScanConfig cfg() {
        return ScanConfig.defaults().setTarget(BASE);
    }

    @Test
    @DisplayName("next 값을 그대로 Location 으로 쓰면 보고")
    void parameter_echoed_into_location_is_reported() throws Exception {
        RedirectingFetcher fetcher = new RedirectingFetcher(
                (m, u) -> UrlParamUtil.parseQuery(u).getOrDefault("next", "/"));
        var page = Pages.html(BASE + "login?next=/home&lang=en", "<html><body>login</body></html>");

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher, page));

        assertEquals(TestStatus.FAILED, r.getStatus());
        assertEquals(1, r.getFindings().size());
        Finding f = r.getFindings().get(0);
        assertEquals("Open Redirect", f.getTitle());
        assertEquals(Severity.MEDIUM, f.getSeverity());
        assertEquals(URI.create(BASE + "login?next=/home&lang=en"), f.getUrl());
        assertEquals("next", f.getEvidence().get("parameter"));
        assertEquals(OpenRedirectModule.EXTERNAL, f.getEvidence().get("location"));
        assertEquals("302", f.getEvidence().get("status"));
        assertThat(f.getEvidence().get("request")).startsWith("GET ");
        assertEquals("CWE-601", f.getCweId());

        assertThat(fetcher.requests).allSatisfy(req -> {
            assertEquals(Boolean.FALSE, req.getFollowRedirects());
            assertTrue(req.isBypassCache());
        });
        assertEquals(1, fetcher.requests.size());
    }

    @Test
    void same_host_or_relative_location_passes() throws Exception {
        RedirectingFetcher fetcher = new RedirectingFetcher((m, u) -> "/home");
        var page = Pages.html(BASE + "go?url=/x", "<html></html>");

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher, page));

        assertEquals(TestStatus.PASSED, r.getStatus());
        assertEquals(OpenRedirectModule.payloads().size(), fetcher.requests.size());
    }

    @Test
    void head_is_tried_when_get_does_not_redirect() throws Exception {
        RedirectingFetcher fetcher = new RedirectingFetcher((m, u) ->
                "HEAD".equals(m) ? UrlParamUtil.parseQuery(u).get("returnUrl") : null);
        var page = Pages.html(BASE + "cart", "<html><body><a href=\"/checkout?returnUrl=/cart\">pay</a></body></html>");

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher, page));

        assertEquals(1, r.getFindings().size());
        Finding f = r.getFindings().get(0);
        assertEquals(URI.create(BASE + "checkout?returnUrl=/cart"), f.getUrl());
        assertThat(f.getEvidence().get("request")).startsWith("HEAD ");
        assertEquals(List.of("GET", "HEAD"), fetcher.requests.stream().map(FetchRequest::getMethod).toList());
    }

    @Test
    void scheme_relative_location_counts_as_external() throws Exception {
        RedirectingFetcher fetcher = new RedirectingFetcher((m, u) -> {
            String to = UrlParamUtil.parseQuery(u).getOrDefault("to", "");
            return to.startsWith("//") ? to : "/";
        });
        var page = Pages.html(BASE + "out?to=/", "<html></html>");

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher, page));

        assertEquals(1, r.getFindings().size());
        assertEquals("//webtestool.example/", r.getFindings().get(0).getEvidence().get("location"));
    }

    @Test
    void without_candidates_default_params_are_tried_on_target() throws Exception {
        var page = Pages.html(BASE + "about", "<html><body><a href=\"/list?page=2\">2</a></body></html>");
        var ctx = Pages.context(cfg(), Pages.NO_NETWORK, page);

        List<OpenRedirectModule.Candidate> c = init(cfg()).candidates(ctx);

        assertThat(c).extracting(OpenRedirectModule.Candidate::param).containsExactly("next", "redirect", "url");
        assertThat(c).extracting(OpenRedirectModule.Candidate::url).containsOnly(URI.create(BASE));
    }

    @Test
    void redirect_like_names() {
        assertTrue(OpenRedirectModule.looksLikeRedirect("returnUrl"));
        assertTrue(OpenRedirectModule.looksLikeRedirect("REDIRECT_URI"));
        assertTrue(OpenRedirectModule.looksLikeRedirect("to"));
        assertFalse(OpenRedirectModule.looksLikeRedirect("token"));
        assertFalse(OpenRedirectModule.looksLikeRedirect("q"));
    }

    @Test
    void external_location_detection() {
        assertTrue(OpenRedirectModule.isExternal("https://evil.test/x", "shop.test"));
        assertTrue(OpenRedirectModule.isExternal("//evil.test/x", "shop.test"));
        assertTrue(OpenRedirectModule.isExternal("/\\evil.test/x", "shop.test"));
        assertFalse(OpenRedirectModule.isExternal("https://SHOP.test/a", "shop.test"));
        assertFalse(OpenRedirectModule.isExternal("/local/path", "shop.test"));
        assertFalse(OpenRedirectModule.isExternal("javascript:alert(1)", "shop.test"));
        assertFalse(OpenRedirectModule.isExternal("http://[bad", "shop.test"));
    }

    @Test
    @DisplayName("실제 HTTP: 리다이렉트를 따라가지 않고 3xx 를 그대로 본다")
    void real_transport_does_not_follow_the_redirect() throws Exception {
        try (LocalSite site = new LocalSite()) {
            site.handle("/go", ex -> {
                String next = UrlParamUtil.parseQuery(ex.getRequestURI()).getOrDefault("next", "/");
                LocalSite.respond(ex, 302, null, "", Map.of("Location", List.of(next)));
            });

            ScanConfig cfg = ScanConfig.defaults().setTarget(site.url("/"));
            cfg.validate();
            IFetcher fetcher = ScanComponents.standard()
                    .create(cfg, ProgressListener.NONE, new AtomicBoolean()).fetcher();
            var page = Pages.html(site.url("/go?next=/"), "<html></html>");

            ModuleResult r = init(cfg).run(Pages.context(cfg, fetcher, page));

            assertEquals(1, r.getFindings().size(), () -> r.getFindings().toString());
            assertEquals(OpenRedirectModule.EXTERNAL, r.getFindings().get(0).getEvidence().get("location"));
            assertEquals(1, site.hits("/go"));
        }
    }
}
