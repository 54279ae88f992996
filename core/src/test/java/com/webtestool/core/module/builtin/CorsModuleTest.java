package com.webtestool.core.module.builtin;

import com.webtestool.core.api.IFetcher;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.http.FetchRequest;
import com.webtestool.core.model.ApiEndpoint;
import com.webtestool.core.model.FetchResult;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.ScanConfig;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.model.TestStatus;
import com.webtestool.core.testutil.Pages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CorsModuleTest {

    private static final String BASE = "http://api.shop.test/";

    /** 요청 → 응답 헤더 */
    private static final class CorsFetcher implements IFetcher {
        final List<FetchRequest> requests = Collections.synchronizedList(new ArrayList<>());
        private final Function<FetchRequest, Map<String, List<String>>> headers;

        CorsFetcher(Function<FetchRequest, Map<String, List<String>>> headers) { this.headers = headers; }

        @Override
        public FetchResult fetch(FetchRequest req) {
            requests.add(req);
            return FetchResult.builder().url(req.getUrl()).statusCode(200)
                    .headers(headers.apply(req)).body("{}").build();
        }
    }

    private static Map<String, List<String>> acao(String origin, String credentials) {
        Map<String, List<String>> h = new LinkedHashMap<>();
        if (origin != null) h.put("Access-Control-Allow-Origin", List.of(origin));
        if (credentials != null) h.put("Access-Control-Allow-Credentials", List.of(credentials));
        return h;
    }

    private static CorsModule init(ScanConfig cfg) throws ModuleException {
        CorsModule m = new CorsModule();
        m.initialize(cfg);
        return m;
    }

    private static ScanConfig cfg() {
        return ScanConfig.defaults().setTarget(BASE);
    }

    @Test
    @DisplayName("Origin 반사 + credentials → HIGH")
    void reflected_origin_with_credentials_is_high() throws Exception {
        CorsFetcher fetcher = new CorsFetcher(req -> acao(req.getHeaders().get("Origin"), "true"));

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher));

        assertEquals(TestStatus.FAILED, r.getStatus());
        assertEquals(1, r.getFindings().size());
        Finding f = r.getFindings().get(0);
        assertEquals("CORS reflects arbitrary origin with credentials", f.getTitle());
        assertEquals(Severity.HIGH, f.getSeverity());
        assertEquals(URI.create(BASE), f.getUrl());
        assertEquals("https://webtestool.example", f.getEvidence().get("origin"));
        assertEquals("CWE-942", f.getCweId());
    }

    @Test
    void wildcard_with_credentials_on_preflight_is_medium() throws Exception {
        CorsFetcher fetcher = new CorsFetcher(req ->
                "OPTIONS".equals(req.getMethod()) ? acao("*", "true") : Map.of());

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher));

        assertEquals(1, r.getFindings().size());
        Finding f = r.getFindings().get(0);
        assertEquals(Severity.MEDIUM, f.getSeverity());
        assertEquals("CORS wildcard origin with credentials", f.getTitle());
        assertEquals("OPTIONS", f.getEvidence().get("method"));
    }

    @Test
    void plain_wildcard_is_low() throws Exception {
        CorsFetcher fetcher = new CorsFetcher(req -> acao("*", null));

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher));

        assertEquals(1, r.getFindings().size());
        assertEquals(Severity.LOW, r.getFindings().get(0).getSeverity());
    }

    @Test
    void fixed_trusted_origin_passes() throws Exception {
        CorsFetcher fetcher = new CorsFetcher(req -> acao("https://app.shop.test", "true"));

        ModuleResult r = init(cfg()).run(Pages.context(cfg(), fetcher));

        assertEquals(TestStatus.PASSED, r.getStatus());
    }

    @Test
    void requests_carry_origin_and_preflight_headers() throws Exception {
        CorsFetcher fetcher = new CorsFetcher(req -> Map.of());

        init(cfg()).run(Pages.context(cfg(), fetcher));

        // origin 2개 × (GET, OPTIONS)
        assertThat(fetcher.requests).extracting(req -> req.getMethod() + " " + req.getHeaders().get("Origin"))
                .containsExactly("GET https://webtestool.example", "OPTIONS https://webtestool.example",
                        "GET null", "OPTIONS null");
        FetchRequest preflight = fetcher.requests.get(1);
        assertEquals("GET", preflight.getHeaders().get("Access-Control-Request-Method"));
        assertThat(fetcher.requests).allSatisfy(req -> assertTrue(req.isBypassCache()));
    }

    @Test
    void same_domain_endpoints_are_checked_without_query() throws Exception {
        ScanConfig cfg = cfg();
        cfg.getModules().setting("cors", "origins", List.of("https://evil.test"));
        TestContext ctx = TestContext.builder()
                .targetUrl(URI.create(BASE)).config(cfg).fetcher(Pages.NO_NETWORK)
                .pages(List.of())
                .endpoints(List.of(
                        new ApiEndpoint("GET", URI.create(BASE + "v1/users?page=2"), null,
                                List.of("page"), URI.create(BASE), ApiEndpoint.FROM_JAVASCRIPT),
                        new ApiEndpoint("GET", URI.create(BASE + "v1/users?page=3"), null,
                                List.of("page"), URI.create(BASE), ApiEndpoint.FROM_JAVASCRIPT),
                        new ApiEndpoint("GET", URI.create("http://cdn.other.test/data"), null,
                                List.of(), URI.create(BASE), ApiEndpoint.FROM_JAVASCRIPT)))
                .build();

        assertEquals(List.of(URI.create(BASE), URI.create(BASE + "v1/users")), init(cfg).urls(ctx));
    }

    @Test
    void empty_origin_list_is_rejected() {
        ScanConfig cfg = cfg();
        cfg.getModules().setting("cors", "origins", List.of());
        assertThrows(ModuleException.class, () -> init(cfg));
    }
}
