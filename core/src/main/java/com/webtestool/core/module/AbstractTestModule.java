package com.webtestool.core.module;

import com.webtestool.core.api.ITestModule;
import com.webtestool.core.error.ModuleException;
import com.webtestool.core.model.Category;
import com.webtestool.core.model.CrawledPage;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.ModuleResult;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 내장 모듈 공통 뼈대.
 * - run(): 시간 측정 + 발견 중복 제거(identity 기준, 첫 발견 유지) + PASSED/FAILED 결정
 * - 하위 클래스는 check() 에서 발견만 모은다
 */
public abstract class AbstractTestModule implements ITestModule {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final Category category;
    private final String description;

    protected AbstractTestModule(String name, Category category, String description) {
        this.name = name;
        this.category = category;
        this.description = description;
    }

    @Override public final String name() { return name; }
    @Override public final Category category() { return category; }
    @Override public String description() { return description; }

    @Override
    public final ModuleResult run(TestContext context) throws ModuleException {
        Instant start = Instant.now();
        List<Finding> raw = new ArrayList<>();
        check(context, raw);

        Map<String, Finding> unique = new LinkedHashMap<>();
        for (Finding f : raw) unique.putIfAbsent(f.identity(), f);
        List<Finding> findings = new ArrayList<>(unique.values());

        Instant end = Instant.now();
        log.debug("{}: {} finding(s) in {}ms", name, findings.size(), end.toEpochMilli() - start.toEpochMilli());
        return ModuleResult.completed(name, category, findings, start, end);
    }

    protected abstract void check(TestContext context, List<Finding> out) throws ModuleException;

    /** module 이 채워진 빌더 */
    protected Finding.Builder finding(String title, Severity severity, URI url) {
        return Finding.builder().module(name).title(title).severity(severity).url(url);
    }

    /** 파싱된 HTML 페이지 */
    protected record HtmlPage(CrawledPage page, Document doc) {
        public URI url() { return page.getUrl(); }
    }

    /** 실패하지 않은 HTML 페이지만 jsoup 으로 파싱. 본문을 다시 읽지 못한 페이지는 건너뛴다. */
    protected List<HtmlPage> htmlPages(TestContext context) {
        List<HtmlPage> out = new ArrayList<>();
        for (CrawledPage p : context.fetchedPages()) {
            if (!p.isHtml()) continue;
            String html;
            try {
                html = p.getBody().text();
            } catch (IllegalStateException e) {
                log.warn("{}: skip {} ({})", name, p.getUrl(), e.getMessage());
                continue;
            }
            out.add(new HtmlPage(p, Jsoup.parse(html, p.getUrl().toString())));
        }
        return out;
    }

    // ---------- settings ----------

    protected static long longSetting(Map<String, Object> s, String key, long def) {
        Object v = s.get(key);
        if (v == null) return def;
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("setting '" + key + "' must be a number: " + v, e);
        }
    }

    protected static Long optionalLong(Map<String, Object> s, String key) {
        return s.containsKey(key) && s.get(key) != null ? longSetting(s, key, 0) : null;
    }

    protected static List<String> stringList(Map<String, Object> s, String key, List<String> def) {
        Object v = s.get(key);
        if (v == null) return def;
        if (v instanceof List<?> l) {
            List<String> out = new ArrayList<>();
            for (Object o : l) if (o != null && !o.toString().isBlank()) out.add(o.toString());
            return out;
        }
        return List.of(v.toString());
    }
}
