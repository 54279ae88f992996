package com.webtestool.core.module.builtin;

import com.webtestool.core.model.Category;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** 온페이지 SEO 점검(크롤된 HTML 페이지마다) */
public final class SeoModule extends AbstractTestModule {

    static final int MAX_TITLE_LENGTH = 60;

    public SeoModule() {
        super(BuiltinModules.SEO, Category.SEO, "On-page SEO checks");
    }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        for (HtmlPage hp : htmlPages(context)) {
            Document doc = hp.doc();
            URI url = hp.url();

            String title = doc.title().trim();
            if (title.isEmpty()) {
                out.add(seo("Missing Title Tag", Severity.HIGH, url, "Page is missing a title tag.",
                        "Add a unique, descriptive <title> to every page."));
            } else if (title.length() > MAX_TITLE_LENGTH) {
                out.add(finding("Title Too Long", Severity.LOW, url)
                        .description("Title is " + title.length() + " chars (recommended < " + MAX_TITLE_LENGTH + ").")
                        .evidence("title", title)
                        .recommendation("Keep titles under " + MAX_TITLE_LENGTH + " characters.")
                        .build());
            }

            if (meta(doc, "description") == null) {
                out.add(seo("Missing Meta Description", Severity.MEDIUM, url, "Page lacks a meta description.",
                        "Add <meta name=\"description\"> summarizing the page."));
            }
            if (meta(doc, "viewport") == null) {
                out.add(seo("Missing Viewport Meta Tag", Severity.MEDIUM, url, "Page is not optimized for mobile.",
                        "Add <meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">."));
            }

            Elements h1 = doc.select("h1");
            if (h1.isEmpty()) {
                out.add(seo("Missing H1 Tag", Severity.MEDIUM, url, "Page has no H1 heading.",
                        "Add exactly one H1 describing the page."));
            } else if (h1.size() > 1) {
                out.add(finding("Multiple H1 Tags", Severity.LOW, url)
                        .description("Page has " + h1.size() + " H1 tags (recommended: 1).")
                        .evidence("count", h1.size())
                        .recommendation("Use a single H1 per page.")
                        .build());
            }

            int noAlt = doc.select("img:not([alt])").size();
            if (noAlt > 0) {
                out.add(finding("Images Missing Alt Text", Severity.MEDIUM, url)
                        .description(noAlt + " image(s) missing alt attributes.")
                        .evidence("count", noAlt)
                        .recommendation("Describe every meaningful image with an alt attribute.")
                        .build());
            }

            if (doc.selectFirst("link[rel=canonical]") == null) {
                out.add(seo("Missing Canonical URL", Severity.LOW, url, "No canonical link tag found.",
                        "Add <link rel=\"canonical\"> to avoid duplicate content."));
            }
            if (doc.select("meta[property^=og:]").isEmpty()) {
                out.add(seo("Missing Open Graph Tags", Severity.LOW, url, "No Open Graph tags for social sharing.",
                        "Add og:title, og:description and og:image."));
            }
            if (doc.select("script[type=application/ld+json], [itemscope]").isEmpty()) {
                out.add(seo("No Structured Data", Severity.LOW, url, "No Schema.org structured data found.",
                        "Describe the page with JSON-LD structured data."));
            }

            String robots = meta(doc, "robots");
            String xRobots = hp.page().header("X-Robots-Tag");
            if (containsNoindex(robots) || containsNoindex(xRobots)) {
                out.add(finding("Page Set to No-Index", Severity.INFO, url)
                        .description("Page is blocked from search engine indexing.")
                        .evidence("robots", robots != null ? robots : xRobots)
                        .recommendation("Remove noindex if the page should appear in search results.")
                        .build());
            }
        }
    }

    private Finding seo(String title, Severity sev, URI url, String description, String recommendation) {
        return finding(title, sev, url).description(description).recommendation(recommendation).build();
    }

    private static String meta(Document doc, String name) {
        Element e = doc.selectFirst("meta[name=" + name + "]");
        if (e == null) return null;
        String c = e.attr("content").trim();
        return c.isEmpty() ? null : c;
    }

    private static boolean containsNoindex(String v) {
        return v != null && v.toLowerCase(Locale.ROOT).contains("noindex");
    }
}
