package com.webtestool.core.module.builtin;

import com.webtestool.core.model.Category;
import com.webtestool.core.model.Finding;
import com.webtestool.core.model.Severity;
import com.webtestool.core.model.TestContext;
import com.webtestool.core.module.AbstractTestModule;
import com.webtestool.core.module.BuiltinModules;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** WCAG 기본 항목 점검 */
public final class AccessibilityModule extends AbstractTestModule {

    private static final Set<String> UNLABELED_EXEMPT = Set.of("hidden", "submit", "button", "reset", "image");

    public AccessibilityModule() {
        super(BuiltinModules.ACCESSIBILITY, Category.ACCESSIBILITY, "Basic WCAG accessibility checks");
    }

    @Override
    protected void check(TestContext context, List<Finding> out) {
        for (HtmlPage hp : htmlPages(context)) {
            Document doc = hp.doc();
            URI url = hp.url();

            Element html = doc.selectFirst("html");
            if (html == null || html.attr("lang").isBlank()) {
                out.add(a11y("Missing Language Attribute", Severity.MEDIUM, url,
                        "The <html> element has no lang attribute.", "WCAG 3.1.1",
                        "Declare the page language, e.g. <html lang=\"en\">."));
            }

            int noAlt = doc.select("img:not([alt])").size();
            if (noAlt > 0) {
                out.add(counted("Image Missing Alt Text", Severity.HIGH, url,
                        noAlt + " image(s) have no alt attribute.", "WCAG 1.1.1", noAlt,
                        "Provide alt text, or alt=\"\" for decorative images."));
            }

            int unlabeled = 0;
            for (Element in : doc.select("input, select, textarea")) {
                if (UNLABELED_EXEMPT.contains(in.attr("type").toLowerCase(Locale.ROOT))) continue;
                if (!hasLabel(doc, in)) unlabeled++;
            }
            if (unlabeled > 0) {
                out.add(counted("Form Input Without Label", Severity.HIGH, url,
                        unlabeled + " form control(s) have no associated label.", "WCAG 1.3.1", unlabeled,
                        "Associate a <label for> or aria-label with every form control."));
            }

            int prev = 0;
            for (Element h : doc.select("h1, h2, h3, h4, h5, h6")) {
                int level = h.tagName().charAt(1) - '0';
                if (prev > 0 && level > prev + 1) {
                    out.add(finding("Skipped Heading Level", Severity.MEDIUM, url)
                            .description("Heading jumps from h" + prev + " to h" + level + ".")
                            .evidence("from", "h" + prev)
                            .evidence("to", "h" + level)
                            .evidence("wcag", "WCAG 1.3.1")
                            .recommendation("Keep heading levels sequential.")
                            .build());
                    break;
                }
                prev = level;
            }

            int emptyLinks = 0;
            for (Element a : doc.select("a[href]")) {
                boolean hasText = !a.text().isBlank() || !a.attr("aria-label").isBlank() || !a.attr("title").isBlank();
                boolean hasImgAlt = !a.select("img[alt]").stream().allMatch(i -> i.attr("alt").isBlank());
                if (!hasText && !hasImgAlt) emptyLinks++;
            }
            if (emptyLinks > 0) {
                out.add(counted("Empty Link Text", Severity.HIGH, url,
                        emptyLinks + " link(s) have no accessible name.", "WCAG 2.4.4", emptyLinks,
                        "Give every link descriptive text or an aria-label."));
            }

            if (doc.select("main, nav, header, footer, [role=main], [role=navigation], [role=banner], [role=contentinfo]").isEmpty()) {
                out.add(a11y("No ARIA Landmarks", Severity.MEDIUM, url,
                        "Page has no landmark regions.", "WCAG 1.3.1",
                        "Use <main>, <nav>, <header> and <footer> or the matching ARIA roles."));
            }
        }
    }

    private static boolean hasLabel(Document doc, Element in) {
        if (!in.attr("aria-label").isBlank() || !in.attr("aria-labelledby").isBlank() || !in.attr("title").isBlank()) {
            return true;
        }
        String id = in.id();
        if (!id.isEmpty()) {
            for (Element l : doc.select("label[for]")) {
                if (id.equals(l.attr("for"))) return true;
            }
        }
        return in.closest("label") != null;
    }

    private Finding a11y(String title, Severity sev, URI url, String description, String wcag, String recommendation) {
        return finding(title, sev, url).description(description)
                .evidence("wcag", wcag)
                .recommendation(recommendation).build();
    }

    private Finding counted(String title, Severity sev, URI url, String description, String wcag, int count,
                            String recommendation) {
        return finding(title, sev, url).description(description)
                .evidence("count", count)
                .evidence("wcag", wcag)
                .recommendation(recommendation).build();
    }
}
