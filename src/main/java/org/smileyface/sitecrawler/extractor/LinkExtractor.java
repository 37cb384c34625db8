package org.smileyface.sitecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecrawler.crawler.DomainScope;
import org.smileyface.sitecrawler.util.CrawlerUtils;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds in-scope crawl candidates among the anchors of an HTML page.
 *
 * <p>Each {@code a[href]} is resolved against the document base (the page URL or its
 * {@code <base href>}), canonicalized, checked against the {@link DomainScope} and finally against the
 * caller's candidate filter (already-visited URLs, robots pre-check). Results keep document order.</p>
 */
public class LinkExtractor {

    private static final Logger log = LoggerFactory.getLogger(LinkExtractor.class);

    private final DomainScope scope;

    public LinkExtractor(DomainScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public Set<String> extractLinks(String html, String baseUrl, Predicate<String> candidateFilter) {
        if (html == null || html.isBlank()) {
            return new LinkedHashSet<>();
        }
        return extractLinks(Jsoup.parse(html, baseUrl), candidateFilter);
    }

    /**
     * @param doc             a document parsed with its base URI set
     * @param candidateFilter extra acceptance test applied to canonical, in-scope URLs (may be null)
     * @return canonical URLs in document order, without duplicates
     */
    public Set<String> extractLinks(Document doc, Predicate<String> candidateFilter) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href");
            String canonical = CrawlerUtils.canonicalize(abs);
            if (canonical == null) continue;
            if (!scope.isInScope(canonical)) continue;
            if (out.contains(canonical)) continue;
            if (candidateFilter != null && !candidateFilter.test(canonical)) {
                log.debug("Link rejected by candidate filter: {}", canonical);
                continue;
            }
            out.add(canonical);
        }
        return out;
    }
}
