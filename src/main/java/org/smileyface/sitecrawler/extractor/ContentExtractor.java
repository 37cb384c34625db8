package org.smileyface.sitecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Extracts readable text from HTML by applying {@link ContentRule}s.
 *
 * <p>Priority: paragraphs of the first {@code <article>}; else all paragraphs of the document; else the
 * whole visible text. Elements matching any of the skip rules (scripts, styles, inline
 * {@code display:none}) and everything below them are never read.</p>
 */
public final class ContentExtractor {

    static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final ContentRule paragraphRule;
    private final ContentRule skipRule;

    public ContentExtractor() {
        this(
                List.of(new TagNameContentRule("p"), ContentRule.hasText()),
                List.of(
                        new TagNameContentRule("script", "style", "noscript", "template"),
                        new ElementStyleRule("display:none"),
                        new ElementStyleRule("visibility:hidden"),
                        ContentRule.hasAttribute("hidden")
                )
        );
    }

    /**
     * @param paragraphRules rules that must ALL match for an element to count as a paragraph
     * @param skipRules      rules where matching ANY one hides the element and its subtree
     */
    public ContentExtractor(Collection<? extends ContentRule> paragraphRules,
                            Collection<? extends ContentRule> skipRules) {
        this.paragraphRule = ContentRule.allOf(paragraphRules == null ? List.of() : paragraphRules);
        this.skipRule = ContentRule.anyOf(skipRules == null ? List.of() : skipRules);
    }

    /**
     * @param html the HTML content string (may be null/blank)
     * @return readable text, or an empty string when there is none
     */
    public String extractReadableText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return extractReadableText(Jsoup.parse(html));
    }

    public String extractReadableText(Document doc) {
        Element article = doc.selectFirst("article");
        if (article != null) {
            String text = String.join(PARAGRAPH_SEPARATOR, extractContent(article));
            if (!text.isBlank()) {
                return text.trim();
            }
        }
        Element root = doc.body() != null ? doc.body() : doc;
        List<String> paragraphs = extractContent(root);
        if (!paragraphs.isEmpty()) {
            return String.join(PARAGRAPH_SEPARATOR, paragraphs).trim();
        }
        return visibleText(root);
    }

    /**
     * Collects the text of every element under {@code root} that matches all paragraph rules, in
     * document order. A matched element's children are not traversed, to avoid nested duplicates.
     */
    public List<String> extractContent(Element root) {
        List<String> out = new ArrayList<>();
        if (root == null) {
            return out;
        }
        traverse(root, out);
        return out;
    }

    /**
     * All visible text nodes below {@code root}, one per line.
     */
    public String visibleText(Element root) {
        if (root == null) return "";
        List<String> lines = new ArrayList<>();
        collectText(root, lines);
        return String.join("\n", lines).trim();
    }

    private void traverse(Element el, List<String> out) {
        if (skipRule.isMatched(el)) {
            return;
        }
        if (paragraphRule.isMatched(el)) {
            String text = el.text();
            if (text != null && !text.isBlank()) {
                out.add(text.trim());
            }
            return; // skip children to avoid nested duplicates
        }
        for (Element child : el.children()) {
            traverse(child, out);
        }
    }

    private void collectText(Element el, List<String> lines) {
        if (skipRule.isMatched(el)) {
            return;
        }
        for (Node node : el.childNodes()) {
            if (node instanceof TextNode textNode) {
                String s = textNode.text().trim();
                if (!s.isEmpty()) lines.add(s);
            } else if (node instanceof Element child) {
                collectText(child, lines);
            }
        }
    }
}
