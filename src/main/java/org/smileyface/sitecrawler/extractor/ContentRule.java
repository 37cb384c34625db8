package org.smileyface.sitecrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.Collection;
import java.util.List;

/**
 * Element predicate used by {@link ContentExtractor}, both to recognize readable paragraphs and to
 * hide subtrees (scripts, hidden blocks) from extraction.
 */
@FunctionalInterface
public interface ContentRule {

    /**
     * @param element a Jsoup element from the parsed page, may be null
     * @return true if matched
     */
    boolean isMatched(Element element);

    /**
     * Matches when every rule matches. An empty collection matches nothing.
     */
    static ContentRule allOf(Collection<? extends ContentRule> rules) {
        List<ContentRule> copy = List.copyOf(rules);
        if (copy.isEmpty()) return element -> false;
        return element -> {
            for (ContentRule r : copy) {
                if (!r.isMatched(element)) return false;
            }
            return true;
        };
    }

    /**
     * Matches when at least one rule matches. An empty collection matches nothing.
     */
    static ContentRule anyOf(Collection<? extends ContentRule> rules) {
        List<ContentRule> copy = List.copyOf(rules);
        return element -> {
            for (ContentRule r : copy) {
                if (r.isMatched(element)) return true;
            }
            return false;
        };
    }

    /**
     * Elements whose text is not blank.
     */
    static ContentRule hasText() {
        return element -> element != null && !element.text().isBlank();
    }

    /**
     * Elements carrying the attribute, whatever its value ({@code <p hidden>}).
     */
    static ContentRule hasAttribute(String name) {
        return element -> element != null && element.hasAttr(name);
    }
}
