package org.smileyface.sitecrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Matches elements by a declaration of their inline {@code style} attribute.
 *
 * <p>The rule is either {@code property:value} ({@code "display:none"}), matching when the element
 * declares that property with that value, or a bare {@code property} ({@code "font-weight"}),
 * matching when the property is declared at all. Property names and values are compared
 * case-insensitively with surrounding whitespace and {@code !important} ignored, so
 * {@code style="DISPLAY : none !important"} is hidden too.</p>
 */
public final class ElementStyleRule implements ContentRule {

    private final String property;
    private final String value;

    /**
     * @param declaration {@code property:value} or {@code property}; must not be blank
     */
    public ElementStyleRule(String declaration) {
        if (declaration == null || declaration.isBlank()) {
            throw new IllegalArgumentException("style declaration must not be null/blank");
        }
        int colon = declaration.indexOf(':');
        if (colon < 0) {
            this.property = normalize(declaration);
            this.value = null;
        } else {
            this.property = normalize(declaration.substring(0, colon));
            this.value = normalizeValue(declaration.substring(colon + 1));
        }
        if (property.isEmpty()) {
            throw new IllegalArgumentException("style declaration has no property: " + declaration);
        }
    }

    public String getProperty() {
        return property;
    }

    /**
     * @return the expected value, or null when any value matches
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        String style = element.attr("style");
        if (style.isBlank()) return false;
        Map<String, String> declarations = parse(style);
        if (!declarations.containsKey(property)) return false;
        return value == null || value.equals(declarations.get(property));
    }

    /**
     * Parses an inline style into property/value pairs; a later declaration of the same property wins.
     */
    static Map<String, String> parse(String style) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : style.split(";")) {
            int colon = part.indexOf(':');
            if (colon <= 0) continue;
            String prop = normalize(part.substring(0, colon));
            if (!prop.isEmpty()) {
                out.put(prop, normalizeValue(part.substring(colon + 1)));
            }
        }
        return out;
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeValue(String s) {
        String v = normalize(s).replace("!important", "");
        return v.replaceAll("\\s+", " ").trim();
    }
}
