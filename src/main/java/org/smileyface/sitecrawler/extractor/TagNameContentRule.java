package org.smileyface.sitecrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Matches elements by tag name, case-insensitively, against one or more names.
 */
public final class TagNameContentRule implements ContentRule {

    private final Set<String> tagNames;

    /**
     * @param tagNames tag names such as {@code "p"} or {@code "script", "style"}; none may be blank
     */
    public TagNameContentRule(String... tagNames) {
        if (tagNames == null || tagNames.length == 0) {
            throw new IllegalArgumentException("at least one tag name is required");
        }
        this.tagNames = Stream.of(tagNames)
                .map(name -> {
                    if (name == null || name.isBlank()) {
                        throw new IllegalArgumentException("tag name must not be null/blank");
                    }
                    return name.trim().toLowerCase(Locale.ROOT);
                })
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> getTagNames() {
        return tagNames;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return tagNames.contains(element.normalName());
    }
}
