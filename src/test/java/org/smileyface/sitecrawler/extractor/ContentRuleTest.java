package org.smileyface.sitecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContentRuleTest {

    private final Document doc = Jsoup.parse("""
            <html><body>
              <p id='full'>Some text</p>
              <p id='blank'>   </p>
              <div id='hidden' hidden>secret</div>
            </body></html>
            """);

    private Element byId(String id) {
        return doc.getElementById(id);
    }

    @Test
    void hasText_ignoresWhitespaceOnlyElements() {
        ContentRule rule = ContentRule.hasText();

        assertThat(rule.isMatched(byId("full"))).isTrue();
        assertThat(rule.isMatched(byId("blank"))).isFalse();
        assertThat(rule.isMatched(null)).isFalse();
    }

    @Test
    void hasAttribute_matchesValuelessAttribute() {
        ContentRule rule = ContentRule.hasAttribute("hidden");

        assertThat(rule.isMatched(byId("hidden"))).isTrue();
        assertThat(rule.isMatched(byId("full"))).isFalse();
    }

    @Test
    void allOf_requiresEveryRule_andEmptyMatchesNothing() {
        ContentRule paragraphWithText = ContentRule.allOf(List.of(new TagNameContentRule("p"), ContentRule.hasText()));

        assertThat(paragraphWithText.isMatched(byId("full"))).isTrue();
        assertThat(paragraphWithText.isMatched(byId("blank"))).isFalse();
        assertThat(ContentRule.allOf(List.of()).isMatched(byId("full"))).isFalse();
    }

    @Test
    void anyOf_requiresOneRule_andEmptyMatchesNothing() {
        ContentRule rule = ContentRule.anyOf(List.of(new TagNameContentRule("div"), ContentRule.hasText()));

        assertThat(rule.isMatched(byId("hidden"))).isTrue();
        assertThat(rule.isMatched(byId("full"))).isTrue();
        assertThat(rule.isMatched(byId("blank"))).isFalse();
        assertThat(ContentRule.anyOf(List.of()).isMatched(byId("full"))).isFalse();
    }

    @Test
    void customParagraphRules_dropShortParagraphs() {
        Document page = Jsoup.parse("""
                <html><body>
                  <p>ok</p>
                  <p>this paragraph is long enough</p>
                </body></html>
                """);
        ContentRule longEnough = element -> element.text().trim().length() >= 10;

        ContentExtractor extractor = new ContentExtractor(List.of(new TagNameContentRule("p"), longEnough), List.of());

        assertThat(extractor.extractContent(page.body())).containsExactly("this paragraph is long enough");
    }
}
